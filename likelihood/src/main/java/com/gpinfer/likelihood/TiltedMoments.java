package com.gpinfer.likelihood;

public class TiltedMoments {
    private final double zerothMoment;
    private final double logZerothMoment;
    private final double mean;
    private final double variance;

    public TiltedMoments(double zerothMoment, double logZerothMoment, double mean, double variance) {
        this.zerothMoment = zerothMoment;
        this.logZerothMoment = logZerothMoment;
        this.mean = mean;
        this.variance = variance;
    }

    // Normaliser of the tilted distribution (m0).
    public double getZerothMoment() {
        return zerothMoment;
    }

    // log m0, finite even where m0 underflows.
    public double getLogZerothMoment() {
        return logZerothMoment;
    }

    // Tilted mean (m1).
    public double getMean() {
        return mean;
    }

    // Tilted variance (m2).
    public double getVariance() {
        return variance;
    }

    @Override
    public String toString() {
        return "TiltedMoments{" +
                "m0=" + zerothMoment +
                ", logM0=" + logZerothMoment +
                ", mean=" + mean +
                ", variance=" + variance +
                '}';
    }
}
