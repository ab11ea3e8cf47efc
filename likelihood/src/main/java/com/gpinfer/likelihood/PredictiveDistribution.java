package com.gpinfer.likelihood;

import java.util.Arrays;

public class PredictiveDistribution {
    private final double[] mean;
    private final double[] variance;
    private final double[] observedProbability;

    public PredictiveDistribution(double[] mean, double[] variance, double[] observedProbability) {
        this.mean = mean.clone();
        this.variance = variance.clone();
        this.observedProbability = observedProbability != null ? observedProbability.clone() : null;
    }

    public PredictiveDistribution(double[] mean, double[] variance) {
        this(mean, variance, null);
    }

    /**
     * Expected value of the {-1,+1} label at each test point.
     */
    public double[] getMean() {
        return mean.clone();
    }

    public double[] getVariance() {
        return variance.clone();
    }

    public boolean hasObservedProbability() {
        return observedProbability != null;
    }

    /**
     * Predictive probability of the supplied labels.
     *
     * @throws IllegalStateException if no labels were supplied to the prediction
     */
    public double[] getObservedProbability() {
        if (observedProbability == null) {
            throw new IllegalStateException("Predictive probabilities require labels");
        }
        return observedProbability.clone();
    }

    public int size() {
        return mean.length;
    }

    @Override
    public String toString() {
        return "PredictiveDistribution{" +
                "size=" + mean.length +
                ", mean=" + Arrays.toString(mean) +
                ", variance=" + Arrays.toString(variance) +
                ", observedProbability="
                + (observedProbability != null ? Arrays.toString(observedProbability) : "N/A") +
                '}';
    }
}
