package com.gpinfer.likelihood;

import com.gpinfer.likelihood.record.LikelihoodRecord;

/**
 * Observation model consumed by GP posterior approximations (Laplace, EP).
 * Implementations are immutable and may be shared between threads.
 */
public interface Likelihood {

    /** The only derivative target currently supported. */
    String LATENT = "latent";

    // Identifier of the observation model, e.g. "probit".
    String getType();

    // Number of hyperparameters exposed to an optimizer.
    int getParameterCount();

    /**
     * Packs the hyperparameters into a vector of length
     * {@link #getParameterCount()}.
     */
    double[] pack();

    /**
     * Returns a likelihood with its hyperparameters taken from the first
     * {@link #getParameterCount()} entries of {@code w}.
     */
    Likelihood unpack(double[] w);

    /**
     * Sum of log p(y_i | f_i) over all observations.
     */
    double logLikelihood(double[] y, double[] f);

    /**
     * First derivative of the log likelihood with respect to {@code target}.
     */
    double[] gradient(double[] y, double[] f, String target);

    /**
     * Diagonal of the Hessian of the log likelihood. Off-diagonal entries are
     * zero since observations are conditionally independent given f.
     */
    double[] hessianDiagonal(double[] y, double[] f, String target);

    /**
     * Diagonal third derivatives of the log likelihood.
     */
    double[] thirdDerivativeDiagonal(double[] y, double[] f, String target);

    default double[] gradient(double[] y, double[] f) {
        return gradient(y, f, LATENT);
    }

    default double[] hessianDiagonal(double[] y, double[] f) {
        return hessianDiagonal(y, f, LATENT);
    }

    default double[] thirdDerivativeDiagonal(double[] y, double[] f) {
        return thirdDerivativeDiagonal(y, f, LATENT);
    }

    /**
     * Moments of the tilted distribution, cavity times the exact likelihood of
     * observation {@code index}.
     */
    TiltedMoments tiltedMoments(double[] y, int index, double cavityVariance, double cavityMean);

    /**
     * Predictive mean and variance of the label at each test point.
     */
    PredictiveDistribution predict(double[] ef, double[] varf);

    /**
     * As {@link #predict(double[], double[])}, additionally evaluating the
     * predictive probability of the labels {@code y}.
     */
    PredictiveDistribution predict(double[] ef, double[] varf, double[] y);

    /**
     * Stores the current hyperparameters at {@code index} of {@code record}.
     * A {@code null} record yields a freshly initialised one.
     */
    LikelihoodRecord recordAppend(LikelihoodRecord record, int index);
}
