package com.gpinfer.likelihood;

import com.gpinfer.likelihood.exception.LabelDomainException;
import com.gpinfer.likelihood.exception.ShapeMismatchException;
import com.gpinfer.likelihood.exception.UnsupportedDerivativeTargetException;
import com.gpinfer.likelihood.record.LikelihoodRecord;
import com.gpinfer.math.NormalMath;
import org.apache.commons.math3.util.FastMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Probit likelihood for binary classification with labels in {-1, +1}:
 *
 * <pre>
 *   p(y | f) = prod_i Phi(y_i * f_i)
 * </pre>
 *
 * There are no hyperparameters. Since phi(f) = phi(y * f) for y in {-1, +1},
 * all latent derivatives are written in terms of the inverse Mills ratio
 * r = phi(y * f) / Phi(y * f), which {@link NormalMath} keeps finite far into
 * the lower tail.
 */
public class ProbitLikelihood implements Likelihood {

    private static final Logger logger = LoggerFactory.getLogger(ProbitLikelihood.class);

    public static final String TYPE = "probit";

    private final boolean strictShapes;
    private final double tailThreshold;

    public ProbitLikelihood() {
        this(LikelihoodConfig.defaults());
    }

    public ProbitLikelihood(LikelihoodConfig config) {
        Objects.requireNonNull(config, "config");
        NormalMath.checkTailThreshold(config.tailThreshold);
        this.strictShapes = config.strictShapes;
        this.tailThreshold = config.tailThreshold;
        logger.debug("Probit likelihood created: strictShapes={}, tailThreshold={}", strictShapes, tailThreshold);
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public int getParameterCount() {
        return 0;
    }

    @Override
    public double[] pack() {
        return new double[0];
    }

    @Override
    public Likelihood unpack(double[] w) {
        Objects.requireNonNull(w, "w");
        return this;
    }

    @Override
    public double logLikelihood(double[] y, double[] f) {
        checkLabels(y);
        int n = alignedLength("y", y, "f", f);

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += NormalMath.logCdf(y[i] * f[i], tailThreshold);
        }
        return sum;
    }

    @Override
    public double[] gradient(double[] y, double[] f, String target) {
        checkLabels(y);
        checkTarget(target);
        int n = alignedLength("y", y, "f", f);

        double[] g = new double[n];
        for (int i = 0; i < n; i++) {
            g[i] = y[i] * millsRatio(y[i] * f[i]);
        }
        return g;
    }

    /**
     * {@code -r^2 - z r} with z = y * f, which is the derivative of r at z,
     * evaluated as {@code -r (r + z)}.
     */
    @Override
    public double[] hessianDiagonal(double[] y, double[] f, String target) {
        checkLabels(y);
        checkTarget(target);
        int n = alignedLength("y", y, "f", f);

        double[] g2 = new double[n];
        for (int i = 0; i < n; i++) {
            double z = y[i] * f[i];
            if (z <= tailThreshold && logger.isTraceEnabled()) {
                logger.trace("Asymptotic tail expansion used at y*f={}", z);
            }
            g2[i] = NormalMath.inverseMillsRatioSlope(z, tailThreshold);
        }
        return g2;
    }

    /**
     * {@code 2 y r^3 + 3 f r^2 - r (y - y f^2)}. With z = y * f this is
     * y times the second derivative of r at z, evaluated as
     * {@code y r (d (r + d) - 1)} with d = r + z.
     */
    @Override
    public double[] thirdDerivativeDiagonal(double[] y, double[] f, String target) {
        checkLabels(y);
        checkTarget(target);
        int n = alignedLength("y", y, "f", f);

        double[] g3 = new double[n];
        for (int i = 0; i < n; i++) {
            double z = y[i] * f[i];
            if (z <= tailThreshold && logger.isTraceEnabled()) {
                logger.trace("Asymptotic tail expansion used at y*f={}", z);
            }
            g3[i] = y[i] * NormalMath.inverseMillsRatioCurvature(z, tailThreshold);
        }
        return g3;
    }

    @Override
    public TiltedMoments tiltedMoments(double[] y, int index, double cavityVariance, double cavityMean) {
        checkLabels(y);
        Objects.checkIndex(index, y.length);
        if (!(cavityVariance >= 0.0) || Double.isInfinite(cavityVariance)) {
            throw new IllegalArgumentException("Cavity variance must be finite and non-negative, got " + cavityVariance);
        }
        if (Double.isNaN(cavityMean)) {
            throw new IllegalArgumentException("Cavity mean is NaN");
        }

        double yi = y[index];
        double scale2 = 1.0 + cavityVariance;
        double scale = FastMath.sqrt(scale2);
        double z = yi * cavityMean / scale;

        double m0 = NormalMath.cdf(z, tailThreshold);
        double logM0 = NormalMath.logCdf(z, tailThreshold);
        double r = millsRatio(z);

        double mean = cavityMean + yi * cavityVariance * r / scale;
        // sigma^2 - sigma^4 r (z + r) / (1 + sigma^2), with -r (z + r) the slope of r
        double variance = cavityVariance
                + cavityVariance * (cavityVariance / scale2) * NormalMath.inverseMillsRatioSlope(z, tailThreshold);

        if (logger.isTraceEnabled()) {
            logger.trace("Tilted moments for site {}: z={}, m0={}, mean={}, variance={}", index, z, m0, mean,
                    variance);
        }
        return new TiltedMoments(m0, logM0, mean, variance);
    }

    @Override
    public PredictiveDistribution predict(double[] ef, double[] varf) {
        return predictInternal(ef, varf, null);
    }

    @Override
    public PredictiveDistribution predict(double[] ef, double[] varf, double[] y) {
        Objects.requireNonNull(y, "y");
        checkLabels(y);
        return predictInternal(ef, varf, y);
    }

    private PredictiveDistribution predictInternal(double[] ef, double[] varf, double[] y) {
        int n = alignedLength("Ef", ef, "Varf", varf);
        if (y != null) {
            n = Math.min(n, alignedLength("Ef", ef, "y", y));
        }

        double[] ey = new double[n];
        double[] vary = new double[n];
        double[] py = y != null ? new double[n] : null;

        for (int i = 0; i < n; i++) {
            if (!(varf[i] >= 0.0)) {
                throw new IllegalArgumentException("Varf must be non-negative, got " + varf[i] + " at index " + i);
            }
            double scale = FastMath.sqrt(1.0 + varf[i]);
            double p = NormalMath.cdf(ef[i] / scale, tailThreshold);
            double q = NormalMath.cdf(-ef[i] / scale, tailThreshold);

            ey[i] = 2.0 * p - 1.0;
            // 1 - Ey^2 without cancellation when p is close to 0 or 1
            vary[i] = 4.0 * p * q;
            if (py != null) {
                py[i] = NormalMath.cdf(ef[i] * y[i] / scale, tailThreshold);
            }
        }
        if (py == null) {
            return new PredictiveDistribution(ey, vary);
        }
        return new PredictiveDistribution(ey, vary, py);
    }

    @Override
    public LikelihoodRecord recordAppend(LikelihoodRecord record, int index) {
        if (record == null) {
            logger.debug("Initialising new {} likelihood record", TYPE);
            return new LikelihoodRecord(TYPE);
        }
        if (!TYPE.equals(record.getType())) {
            throw new IllegalArgumentException(
                    "Cannot append " + TYPE + " parameters to a '" + record.getType() + "' record");
        }
        record.put(index, pack());
        return record;
    }

    public boolean isStrictShapes() {
        return strictShapes;
    }

    public double getTailThreshold() {
        return tailThreshold;
    }

    private double millsRatio(double z) {
        if (z <= tailThreshold && logger.isTraceEnabled()) {
            logger.trace("Asymptotic tail expansion used at y*f={}", z);
        }
        return NormalMath.inverseMillsRatio(z, tailThreshold);
    }

    private static void checkLabels(double[] y) {
        Objects.requireNonNull(y, "y");
        for (int i = 0; i < y.length; i++) {
            if (y[i] != 1.0 && y[i] != -1.0) {
                throw new LabelDomainException(TYPE, i, y[i]);
            }
        }
    }

    private static void checkTarget(String target) {
        if (!LATENT.equals(target)) {
            throw new UnsupportedDerivativeTargetException(TYPE, target);
        }
    }

    private int alignedLength(String firstName, double[] first, String secondName, double[] second) {
        Objects.requireNonNull(first, firstName);
        Objects.requireNonNull(second, secondName);
        if (first.length == second.length) {
            return first.length;
        }
        if (strictShapes) {
            throw new ShapeMismatchException(firstName, first.length, secondName, second.length);
        }
        int n = Math.min(first.length, second.length);
        logger.warn("{} has length {} but {} has length {}, using the first {} entries", firstName, first.length,
                secondName, second.length, n);
        return n;
    }
}
