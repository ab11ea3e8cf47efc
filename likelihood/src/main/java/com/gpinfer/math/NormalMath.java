package com.gpinfer.math;

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.util.FastMath;

/**
 * Standard normal density, distribution and related ratios, evaluated so that
 * the lower tail neither underflows to zero nor produces 0/0.
 * <p>
 * Below the tail threshold the distribution function is replaced by the
 * asymptotic expansion (26.2.12) in Abramowitz &amp; Stegun:
 * {@code Phi(x) = -phi(x) / x * S(x)} with
 * {@code S(x) = 1 - 1/x^2 + 1*3/x^4 - 1*3*5/x^6 + ...}, truncated at its
 * smallest term.
 * <p>
 * The derivative quantities of the ratio (offset, slope, curvature) cancel
 * leading terms, so they switch to the series at
 * {@link #DEFAULT_TAIL_THRESHOLD} even when a lower threshold is configured.
 */
public final class NormalMath {

    public static final double DEFAULT_TAIL_THRESHOLD = -10.0;

    /** Thresholds outside this range either lose accuracy in S(x) or let Phi underflow first. */
    public static final double MIN_TAIL_THRESHOLD = -37.0;
    public static final double MAX_TAIL_THRESHOLD = -8.0;

    private static final double SQRT_TWO = FastMath.sqrt(2.0);
    private static final double ONE_OVER_SQRT_TWO_PI = 1.0 / FastMath.sqrt(2.0 * FastMath.PI);
    private static final double LOG_SQRT_TWO_PI = 0.5 * FastMath.log(2.0 * FastMath.PI);
    private static final double EPSILON = Math.ulp(1.0);
    // below this every term of S(x) - 1 after the first is negligible
    private static final double SERIES_CUTOFF = -1.0 / FastMath.sqrt(EPSILON);

    private NormalMath() {
    }

    public static double pdf(double x) {
        return ONE_OVER_SQRT_TWO_PI * FastMath.exp(-0.5 * x * x);
    }

    public static double logPdf(double x) {
        return -0.5 * x * x - LOG_SQRT_TWO_PI;
    }

    public static double cdf(double x) {
        return cdf(x, DEFAULT_TAIL_THRESHOLD);
    }

    public static double cdf(double x, double tailThreshold) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (x == Double.NEGATIVE_INFINITY) {
            return 0.0;
        }
        if (x <= tailThreshold) {
            return -pdf(x) * tailSeries(x) / x;
        }
        return 0.5 * Erf.erfc(-x / SQRT_TWO);
    }

    public static double logCdf(double x) {
        return logCdf(x, DEFAULT_TAIL_THRESHOLD);
    }

    /**
     * log Phi(x). Finite for every finite x.
     */
    public static double logCdf(double x, double tailThreshold) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (x > 0.0) {
            return FastMath.log1p(-cdf(-x, tailThreshold));
        }
        if (x > tailThreshold) {
            return FastMath.log(cdf(x, tailThreshold));
        }
        if (x == Double.NEGATIVE_INFINITY) {
            return Double.NEGATIVE_INFINITY;
        }
        return logPdf(x) - FastMath.log(-x) + FastMath.log(tailSeries(x));
    }

    public static double inverseMillsRatio(double x) {
        return inverseMillsRatio(x, DEFAULT_TAIL_THRESHOLD);
    }

    /**
     * phi(x) / Phi(x). Tends to {@code -x} as x goes to minus infinity and to 0
     * as x goes to plus infinity.
     */
    public static double inverseMillsRatio(double x, double tailThreshold) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (x > tailThreshold) {
            return pdf(x) / cdf(x, tailThreshold);
        }
        return -x / tailSeries(x);
    }

    public static double inverseMillsRatioOffset(double x) {
        return inverseMillsRatioOffset(x, DEFAULT_TAIL_THRESHOLD);
    }

    /**
     * phi(x) / Phi(x) + x, evaluated without the cancellation between the two
     * terms that occurs in the lower tail.
     */
    public static double inverseMillsRatioOffset(double x, double tailThreshold) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        double threshold = derivativeThreshold(tailThreshold);
        if (x > threshold) {
            return pdf(x) / cdf(x, threshold) + x;
        }
        if (x < SERIES_CUTOFF) {
            // x * T / (1 + T) with T = -1/x^2, without squaring x
            return -1.0 / x;
        }
        double t = tailCorrection(x);
        return x * t / (1.0 + t);
    }

    public static double inverseMillsRatioSlope(double x) {
        return inverseMillsRatioSlope(x, DEFAULT_TAIL_THRESHOLD);
    }

    /**
     * First derivative of phi(x) / Phi(x), {@code -r (r + x)}. Tends to -1 as
     * x goes to minus infinity.
     */
    public static double inverseMillsRatioSlope(double x, double tailThreshold) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        double r = inverseMillsRatio(x, derivativeThreshold(tailThreshold));
        if (r == 0.0) {
            return 0.0;
        }
        return -r * inverseMillsRatioOffset(x, tailThreshold);
    }

    public static double inverseMillsRatioCurvature(double x) {
        return inverseMillsRatioCurvature(x, DEFAULT_TAIL_THRESHOLD);
    }

    /**
     * Second derivative of phi(x) / Phi(x). With r the ratio and d = r + x it
     * equals {@code r (d (r + d) - 1)}; below the series cutoff the leading
     * asymptotic term {@code -2 / x^3} is returned instead.
     */
    public static double inverseMillsRatioCurvature(double x, double tailThreshold) {
        if (Double.isNaN(x)) {
            return Double.NaN;
        }
        if (x < SERIES_CUTOFF) {
            return -2.0 / (x * x * x);
        }
        double r = inverseMillsRatio(x, derivativeThreshold(tailThreshold));
        if (r == 0.0) {
            // upper tail, where d = x would overflow d * (r + d)
            return 0.0;
        }
        double d = inverseMillsRatioOffset(x, tailThreshold);
        return r * (d * (r + d) - 1.0);
    }

    private static double derivativeThreshold(double tailThreshold) {
        return Math.max(tailThreshold, DEFAULT_TAIL_THRESHOLD);
    }

    static double tailSeries(double x) {
        return 1.0 + tailCorrection(x);
    }

    /**
     * S(x) - 1 of the lower-tail expansion. Terms are summed in pairs until
     * they stop shrinking or drop below machine precision relative to the
     * correction itself, so that {@link #inverseMillsRatioOffset} keeps its
     * relative accuracy.
     */
    static double tailCorrection(double x) {
        if (x < SERIES_CUTOFF) {
            return -1.0 / (x * x);
        }
        double correction = 0.0;
        double xsq = x * x;
        double i = 1.0;
        double g = 1.0;
        double a = Double.MAX_VALUE;
        double lastA;
        do {
            lastA = a;
            double u = (4.0 * i - 3.0) / xsq;
            double v = u * ((4.0 * i - 1.0) / xsq);
            a = g * (u - v);
            correction -= a;
            g *= v;
            ++i;
            a = Math.abs(a);
        } while (lastA > a && a >= Math.abs(correction * EPSILON));
        return correction;
    }

    public static void checkTailThreshold(double tailThreshold) {
        if (!(tailThreshold >= MIN_TAIL_THRESHOLD && tailThreshold <= MAX_TAIL_THRESHOLD)) {
            throw new IllegalArgumentException("Tail threshold must lie in [" + MIN_TAIL_THRESHOLD + ", "
                    + MAX_TAIL_THRESHOLD + "], got " + tailThreshold);
        }
    }
}
