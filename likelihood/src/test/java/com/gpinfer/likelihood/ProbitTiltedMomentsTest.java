package com.gpinfer.likelihood;

import com.gpinfer.likelihood.exception.LabelDomainException;
import com.gpinfer.math.NormalMath;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProbitTiltedMomentsTest {

    private final Likelihood likelihood = new ProbitLikelihood();

    @Test
    void testUnitCavityAtZero() {
        TiltedMoments m = likelihood.tiltedMoments(new double[] { 1 }, 0, 1.0, 0.0);

        assertEquals(0.5, m.getZerothMoment(), 1e-15);
        assertEquals(Math.log(0.5), m.getLogZerothMoment(), 1e-15);
        // shifted towards the observed label, variance contracted
        assertTrue(m.getMean() > 0.0);
        assertEquals(0.7978845608028654 / Math.sqrt(2.0), m.getMean(), 1e-12);
        assertTrue(m.getVariance() <= 1.0);
        assertEquals(1.0 - 2.0 / Math.PI / 2.0, m.getVariance(), 1e-12);
    }

    @Test
    void testNegativeLabelMirrorsPositive() {
        TiltedMoments pos = likelihood.tiltedMoments(new double[] { 1 }, 0, 0.7, 0.4);
        TiltedMoments neg = likelihood.tiltedMoments(new double[] { -1 }, 0, 0.7, -0.4);

        assertEquals(pos.getZerothMoment(), neg.getZerothMoment(), 0.0);
        assertEquals(pos.getMean(), -neg.getMean(), 1e-15);
        assertEquals(pos.getVariance(), neg.getVariance(), 0.0);
    }

    @Test
    void testZeroCavityVarianceIsDegenerate() {
        TiltedMoments m = likelihood.tiltedMoments(new double[] { 1 }, 0, 0.0, 1.0);

        assertEquals(0.8413447460685429, m.getZerothMoment(), 1e-12);
        assertEquals(1.0, m.getMean(), 0.0);
        assertEquals(0.0, m.getVariance(), 0.0);
    }

    @Test
    void testIndexSelectsObservation() {
        double[] y = { 1, -1, 1 };
        TiltedMoments m = likelihood.tiltedMoments(y, 1, 2.0, 0.5);
        TiltedMoments expected = likelihood.tiltedMoments(new double[] { -1 }, 0, 2.0, 0.5);

        assertEquals(expected.getZerothMoment(), m.getZerothMoment(), 0.0);
        assertEquals(expected.getMean(), m.getMean(), 0.0);
        assertEquals(expected.getVariance(), m.getVariance(), 0.0);
        assertTrue(m.getMean() < 0.5);
    }

    @Test
    void testMomentsMatchNumericalIntegration() {
        double y = -1.0;
        double s2 = 1.7;
        double mu = 0.9;
        TiltedMoments m = likelihood.tiltedMoments(new double[] { y }, 0, s2, mu);

        // trapezoid rule over +-12 cavity standard deviations
        double sd = Math.sqrt(s2);
        int steps = 200000;
        double lo = mu - 12 * sd;
        double step = 24 * sd / steps;
        double z0 = 0, z1 = 0, z2 = 0;
        for (int k = 0; k <= steps; k++) {
            double f = lo + k * step;
            double w = (k == 0 || k == steps) ? 0.5 : 1.0;
            double cavity = Math.exp(-0.5 * (f - mu) * (f - mu) / s2) / Math.sqrt(2 * Math.PI * s2);
            double p = cavity * NormalMath.cdf(y * f) * w * step;
            z0 += p;
            z1 += p * f;
            z2 += p * f * f;
        }
        double mean = z1 / z0;
        double variance = z2 / z0 - mean * mean;

        assertEquals(z0, m.getZerothMoment(), 1e-8);
        assertEquals(mean, m.getMean(), 1e-7);
        assertEquals(variance, m.getVariance(), 1e-7);
    }

    @Test
    void testFarTailKeepsLogNormaliserFinite() {
        TiltedMoments m = likelihood.tiltedMoments(new double[] { -1 }, 0, 1.0, 60.0);

        assertEquals(0.0, m.getZerothMoment(), 0.0);
        assertTrue(Double.isFinite(m.getLogZerothMoment()));
        assertTrue(m.getLogZerothMoment() < -800.0);
        assertTrue(Double.isFinite(m.getMean()));
        assertTrue(m.getMean() < 60.0);
        assertTrue(m.getVariance() >= 0.0 && m.getVariance() <= 1.0, m.toString());
    }

    @Test
    void testHugeCavityVarianceStaysFinite() {
        TiltedMoments m = likelihood.tiltedMoments(new double[] { 1 }, 0, 1e200, 0.0);

        assertEquals(0.5, m.getZerothMoment(), 1e-15);
        assertTrue(Double.isFinite(m.getMean()));
        // sigma^2 (1 - 2/pi) once 1 + sigma^2 == sigma^2
        assertEquals(1e200 * (1.0 - 2.0 / Math.PI), m.getVariance(), 1e188);
    }

    @Test
    void testInvalidInputsAreRejected() {
        assertThrows(LabelDomainException.class, () -> likelihood.tiltedMoments(new double[] { 1, 0 }, 0, 1.0, 0.0));
        assertThrows(LabelDomainException.class, () -> likelihood.tiltedMoments(new double[] { 2 }, 0, 1.0, 0.0));
        assertThrows(IllegalArgumentException.class, () -> likelihood.tiltedMoments(new double[] { 1 }, 0, -0.1, 0.0));
        assertThrows(IllegalArgumentException.class,
                () -> likelihood.tiltedMoments(new double[] { 1 }, 0, Double.NaN, 0.0));
        assertThrows(IndexOutOfBoundsException.class, () -> likelihood.tiltedMoments(new double[] { 1 }, 1, 1.0, 0.0));
    }
}
