package com.imagecube.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GaussianKernelTest {

    @Test
    void normalisedToUnitSum() {
        assertEquals(1.0, GaussianKernel.of(2.7).sum(), 1e-5);
        assertEquals(1.0, GaussianKernel.of(0.1).sum(), 1e-5);
    }

    @Test
    void oddSideOfAtLeastThree() {
        assertEquals(17, GaussianKernel.of(2.0).size());
        assertEquals(11, GaussianKernel.of(1.2).size());
        assertEquals(3, GaussianKernel.of(0.05).size());
        assertEquals(GaussianKernel.of(2.0).size() * GaussianKernel.of(2.0).size(), GaussianKernel.of(2.0).values().length);
    }

    @Test
    void peakAtCentreAndSymmetric() {
        GaussianKernel k = GaussianKernel.of(1.5);
        float[] v = k.values();
        int n = k.size(), c = n / 2;
        float centre = v[c * n + c];
        for (float f : v) assertTrue(f <= centre);
        assertEquals(v[c * n], v[c * n + n - 1], 1e-9);
        assertEquals(v[c], v[(n - 1) * n + c], 1e-9);
    }

    @Test
    void sigmaFromFwhm() {
        assertEquals(1.0, GaussianKernel.sigmaFor(2 * Math.sqrt(2 * Math.log(2)), 1.0), 1e-12);
        assertEquals(0.5, GaussianKernel.sigmaFor(2 * Math.sqrt(2 * Math.log(2)), 2.0), 1e-12);
    }

    @Test
    void invalidSigma() {
        assertThrows(IllegalArgumentException.class, () -> GaussianKernel.of(0));
        assertThrows(IllegalArgumentException.class, () -> GaussianKernel.of(Double.NaN));
    }
}
