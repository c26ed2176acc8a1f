package com.featuredetect.filter_convolution_gauss;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SeparabilityGauss} class.
 */
public class SeparabilityGaussTest {

    @Test
    public void testKernelSize() {
        Assert.assertEquals("invalid size for sigma 1.6", 15, SeparabilityGauss.kernelSize(1.6));
        Assert.assertEquals("invalid size for sigma 1.0", 9, SeparabilityGauss.kernelSize(1.0));
        Assert.assertEquals("invalid size for sigma 0.1", 3, SeparabilityGauss.kernelSize(0.1));
    }

    @Test
    public void testKernelIsNormalizedAndSymmetric() {
        for (double sigma : new double[] { 0.5, 1.2263, 1.6, 3.5 }) {
            double[] kernel = SeparabilityGauss.create1DGaussianKernel(sigma);
            Assert.assertEquals("kernel length must be odd for sigma " + sigma, 1, kernel.length % 2);
            double sum = 0;
            for (int i = 0; i < kernel.length; i++) {
                sum += kernel[i];
                Assert.assertEquals("kernel is not symmetric at " + i + " for sigma " + sigma,
                                    kernel[i], kernel[kernel.length - 1 - i], 1e-15);
            }
            Assert.assertEquals("kernel does not sum to 1 for sigma " + sigma, 1.0, sum, 1e-12);
            Assert.assertTrue("centre must be the largest tap", kernel[kernel.length / 2] >= kernel[0]);
        }
    }

    @Test
    public void testReflect101() {
        Assert.assertEquals(1, SeparabilityGauss.reflect101(-1, 5));
        Assert.assertEquals(2, SeparabilityGauss.reflect101(-2, 5));
        Assert.assertEquals(3, SeparabilityGauss.reflect101(5, 5));
        Assert.assertEquals(2, SeparabilityGauss.reflect101(6, 5));
        Assert.assertEquals(4, SeparabilityGauss.reflect101(4, 5));
        // kernel wider than the image reflects more than once
        Assert.assertEquals(2, SeparabilityGauss.reflect101(-6, 3));
        Assert.assertEquals(0, SeparabilityGauss.reflect101(-7, 1));
    }

    @Test
    public void testBlurKeepsConstantImage() {
        double[][] image = new double[6][9];
        for (double[] row : image) {
            java.util.Arrays.fill(row, 42.0);
        }
        double[][] blurred = SeparabilityGauss.seperabilityGauss(image, 2.0, 0.7);
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 9; c++) {
                Assert.assertEquals("constant image changed at (" + r + ", " + c + ")", 42.0, blurred[r][c], 1e-9);
            }
        }
    }

    @Test
    public void testBlurSpreadsImpulseSymmetrically() {
        double[][] image = new double[21][21];
        image[10][10] = 1;
        double[][] blurred = SeparabilityGauss.seperabilityGauss(image, 1.5);

        double sum = 0;
        for (double[] row : blurred) {
            for (double v : row) {
                sum += v;
            }
        }
        Assert.assertEquals("blur must preserve the mass of an interior impulse", 1.0, sum, 1e-12);
        Assert.assertEquals(blurred[10][9], blurred[10][11], 1e-15);
        Assert.assertEquals(blurred[9][10], blurred[10][9], 1e-15);
        Assert.assertTrue(blurred[10][10] > blurred[10][11]);
    }
}
