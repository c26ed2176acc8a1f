package com.featuredetect.imageOperator;

/**
 * Numeric image primitives consumed by the scale space builder.
 * Images are row-major gray matrices, {@code image[row][col]}.
 * All implementations must use the same border policy so that blurs compose by sum of squares.
 */
public interface ImageOperators {

    /**
     * Resamples {@code image} to {@code width x height}.
     */
    double[][] resize(double[][] image, int width, int height, Interpolation interpolation);

    /**
     * Separable Gaussian convolution with a reflect-101 border.
     */
    double[][] gaussianBlur(double[][] image, double sigmaX, double sigmaY);

    /**
     * Pointwise signed difference {@code a - b}.
     */
    double[][] subtract(double[][] a, double[][] b);
}
