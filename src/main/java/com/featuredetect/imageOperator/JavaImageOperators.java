package com.featuredetect.imageOperator;

import com.featuredetect.filter_convolution_gauss.SeparabilityGauss;

/**
 * Plain Java image primitives. Default backend of the detector.
 */
public class JavaImageOperators implements ImageOperators {

    @Override
    public double[][] resize(double[][] image, int width, int height, Interpolation interpolation) {
        checkTargetSize(width, height);
        return switch (interpolation) {
            case LINEAR -> Up_DownSample.upsampleWithLinearInterpolation(image, width, height);
            case NEAREST -> Up_DownSample.downsample(image, width, height);
        };
    }

    @Override
    public double[][] gaussianBlur(double[][] image, double sigmaX, double sigmaY) {
        if (sigmaX <= 0 || sigmaY <= 0) {
            throw new IllegalArgumentException("blur sigma must be positive, got " + sigmaX + ", " + sigmaY);
        }
        return SeparabilityGauss.seperabilityGauss(image, sigmaX, sigmaY);
    }

    @Override
    public double[][] subtract(double[][] a, double[][] b) {
        int height = a.length;
        int width = a[0].length;
        if (b.length != height || b[0].length != width) {
            throw new IllegalArgumentException("cannot subtract " + b.length + "x" + b[0].length +
                                               " image from " + height + "x" + width + " image");
        }
        double[][] difference = new double[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                difference[r][c] = a[r][c] - b[r][c];
            }
        }
        return difference;
    }

    static void checkTargetSize(int width, int height) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("invalid target size " + width + "x" + height);
        }
    }
}
