package com.featuredetect.SIFT;

/**
 * One image of the scale space with the cumulative blur it carries, relative to its octave.
 */
public class SiftImage {
    public final double[][] data;
    public final double sigma;

    public SiftImage(double[][] data, double sigma) {
        this.data = data;
        this.sigma = sigma;
    }

    public int getWidth() {
        return data[0].length;
    }

    public int getHeight() {
        return data.length;
    }
}
