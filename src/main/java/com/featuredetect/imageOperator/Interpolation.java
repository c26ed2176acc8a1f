package com.featuredetect.imageOperator;

/**
 * Resampling modes needed by the scale space: bilinear for the initial 2x upsample,
 * nearest neighbour for the octave downsample.
 */
public enum Interpolation {
    LINEAR,
    NEAREST
}
