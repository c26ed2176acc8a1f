package com.featuredetect.SIFT;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Tham số của SIFT. Defaults follow Lowe's paper and the OpenCV implementation.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class SiftParameters {

    // --- scale space ---
    @Builder.Default
    private final double sigma = 1.6;
    @Builder.Default
    private final int numIntervals = 3;
    @Builder.Default
    private final double assumedBlur = 0.5;

    // --- extrema detection and localization ---
    @Builder.Default
    private final int imageBorderWidth = 5;
    @Builder.Default
    private final double contrastThreshold = 0.04;
    @Builder.Default
    private final double eigenvalueRatio = 10;
    @Builder.Default
    private final int numAttemptsUntilConvergence = 5;

    // --- orientation ---
    @Builder.Default
    private final double orientationRadiusFactor = 3;
    @Builder.Default
    private final int orientationNumBins = 36;
    @Builder.Default
    private final double orientationPeakRatio = 0.8;
    @Builder.Default
    private final double orientationScaleFactor = 1.5;

    // --- descriptor ---
    @Builder.Default
    private final int descriptorWindowWidth = 4;
    @Builder.Default
    private final int descriptorNumBins = 8;
    @Builder.Default
    private final double descriptorScaleMultiplier = 3;
    @Builder.Default
    private final double descriptorMaxValue = 0.2;

    /** 0 giữ lại tất cả keypoints. */
    @Builder.Default
    private final int maxFeatures = 0;

    public static SiftParameters defaults() {
        return SiftParameters.builder().build();
    }

    public int getDescriptorLength() {
        return descriptorWindowWidth * descriptorWindowWidth * descriptorNumBins;
    }

    /**
     * @throws InvalidSiftParametersException for the first parameter that is out of range.
     */
    public SiftParameters validate() {
        requirePositive("sigma", sigma);
        // layer index của keypoint có thể bằng numIntervals và phải vừa trong 8 bit của octave code
        if (numIntervals < 1 || numIntervals > OctaveCode.MAX_LAYER - 1) {
            throw new InvalidSiftParametersException("numIntervals must be in [1, " + (OctaveCode.MAX_LAYER - 1) +
                                                     "], got " + numIntervals);
        }
        requireNonNegative("assumedBlur", assumedBlur);
        if (imageBorderWidth < 1) {
            throw new InvalidSiftParametersException("imageBorderWidth must be at least 1, got " + imageBorderWidth);
        }
        requireNonNegative("contrastThreshold", contrastThreshold);
        requireNonNegative("eigenvalueRatio", eigenvalueRatio);
        if (numAttemptsUntilConvergence < 1) {
            throw new InvalidSiftParametersException("numAttemptsUntilConvergence must be at least 1, got " +
                                                     numAttemptsUntilConvergence);
        }
        requirePositive("orientationRadiusFactor", orientationRadiusFactor);
        requirePositiveCount("orientationNumBins", orientationNumBins);
        if (!(orientationPeakRatio > 0 && orientationPeakRatio <= 1)) {
            throw new InvalidSiftParametersException("orientationPeakRatio must be in (0, 1], got " +
                                                     orientationPeakRatio);
        }
        requirePositive("orientationScaleFactor", orientationScaleFactor);
        requirePositiveCount("descriptorWindowWidth", descriptorWindowWidth);
        requirePositiveCount("descriptorNumBins", descriptorNumBins);
        requirePositive("descriptorScaleMultiplier", descriptorScaleMultiplier);
        requireNonNegative("descriptorMaxValue", descriptorMaxValue);
        if (maxFeatures < 0) {
            throw new InvalidSiftParametersException("maxFeatures must not be negative, got " + maxFeatures);
        }
        return this;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidSiftParametersException(name + " must be positive, got " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidSiftParametersException(name + " must not be negative, got " + value);
        }
    }

    private static void requirePositiveCount(String name, int value) {
        if (value < 1) {
            throw new InvalidSiftParametersException(name + " must be positive, got " + value);
        }
    }
}
