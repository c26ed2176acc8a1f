package com.featuredetect.API;

import com.featuredetect.SIFT.SiftParameters;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cấu hình SIFT đọc từ application.properties (tiền tố {@code sift.}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "sift")
public class SiftProperties {

    public enum Backend { JAVA, OPENCV }

    /** Ảnh được xử lý bằng Java thuần hay bằng OpenCV. */
    private Backend backend = Backend.JAVA;

    private double sigma = 1.6;
    private int numIntervals = 3;
    private double assumedBlur = 0.5;
    private int imageBorderWidth = 5;
    private double contrastThreshold = 0.04;
    private double eigenvalueRatio = 10;
    private int numAttemptsUntilConvergence = 5;
    private double orientationRadiusFactor = 3;
    private int orientationNumBins = 36;
    private double orientationPeakRatio = 0.8;
    private double orientationScaleFactor = 1.5;
    private int descriptorWindowWidth = 4;
    private int descriptorNumBins = 8;
    private double descriptorScaleMultiplier = 3;
    private double descriptorMaxValue = 0.2;
    private int maxFeatures = 0;

    public SiftParameters toParameters() {
        return SiftParameters.builder()
                .sigma(sigma)
                .numIntervals(numIntervals)
                .assumedBlur(assumedBlur)
                .imageBorderWidth(imageBorderWidth)
                .contrastThreshold(contrastThreshold)
                .eigenvalueRatio(eigenvalueRatio)
                .numAttemptsUntilConvergence(numAttemptsUntilConvergence)
                .orientationRadiusFactor(orientationRadiusFactor)
                .orientationNumBins(orientationNumBins)
                .orientationPeakRatio(orientationPeakRatio)
                .orientationScaleFactor(orientationScaleFactor)
                .descriptorWindowWidth(descriptorWindowWidth)
                .descriptorNumBins(descriptorNumBins)
                .descriptorScaleMultiplier(descriptorScaleMultiplier)
                .descriptorMaxValue(descriptorMaxValue)
                .maxFeatures(maxFeatures)
                .build();
    }
}
