package com.featuredetect.SIFT;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Giai đoạn 3: gán hướng cho điểm khóa.
 * Each localized keypoint yields one oriented copy per dominant peak of its gradient orientation histogram.
 */
public class SiftStage3 {

    private static final Logger LOG = LoggerFactory.getLogger(SiftStage3.class);

    private final double radiusFactor;
    private final int numBins;
    private final double peakRatio;
    private final double scaleFactor;

    public SiftStage3(SiftParameters parameters) {
        this.radiusFactor = parameters.getOrientationRadiusFactor();
        this.numBins = parameters.getOrientationNumBins();
        this.peakRatio = parameters.getOrientationPeakRatio();
        this.scaleFactor = parameters.getOrientationScaleFactor();
    }

    public List<Keypoint> run(List<LocalizedKeypoint> localizedKeypoints, ScaleSpacePyramid pyramid) {
        List<Keypoint> orientedKeypoints = new ArrayList<>();
        for (LocalizedKeypoint localized : localizedKeypoints) {
            SiftImage gaussianImage = pyramid.getGaussianImage(localized.getOctaveIndex(), localized.getImageIndex());
            orientedKeypoints.addAll(computeKeypointsWithOrientations(localized.getKeypoint(),
                                                                      localized.getOctaveIndex(),
                                                                      gaussianImage));
        }
        LOG.debug("run: {} keypoints produced {} oriented keypoints", localizedKeypoints.size(), orientedKeypoints.size());
        return orientedKeypoints;
    }

    public List<Keypoint> computeKeypointsWithOrientations(Keypoint keypoint, int octaveIndex, SiftImage gaussianImage) {
        double[] rawHistogram = computeRawHistogram(keypoint, octaveIndex, gaussianImage);
        double[] smoothHistogram = smoothHistogram(rawHistogram);
        return findPeaks(keypoint, smoothHistogram);
    }

    double[] computeRawHistogram(Keypoint keypoint, int octaveIndex, SiftImage gaussianImage) {
        double[][] imageData = gaussianImage.data;
        int height = gaussianImage.getHeight();
        int width = gaussianImage.getWidth();

        double octaveScale = Math.scalb(1.0, octaveIndex);
        // so sánh với cách tính keypoint.size trong SiftStage2
        double scale = scaleFactor * keypoint.getSize() / Math.scalb(1.0, octaveIndex + 1);
        int radius = (int) Math.rint(radiusFactor * scale);
        double weightFactor = -0.5 / (scale * scale);

        int centerY = (int) Math.rint(keypoint.getY() / octaveScale);
        int centerX = (int) Math.rint(keypoint.getX() / octaveScale);

        double[] histogram = new double[numBins];
        for (int i = -radius; i <= radius; i++) {
            int sampleY = centerY + i;
            if (sampleY <= 0 || sampleY >= height - 1) {
                continue;
            }
            for (int j = -radius; j <= radius; j++) {
                int sampleX = centerX + j;
                if (sampleX <= 0 || sampleX >= width - 1) {
                    continue;
                }
                double dx = imageData[sampleY][sampleX + 1] - imageData[sampleY][sampleX - 1];
                double dy = imageData[sampleY - 1][sampleX] - imageData[sampleY + 1][sampleX];
                double magnitude = Math.sqrt(dx * dx + dy * dy);
                double orientation = Math.toDegrees(Math.atan2(dy, dx));
                double weight = Math.exp(weightFactor * (i * i + j * j));

                int bin = (int) Math.rint(orientation * numBins / 360.0);
                histogram[Math.floorMod(bin, numBins)] += weight * magnitude;
            }
        }
        return histogram;
    }

    /**
     * Làm mịn vòng tròn với nhân [1, 4, 6, 4, 1] / 16.
     */
    double[] smoothHistogram(double[] histogram) {
        int n = histogram.length;
        double[] smooth = new double[n];
        for (int i = 0; i < n; i++) {
            smooth[i] = (6 * histogram[i]
                         + 4 * (histogram[Math.floorMod(i - 1, n)] + histogram[(i + 1) % n])
                         + histogram[Math.floorMod(i - 2, n)] + histogram[(i + 2) % n]) / 16.0;
        }
        return smooth;
    }

    private List<Keypoint> findPeaks(Keypoint keypoint, double[] histogram) {
        List<Keypoint> keypointsWithOrientations = new ArrayList<>();
        double maxPeakValue = 0;
        for (double value : histogram) {
            maxPeakValue = Math.max(maxPeakValue, value);
        }

        for (int i = 0; i < numBins; i++) {
            double currentValue = histogram[i];
            double prevValue = histogram[Math.floorMod(i - 1, numBins)];
            double nextValue = histogram[(i + 1) % numBins];
            if (currentValue > prevValue && currentValue > nextValue && currentValue >= peakRatio * maxPeakValue) {
                double denominator = prevValue - 2 * currentValue + nextValue;
                if (Math.abs(denominator) < SIFTFeatureDetector.FLOAT_TOLERANCE) {
                    denominator = -SIFTFeatureDetector.FLOAT_TOLERANCE;
                }
                double interpolatedPeakIndex = floorMod(i + 0.5 * (prevValue - nextValue) / denominator, numBins);
                double orientation = 360.0 - interpolatedPeakIndex * 360.0 / numBins;
                if (Math.abs(orientation - 360.0) < SIFTFeatureDetector.FLOAT_TOLERANCE) {
                    orientation = 0;
                }
                keypointsWithOrientations.add(keypoint.withAngle(orientation));
            }
        }
        return keypointsWithOrientations;
    }

    static double floorMod(double value, double modulus) {
        double result = value % modulus;
        return result < 0 ? result + modulus : result;
    }
}
