package com.featuredetect.SIFT;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Giai đoạn 4: Tạo bộ mô tả SIFT (Descriptor).
 * Mỗi keypoint được biểu diễn bằng vector windowWidth x windowWidth x numBins (mặc định 4x4x8 = 128),
 * sampled on the Gaussian image the keypoint was found in and rotated to the keypoint's angle.
 */
public class SiftStage4 {

    private static final Logger LOG = LoggerFactory.getLogger(SiftStage4.class);

    private final int windowWidth;
    private final int numBins;
    private final double scaleMultiplier;
    private final double descriptorMaxValue;

    public SiftStage4(SiftParameters parameters) {
        this.windowWidth = parameters.getDescriptorWindowWidth();
        this.numBins = parameters.getDescriptorNumBins();
        this.scaleMultiplier = parameters.getDescriptorScaleMultiplier();
        this.descriptorMaxValue = parameters.getDescriptorMaxValue();
    }

    /**
     * @param keypoints keypoints in input image coordinates, as returned by {@link Keypoints#convertToInputImageSize}.
     * @return one descriptor row per keypoint, same order.
     */
    public float[][] run(List<Keypoint> keypoints, ScaleSpacePyramid pyramid) {
        float[][] descriptors = new float[keypoints.size()][];
        for (int i = 0; i < keypoints.size(); i++) {
            descriptors[i] = generateDescriptor(keypoints.get(i), pyramid);
        }
        LOG.debug("run: generated {} descriptors of length {}", descriptors.length, getDescriptorLength());
        return descriptors;
    }

    public int getDescriptorLength() {
        return windowWidth * windowWidth * numBins;
    }

    public float[] generateDescriptor(Keypoint keypoint, ScaleSpacePyramid pyramid) {
        UnpackedOctave unpacked = keypoint.unpackOctave();
        SiftImage gaussianImage = pyramid.getGaussianImage(unpacked.getOctave() + 1, unpacked.getLayer());
        double[][] imageData = gaussianImage.data;
        int numRows = gaussianImage.getHeight();
        int numCols = gaussianImage.getWidth();
        double scale = unpacked.getScale();

        int pointX = (int) Math.rint(scale * keypoint.getX());
        int pointY = (int) Math.rint(scale * keypoint.getY());
        double binsPerDegree = numBins / 360.0;
        double angle = 360.0 - keypoint.getAngle();
        double cosAngle = Math.cos(Math.toRadians(angle));
        double sinAngle = Math.sin(Math.toRadians(angle));
        double weightMultiplier = -0.5 / ((0.5 * windowWidth) * (0.5 * windowWidth));

        // hai chiều đầu tăng thêm 2 để hứng phần nội suy tràn ra ngoài biên
        double[][][] histogramTensor = new double[windowWidth + 2][windowWidth + 2][numBins];

        double histWidth = scaleMultiplier * 0.5 * scale * keypoint.getSize();
        // sqrt(2) ứng với đường chéo của một pixel
        int halfWidth = (int) Math.rint(histWidth * Math.sqrt(2) * (windowWidth + 1) * 0.5);
        halfWidth = (int) Math.min(halfWidth, Math.sqrt((double) numRows * numRows + (double) numCols * numCols));

        for (int row = -halfWidth; row <= halfWidth; row++) {
            for (int col = -halfWidth; col <= halfWidth; col++) {
                double rowRot = col * sinAngle + row * cosAngle;
                double colRot = col * cosAngle - row * sinAngle;
                double rowBin = (rowRot / histWidth) + 0.5 * windowWidth - 0.5;
                double colBin = (colRot / histWidth) + 0.5 * windowWidth - 0.5;
                if (rowBin <= -1 || rowBin >= windowWidth || colBin <= -1 || colBin >= windowWidth) {
                    continue;
                }
                int windowRow = pointY + row;
                int windowCol = pointX + col;
                if (windowRow <= 0 || windowRow >= numRows - 1 || windowCol <= 0 || windowCol >= numCols - 1) {
                    continue;
                }
                double dx = imageData[windowRow][windowCol + 1] - imageData[windowRow][windowCol - 1];
                double dy = imageData[windowRow - 1][windowCol] - imageData[windowRow + 1][windowCol];
                double gradientMagnitude = Math.sqrt(dx * dx + dy * dy);
                double gradientOrientation = SiftStage3.floorMod(Math.toDegrees(Math.atan2(dy, dx)), 360.0);
                double weight = Math.exp(weightMultiplier * ((rowRot / histWidth) * (rowRot / histWidth)
                                                             + (colRot / histWidth) * (colRot / histWidth)));
                double orientationBin = (gradientOrientation - angle) * binsPerDegree;

                trilinearInterpolation(histogramTensor, rowBin, colBin, orientationBin, weight * gradientMagnitude);
            }
        }
        return flattenAndNormalize(histogramTensor);
    }

    /**
     * Nội suy tuyến tính 3 chiều: phân bố giá trị vào 8 bins lân cận (row, col, orientation).
     */
    private void trilinearInterpolation(double[][][] histogramTensor, double rowBin, double colBin,
                                        double orientationBin, double magnitude) {
        int rowBinFloor = (int) Math.floor(rowBin);
        int colBinFloor = (int) Math.floor(colBin);
        int orientationBinFloor = (int) Math.floor(orientationBin);
        double rowFraction = rowBin - rowBinFloor;
        double colFraction = colBin - colBinFloor;
        double orientationFraction = orientationBin - orientationBinFloor;
        if (orientationBinFloor < 0) {
            orientationBinFloor += numBins;
        }
        if (orientationBinFloor >= numBins) {
            orientationBinFloor -= numBins;
        }
        int orientationBinNext = (orientationBinFloor + 1) % numBins;

        double c1 = magnitude * rowFraction;
        double c0 = magnitude * (1 - rowFraction);
        double c11 = c1 * colFraction;
        double c10 = c1 * (1 - colFraction);
        double c01 = c0 * colFraction;
        double c00 = c0 * (1 - colFraction);

        double[] h00 = histogramTensor[rowBinFloor + 1][colBinFloor + 1];
        double[] h01 = histogramTensor[rowBinFloor + 1][colBinFloor + 2];
        double[] h10 = histogramTensor[rowBinFloor + 2][colBinFloor + 1];
        double[] h11 = histogramTensor[rowBinFloor + 2][colBinFloor + 2];

        h00[orientationBinFloor] += c00 * (1 - orientationFraction);
        h00[orientationBinNext] += c00 * orientationFraction;
        h01[orientationBinFloor] += c01 * (1 - orientationFraction);
        h01[orientationBinNext] += c01 * orientationFraction;
        h10[orientationBinFloor] += c10 * (1 - orientationFraction);
        h10[orientationBinNext] += c10 * orientationFraction;
        h11[orientationBinFloor] += c11 * (1 - orientationFraction);
        h11[orientationBinNext] += c11 * orientationFraction;
    }

    /**
     * Bỏ viền, duỗi thẳng theo thứ tự row -> col -> orientation, cắt ngưỡng rồi chuẩn hóa.
     * The clip threshold comes from the norm before clipping, the final scale from the norm after it.
     */
    float[] flattenAndNormalize(double[][][] histogramTensor) {
        double[] descriptor = new double[getDescriptorLength()];
        int index = 0;
        for (int i = 1; i <= windowWidth; i++)
            for (int j = 1; j <= windowWidth; j++)
                for (int k = 0; k < numBins; k++)
                    descriptor[index++] = histogramTensor[i][j][k];

        double threshold = norm(descriptor) * descriptorMaxValue;
        for (int i = 0; i < descriptor.length; i++) {
            if (descriptor[i] > threshold) {
                descriptor[i] = threshold;
            }
        }
        double clippedNorm = Math.max(norm(descriptor), SIFTFeatureDetector.FLOAT_TOLERANCE);

        float[] quantized = new float[descriptor.length];
        for (int i = 0; i < descriptor.length; i++) {
            double value = Math.rint(512 * (descriptor[i] / clippedNorm));
            quantized[i] = (float) Math.max(0, Math.min(255, value));
        }
        return quantized;
    }

    private static double norm(double[] vector) {
        double sum = 0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }
}
