package com.featuredetect.SIFT;

import com.featuredetect.imageOperator.ImageOperators;
import com.featuredetect.imageOperator.Interpolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Giai đoạn 1: xây dựng không gian tỷ lệ.
 * Upsamples the input 2x, blurs it to the base sigma, then builds the Gaussian and DoG pyramids.
 */
public class SiftStage1 {

    private static final Logger LOG = LoggerFactory.getLogger(SiftStage1.class);

    private final double sigma;
    private final int numIntervals;
    private final double assumedBlur;
    private final ImageOperators operators;

    public SiftStage1(SiftParameters parameters, ImageOperators operators) {
        this.sigma = parameters.getSigma();
        this.numIntervals = parameters.getNumIntervals();
        this.assumedBlur = parameters.getAssumedBlur();
        this.operators = operators;
    }

    public ScaleSpacePyramid run(double[][] image) {
        SiftImage baseImage = generateBaseImage(image);
        int numOctaves = computeNumberOfOctaves(baseImage.getHeight(), baseImage.getWidth());
        double[] gaussianKernels = generateGaussianKernels(sigma, numIntervals);

        LOG.debug("run: base image is {}x{}, building {} octaves", baseImage.getWidth(), baseImage.getHeight(), numOctaves);

        List<List<SiftImage>> gaussianPyramid = buildGaussianPyramid(baseImage, numOctaves, gaussianKernels);
        List<Octave> octaves = new ArrayList<>(gaussianPyramid.size());
        for (int o = 0; o < gaussianPyramid.size(); o++) {
            List<SiftImage> gaussianOctave = gaussianPyramid.get(o);
            octaves.add(new Octave(o, gaussianOctave, buildDogOctave(gaussianOctave)));
        }
        return new ScaleSpacePyramid(octaves);
    }

    /**
     * Phóng to ảnh gấp đôi bằng nội suy song tuyến tính rồi làm mờ để ảnh có độ mờ sigma.
     * The input is assumed to carry {@code assumedBlur}, which the upsample doubles.
     */
    public SiftImage generateBaseImage(double[][] image) {
        int height = image.length;
        int width = image[0].length;
        double[][] upsampled = operators.resize(image, 2 * width, 2 * height, Interpolation.LINEAR);
        double sigmaDiff = Math.sqrt(Math.max(sigma * sigma - (2 * assumedBlur) * (2 * assumedBlur), 0.01));
        return new SiftImage(operators.gaussianBlur(upsampled, sigmaDiff, sigmaDiff), sigma);
    }

    /**
     * Octaves are halved until the smallest side is a few pixels: round(log2(min(h, w)) - 1).
     */
    public static int computeNumberOfOctaves(int height, int width) {
        int shortestSide = Math.min(height, width);
        if (shortestSide < 1) {
            return 0;
        }
        return Math.max(0, (int) Math.rint(Math.log(shortestSide) / Math.log(2) - 1));
    }

    /**
     * Incremental blurs of one octave. Entry 0 is sigma itself; entry i is the blur that takes
     * the image from k^(i-1) sigma to k^i sigma, with k = 2^(1/numIntervals).
     */
    public static double[] generateGaussianKernels(double sigma, int numIntervals) {
        int numImagesPerOctave = numIntervals + 3;
        double k = Math.pow(2.0, 1.0 / numIntervals);
        double[] gaussianKernels = new double[numImagesPerOctave];
        gaussianKernels[0] = sigma;
        for (int imageIndex = 1; imageIndex < numImagesPerOctave; imageIndex++) {
            double sigmaPrevious = Math.pow(k, imageIndex - 1) * sigma;
            double sigmaTotal = k * sigmaPrevious;
            gaussianKernels[imageIndex] = Math.sqrt(sigmaTotal * sigmaTotal - sigmaPrevious * sigmaPrevious);
        }
        return gaussianKernels;
    }

    /*****
     Ảnh đầu tiên của mỗi octave đã có độ mờ sigma, các ảnh tiếp theo được làm mờ thêm theo gaussianKernels.
     Ảnh gốc của octave sau là ảnh thứ ba từ cuối (độ mờ 2 * sigma) thu nhỏ một nửa,
     so the next octave starts again at sigma relative to its own resolution.
     *****/
    private List<List<SiftImage>> buildGaussianPyramid(SiftImage baseImage, int numOctaves, double[] gaussianKernels) {
        List<List<SiftImage>> pyramid = new ArrayList<>(numOctaves);
        double k = Math.pow(2.0, 1.0 / numIntervals);
        double[][] currentImage = baseImage.data;

        for (int o = 0; o < numOctaves; o++) {
            List<SiftImage> octave = new ArrayList<>(gaussianKernels.length);
            octave.add(new SiftImage(currentImage, sigma));
            for (int l = 1; l < gaussianKernels.length; l++) {
                currentImage = operators.gaussianBlur(currentImage, gaussianKernels[l], gaussianKernels[l]);
                octave.add(new SiftImage(currentImage, sigma * Math.pow(k, l)));
            }
            pyramid.add(octave);
            LOG.debug("buildGaussianPyramid: octave {} is {}x{}", o, octave.get(0).getWidth(), octave.get(0).getHeight());

            if (o < numOctaves - 1) {
                SiftImage octaveBase = octave.get(octave.size() - 3);
                currentImage = operators.resize(octaveBase.data,
                                                octaveBase.getWidth() / 2,
                                                octaveBase.getHeight() / 2,
                                                Interpolation.NEAREST);
            }
        }
        return pyramid;
    }

    private List<SiftImage> buildDogOctave(List<SiftImage> gaussianOctave) {
        List<SiftImage> dogOctave = new ArrayList<>(gaussianOctave.size() - 1);
        for (int l = 0; l < gaussianOctave.size() - 1; l++) {
            SiftImage first = gaussianOctave.get(l);
            SiftImage second = gaussianOctave.get(l + 1);
            dogOctave.add(new SiftImage(operators.subtract(second.data, first.data), first.sigma));
        }
        return dogOctave;
    }
}
