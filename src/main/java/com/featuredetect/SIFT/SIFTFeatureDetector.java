package com.featuredetect.SIFT;

import com.featuredetect.imageOperator.ImageOperators;
import com.featuredetect.imageOperator.JavaImageOperators;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Phát hiện SIFT features: pyramid, extrema, orientation, deduplication, rescaling and descriptors.
 * Instances keep no state between calls.
 */
@Getter
public class SIFTFeatureDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SIFTFeatureDetector.class);

    /** Floor used wherever a near-zero denominator could appear. */
    public static final double FLOAT_TOLERANCE = 1e-7;

    private final SiftParameters parameters;
    private final ImageOperators operators;

    private final SiftStage1 siftStage1;
    private final SiftStage2 siftStage2;
    private final SiftStage3 siftStage3;
    private final SiftStage4 siftStage4;

    /**
     * @throws InvalidSiftParametersException if any parameter is out of range.
     */
    public SIFTFeatureDetector(SiftParameters parameters, ImageOperators operators) {
        this.parameters = parameters.validate();
        this.operators = operators;

        this.siftStage1 = new SiftStage1(parameters, operators);
        this.siftStage2 = new SiftStage2(parameters);
        this.siftStage3 = new SiftStage3(parameters);
        this.siftStage4 = new SiftStage4(parameters);
    }

    public SIFTFeatureDetector(SiftParameters parameters) {
        this(parameters, new JavaImageOperators());
    }

    public SIFTFeatureDetector() {
        this(SiftParameters.defaults());
    }

    /**
     * @param image gray matrix {@code image[row][col]} on a 0-255 scale.
     * @return unique keypoints sorted by {@link Keypoint#BY_ALL} and their descriptors;
     *         empty when the image is too small for a single octave.
     */
    public ImageFeature detectFeatures(double[][] image) {
        checkImage(image);
        int descriptorLength = parameters.getDescriptorLength();
        if (image.length == 0 || image[0].length == 0) {
            LOG.info("detectFeatures: image is empty, no features");
            return ImageFeature.empty(descriptorLength);
        }

        int height = image.length;
        int width = image[0].length;
        LOG.info("detectFeatures: entry, image is {}x{}, parameters={}", width, height, parameters);
        long startTime = System.currentTimeMillis();

        ScaleSpacePyramid pyramid = siftStage1.run(image);
        if (pyramid.getNumOctaves() == 0) {
            LOG.info("detectFeatures: exit, {}x{} image is too small for a single octave", width, height);
            return ImageFeature.empty(descriptorLength);
        }

        List<LocalizedKeypoint> localized = siftStage2.run(pyramid);
        List<Keypoint> oriented = siftStage3.run(localized, pyramid);
        List<Keypoint> unique = Keypoints.removeDuplicateKeypoints(oriented);
        LOG.debug("detectFeatures: {} oriented keypoints, {} after removing duplicates", oriented.size(), unique.size());

        List<Keypoint> keypoints = Keypoints.convertToInputImageSize(unique);
        float[][] descriptors = siftStage4.run(keypoints, pyramid);
        ImageFeature imageFeature = new ImageFeature(keypoints, descriptors, descriptorLength);

        int maxFeatures = parameters.getMaxFeatures();
        if (maxFeatures > 0 && imageFeature.getNumKeypoints() > maxFeatures) {
            imageFeature = filterByResponseScore(imageFeature, maxFeatures);
        }

        LOG.info("detectFeatures: exit, extracted {} features from {} octaves, elapsedTime={}ms",
                 imageFeature.getNumKeypoints(), pyramid.getNumOctaves(), System.currentTimeMillis() - startTime);
        return imageFeature;
    }

    /**
     * Giữ lại topN keypoints có response lớn nhất, preserving the sorted order of the survivors.
     */
    static ImageFeature filterByResponseScore(ImageFeature features, int topN) {
        List<Keypoint> keypoints = features.getKeyPoints();
        Integer[] byResponse = new Integer[keypoints.size()];
        for (int i = 0; i < byResponse.length; i++) {
            byResponse[i] = i;
        }
        // stable sort: equal responses keep the earlier keypoint
        Arrays.sort(byResponse, (a, b) -> Double.compare(keypoints.get(b).getResponse(), keypoints.get(a).getResponse()));

        List<Integer> kept = new ArrayList<>(Arrays.asList(byResponse).subList(0, topN));
        Collections.sort(kept);

        List<Keypoint> keptKeypoints = new ArrayList<>(topN);
        float[][] keptDescriptors = new float[topN][];
        for (int i = 0; i < topN; i++) {
            keptKeypoints.add(keypoints.get(kept.get(i)));
            keptDescriptors[i] = features.getDescriptor(kept.get(i));
        }
        LOG.debug("filterByResponseScore: kept {} of {} features", topN, keypoints.size());
        return new ImageFeature(keptKeypoints, keptDescriptors, features.getDescriptorLength());
    }

    private static void checkImage(double[][] image) {
        if (image == null) {
            throw new IllegalArgumentException("image must not be null");
        }
        if (image.length == 0) {
            return;
        }
        int width = -1;
        for (int r = 0; r < image.length; r++) {
            if (image[r] == null) {
                throw new IllegalArgumentException("image row " + r + " is null");
            }
            if (width < 0) {
                width = image[r].length;
            } else if (image[r].length != width) {
                throw new IllegalArgumentException("image row " + r + " has " + image[r].length +
                                                   " columns, expected " + width);
            }
        }
    }
}
