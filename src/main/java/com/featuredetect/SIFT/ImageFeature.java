package com.featuredetect.SIFT;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * ImageFeature: định dạng OUTPUT giống như OpenCV detectAndCompute.
 * Keypoints are in input image coordinates; descriptor row {@code i} belongs to keypoint {@code i}.
 */
@Getter
public class ImageFeature {
    private final List<Keypoint> keyPoints;
    private final float[][] descriptors;
    private final int descriptorLength;

    public ImageFeature(List<Keypoint> keyPoints, float[][] descriptors, int descriptorLength) {
        if (keyPoints.size() != descriptors.length) {
            throw new IllegalArgumentException(keyPoints.size() + " keypoints but " + descriptors.length + " descriptors");
        }
        this.keyPoints = List.copyOf(keyPoints);
        this.descriptors = copyRows(descriptors);
        this.descriptorLength = descriptorLength;
    }

    public static ImageFeature empty(int descriptorLength) {
        return new ImageFeature(Collections.emptyList(), new float[0][], descriptorLength);
    }

    public int getNumKeypoints() {
        return keyPoints.size();
    }

    /** Bản sao của ma trận descriptor, one row per keypoint. */
    public float[][] getDescriptors() {
        return copyRows(descriptors);
    }

    public float[] getDescriptor(int index) {
        return descriptors[index].clone();
    }

    // Lấy descriptor của keypoint thứ i dưới dạng byte [0, 255]
    public byte[] getDescriptorAsByte(int index) {
        float[] descriptor = descriptors[index];
        byte[] result = new byte[descriptor.length];
        for (int i = 0; i < descriptor.length; i++) {
            result[i] = (byte) (((int) descriptor[i]) & 0xFF);
        }
        return result;
    }

    private static float[][] copyRows(float[][] rows) {
        float[][] copy = new float[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            copy[i] = rows[i].clone();
        }
        return copy;
    }

    @Override
    public String toString() {
        return String.format("ImageFeature[keypoints=%d, descriptor_dims=%d]", getNumKeypoints(), descriptorLength);
    }
}
