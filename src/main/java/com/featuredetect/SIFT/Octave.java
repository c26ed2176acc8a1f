package com.featuredetect.SIFT;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Một octave của kim tự tháp: {@code numIntervals + 3} ảnh Gaussian và {@code numIntervals + 2} ảnh DoG,
 * all sharing the octave's resolution.
 */
@Getter
public class Octave {
    private final int index;
    private final List<SiftImage> gaussianImages;
    private final List<SiftImage> dogImages;

    public Octave(int index, List<SiftImage> gaussianImages, List<SiftImage> dogImages) {
        if (dogImages.size() != gaussianImages.size() - 1) {
            throw new IllegalArgumentException("octave " + index + " has " + gaussianImages.size() +
                                               " gaussian images but " + dogImages.size() + " DoG images");
        }
        this.index = index;
        this.gaussianImages = Collections.unmodifiableList(gaussianImages);
        this.dogImages = Collections.unmodifiableList(dogImages);
    }

    public SiftImage getGaussianImage(int layer) {
        return gaussianImages.get(layer);
    }

    public SiftImage getDogImage(int layer) {
        return dogImages.get(layer);
    }

    public int getWidth() {
        return gaussianImages.get(0).getWidth();
    }

    public int getHeight() {
        return gaussianImages.get(0).getHeight();
    }
}
