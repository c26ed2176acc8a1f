package com.featuredetect.SIFT;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Gaussian and DoG pyramids of one image. Octave {@code o} has half the resolution of octave {@code o - 1}.
 */
@Getter
public class ScaleSpacePyramid {
    private final List<Octave> octaves;

    public ScaleSpacePyramid(List<Octave> octaves) {
        this.octaves = Collections.unmodifiableList(octaves);
    }

    public int getNumOctaves() {
        return octaves.size();
    }

    public Octave getOctave(int octaveIndex) {
        return octaves.get(octaveIndex);
    }

    public SiftImage getGaussianImage(int octaveIndex, int layer) {
        return octaves.get(octaveIndex).getGaussianImage(layer);
    }
}
