package com.featuredetect.SIFT;

import lombok.Value;

/**
 * Fields of a packed octave code. {@code scale} maps input image coordinates to the octave's frame.
 */
@Value
public class UnpackedOctave {
    int octave;
    int layer;
    double scale;
    double subLayerOffset;
}
