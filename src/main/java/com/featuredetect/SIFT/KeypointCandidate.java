package com.featuredetect.SIFT;

import lombok.Value;

/**
 * Cực trị rời rạc trong không gian DoG, trước khi tinh chỉnh dưới mức pixel.
 * {@code x} is the column, {@code y} the row, {@code layer} the DoG image index inside {@code octave}.
 */
@Value
public class KeypointCandidate {
    int x;
    int y;
    int octave;
    int layer;

    @Override
    public String toString() {
        return String.format("Candidate[Octave=%d, Layer=%d] at (%d, %d)", octave, layer, x, y);
    }
}
