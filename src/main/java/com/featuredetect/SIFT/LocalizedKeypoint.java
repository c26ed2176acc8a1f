package com.featuredetect.SIFT;

import lombok.Value;

/**
 * A keypoint that survived localization, with the octave and Gaussian layer it was refined to.
 */
@Value
public class LocalizedKeypoint {
    Keypoint keypoint;
    int octaveIndex;
    int imageIndex;
}
