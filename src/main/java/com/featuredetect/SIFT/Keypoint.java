package com.featuredetect.SIFT;

import lombok.Value;
import lombok.With;

import java.util.Comparator;

/**
 * Điểm khóa (Keypoint), tương ứng với cv::KeyPoint.
 * Immutable: every pipeline stage returns a new instance.
 */
@Value
@With
public class Keypoint {

    /** Orientation of a keypoint that has not been through orientation assignment yet. */
    public static final double UNSET_ANGLE = -1;

    /** Lexicographic order used to find duplicates: x, y, -size, angle, -response, -octave. */
    public static final Comparator<Keypoint> BY_ALL = new ByAll();

    double x;
    double y;
    /** Diameter of the meaningful neighbourhood. */
    double size;
    /** Degrees in [0, 360), or {@link #UNSET_ANGLE}. */
    double angle;
    double response;
    /** Packed octave code, see {@link OctaveCode}. */
    int octave;

    public UnpackedOctave unpackOctave() {
        return OctaveCode.unpack(octave);
    }

    /**
     * Maps a keypoint found on the 2x upsampled base image back to input image coordinates.
     */
    public Keypoint toInputImageFrame() {
        return new Keypoint(0.5 * x, 0.5 * y, 0.5 * size, angle, response, OctaveCode.decrementOctave(octave));
    }

    /**
     * True when position, size and angle are all identical.
     */
    public boolean sameFeature(Keypoint that) {
        return this.x == that.x && this.y == that.y && this.size == that.size && this.angle == that.angle;
    }

    public static class ByAll implements Comparator<Keypoint> {
        @Override
        public int compare(Keypoint k1, Keypoint k2) {
            if (k1.x != k2.x) {
                return k1.x < k2.x ? -1 : 1;
            }
            if (k1.y != k2.y) {
                return k1.y < k2.y ? -1 : 1;
            }
            if (k1.size != k2.size) {
                return k1.size > k2.size ? -1 : 1;
            }
            if (k1.angle != k2.angle) {
                return k1.angle < k2.angle ? -1 : 1;
            }
            if (k1.response != k2.response) {
                return k1.response > k2.response ? -1 : 1;
            }
            return Integer.compare(k2.octave, k1.octave);
        }
    }
}
