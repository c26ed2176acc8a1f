package com.featuredetect.SIFT;

/**
 * Packs octave, layer and sub-layer offset of a keypoint into one int, the way cv::KeyPoint does:
 * bits 0-7 octave (signed byte), bits 8-15 layer, bits 16-23 offset quantized to 1/255.
 */
public class OctaveCode {

    public static final int MIN_OCTAVE = -128;
    public static final int MAX_OCTAVE = 127;
    public static final int MAX_LAYER = 255;

    private OctaveCode() {
    }

    /**
     * @param subLayerOffset refined offset from {@code layer}, nominally in [-0.5, 0.5].
     */
    public static int pack(int octave, int layer, double subLayerOffset) {
        if (octave < MIN_OCTAVE || octave > MAX_OCTAVE) {
            throw new IllegalArgumentException("octave " + octave + " is outside [" + MIN_OCTAVE + ", " + MAX_OCTAVE + "]");
        }
        if (layer < 0 || layer > MAX_LAYER) {
            throw new IllegalArgumentException("layer " + layer + " is outside [0, " + MAX_LAYER + "]");
        }
        int quantized = (int) Math.rint((subLayerOffset + 0.5) * 255);
        quantized = Math.max(0, Math.min(255, quantized));
        return (octave & 255) | (layer << 8) | (quantized << 16);
    }

    public static UnpackedOctave unpack(int code) {
        int octave = code & 255;
        int layer = (code >> 8) & 255;
        if (octave >= 128) {
            octave = octave | -128;
        }
        double scale = Math.scalb(1.0, -octave);
        double subLayerOffset = ((code >> 16) & 255) / 255.0 - 0.5;
        return new UnpackedOctave(octave, layer, scale, subLayerOffset);
    }

    /**
     * Lowers the octave field by one, leaving layer and offset untouched.
     */
    public static int decrementOctave(int code) {
        return (code & ~255) | ((code - 1) & 255);
    }
}
