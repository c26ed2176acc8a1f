package com.featuredetect.SIFT;

import com.featuredetect.imageOperator.JavaImageOperators;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;

/**
 * Tests the {@link SiftStage4} class.
 */
public class SiftStage4Test {

    private final SiftParameters parameters = SiftParameters.defaults();
    private final SiftStage1 stage1 = new SiftStage1(parameters, new JavaImageOperators());
    private final SiftStage4 stage4 = new SiftStage4(parameters);

    // input image frame: octave -1 is the upsampled base image
    private final Keypoint keypoint = new Keypoint(32, 30, 6, 30, 0.05, OctaveCode.pack(-1, 1, 0.1));

    @Test
    public void testFlatImageGivesZeroDescriptor() {
        ScaleSpacePyramid pyramid = stage1.run(SyntheticImages.flat(64, 64, 120));

        float[] descriptor = stage4.generateDescriptor(keypoint, pyramid);

        Assert.assertEquals("invalid descriptor length", 128, descriptor.length);
        for (float v : descriptor) {
            Assert.assertEquals("flat image must not produce gradients", 0f, v, 0f);
        }
    }

    @Test
    public void testDescriptorValuesAreQuantized() {
        ScaleSpacePyramid pyramid = stage1.run(SyntheticImages.texture(64, 64));

        float[][] descriptors = stage4.run(Arrays.asList(keypoint, keypoint.withAngle(200)), pyramid);

        Assert.assertEquals(2, descriptors.length);
        for (float[] descriptor : descriptors) {
            Assert.assertEquals(stage4.getDescriptorLength(), descriptor.length);
            double norm = 0;
            for (float v : descriptor) {
                Assert.assertTrue("value out of range: " + v, v >= 0 && v <= 255);
                Assert.assertEquals("value is not an integer: " + v, Math.rint(v), v, 0.0);
                norm += v * v;
            }
            Assert.assertTrue("textured image must produce a descriptor", norm > 0);
        }
        Assert.assertFalse("orientation must change the descriptor", Arrays.equals(descriptors[0], descriptors[1]));
    }

    @Test
    public void testClipUsesNormBeforeClippingAndRescalesWithNormAfter() {
        int width = parameters.getDescriptorWindowWidth();
        int bins = parameters.getDescriptorNumBins();
        double[][][] tensor = new double[width + 2][width + 2][bins];
        for (int i = 0; i < width + 2; i++) {
            for (int j = 0; j < width + 2; j++) {
                for (int k = 0; k < bins; k++) {
                    boolean inside = i >= 1 && i <= width && j >= 1 && j <= width;
                    // the spill-over ring must not reach the descriptor
                    tensor[i][j][k] = inside ? 1 : 1000;
                }
            }
        }
        double dominant = 10;
        tensor[1][1][0] = dominant;

        float[] descriptor = stage4.flattenAndNormalize(tensor);

        int others = width * width * bins - 1;
        double normBeforeClip = Math.sqrt(dominant * dominant + others);
        double clipped = parameters.getDescriptorMaxValue() * normBeforeClip;
        double normAfterClip = Math.sqrt(clipped * clipped + others);

        Assert.assertEquals("invalid descriptor length", 128, descriptor.length);
        Assert.assertEquals("dominant entry must be clipped before renormalizing",
                            Math.rint(512 * parameters.getDescriptorMaxValue() * normBeforeClip / normAfterClip),
                            descriptor[0], 0.0);
        for (int i = 1; i < descriptor.length; i++) {
            Assert.assertEquals("invalid entry " + i, Math.rint(512 / normAfterClip), descriptor[i], 0.0);
        }
        // normalize, clip at 0.2 and skip the second normalization would give rint(512 * 0.2)
        Assert.assertNotEquals(Math.rint(512 * parameters.getDescriptorMaxValue()), descriptor[0], 0.0);
    }

    @Test
    public void testZeroHistogramStaysZero() {
        int width = parameters.getDescriptorWindowWidth();
        float[] descriptor = stage4.flattenAndNormalize(new double[width + 2][width + 2][parameters.getDescriptorNumBins()]);

        for (float v : descriptor) {
            Assert.assertFalse("zero histogram produced NaN", Float.isNaN(v));
            Assert.assertEquals(0f, v, 0f);
        }
    }

    @Test
    public void testDescriptorLengthFollowsParameters() {
        SiftParameters small = parameters.toBuilder().descriptorWindowWidth(2).descriptorNumBins(6).build();
        SiftStage4 stage = new SiftStage4(small);
        ScaleSpacePyramid pyramid = stage1.run(SyntheticImages.texture(64, 64));

        float[] descriptor = stage.generateDescriptor(keypoint, pyramid);

        Assert.assertEquals(24, stage.getDescriptorLength());
        Assert.assertEquals(24, descriptor.length);
    }
}
