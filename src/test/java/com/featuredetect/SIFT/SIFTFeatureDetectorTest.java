package com.featuredetect.SIFT;

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

/**
 * Tests the {@link SIFTFeatureDetector} class.
 */
public class SIFTFeatureDetectorTest {

    private final SIFTFeatureDetector detector = new SIFTFeatureDetector();

    @Test(expected = IllegalArgumentException.class)
    public void testNullImage() {
        detector.detectFeatures(null);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRaggedImage() {
        detector.detectFeatures(new double[][] { new double[5], new double[4] });
    }

    @Test
    public void testDegenerateImagesGiveNoFeatures() {
        double[][][] images = { new double[0][0], new double[4][0], new double[1][1], new double[2][2], new double[6][90] };
        for (double[][] image : images) {
            ImageFeature features = detector.detectFeatures(image);
            Assert.assertEquals("features found in degenerate image", 0, features.getNumKeypoints());
            Assert.assertEquals(0, features.getDescriptors().length);
            Assert.assertEquals(128, features.getDescriptorLength());
        }
    }

    @Test
    public void testFlatImageGivesNoFeatures() {
        ImageFeature features = detector.detectFeatures(SyntheticImages.flat(64, 64, 77));
        Assert.assertEquals(0, features.getNumKeypoints());
    }

    @Test
    public void testSingleBlob() {
        ImageFeature small = detector.detectFeatures(SyntheticImages.blob(128, 128, 64, 64, 4));
        ImageFeature large = detector.detectFeatures(SyntheticImages.blob(128, 128, 64, 64, 8));

        Keypoint smallBlob = assertBlobFound(small, 4);
        Keypoint largeBlob = assertBlobFound(large, 8);

        double ratio = largeBlob.getSize() / smallBlob.getSize();
        Assert.assertTrue("size must follow the blob scale, ratio is " + ratio, ratio > 1.5 && ratio < 2.6);
    }

    @Test
    public void testOutputInvariants() {
        ImageFeature features = detector.detectFeatures(SyntheticImages.texture(96, 80));
        List<Keypoint> keypoints = features.getKeyPoints();

        Assert.assertTrue("textured image must produce keypoints", keypoints.size() > 5);
        Assert.assertEquals(keypoints.size(), features.getDescriptors().length);
        for (int i = 0; i < keypoints.size(); i++) {
            Keypoint keypoint = keypoints.get(i);
            Assert.assertTrue("angle out of range: " + keypoint, keypoint.getAngle() >= 0 && keypoint.getAngle() < 360);
            Assert.assertTrue("keypoint outside the image: " + keypoint,
                              keypoint.getX() >= 0 && keypoint.getX() < 80 && keypoint.getY() >= 0 && keypoint.getY() < 96);
            Assert.assertTrue(keypoint.getResponse() > 0);
            if (i > 0) {
                Assert.assertTrue("keypoints are not sorted", Keypoint.BY_ALL.compare(keypoints.get(i - 1), keypoint) <= 0);
                Assert.assertFalse("duplicate keypoint " + keypoint, keypoints.get(i - 1).sameFeature(keypoint));
            }
            for (float v : features.getDescriptor(i)) {
                Assert.assertTrue("descriptor value out of range: " + v, v >= 0 && v <= 255 && v == Math.rint(v));
            }
        }
        Assert.assertEquals("deduplication must be idempotent", keypoints, Keypoints.removeDuplicateKeypoints(keypoints));
    }

    @Test
    public void testTranslation() {
        int shift = 16;
        double[][] original = twoBlobs(192, 88, 92);
        double[][] shifted = twoBlobs(192, 88 + shift, 92 + shift);

        ImageFeature a = detector.detectFeatures(original);
        ImageFeature b = detector.detectFeatures(shifted);

        Assert.assertTrue("pattern must produce keypoints", a.getNumKeypoints() > 0);
        Assert.assertEquals("translation changed the number of keypoints", a.getNumKeypoints(), b.getNumKeypoints());
        for (int i = 0; i < a.getNumKeypoints(); i++) {
            Keypoint ka = a.getKeyPoints().get(i);
            Keypoint kb = b.getKeyPoints().get(i);
            Assert.assertEquals("x of " + ka, ka.getX() + shift, kb.getX(), 1e-6);
            Assert.assertEquals("y of " + ka, ka.getY() + shift, kb.getY(), 1e-6);
            Assert.assertEquals("size of " + ka, ka.getSize(), kb.getSize(), 1e-6);
            Assert.assertEquals("angle of " + ka, ka.getAngle(), kb.getAngle(), 1e-6);
            Assert.assertEquals("octave of " + ka, ka.getOctave(), kb.getOctave());
            Assert.assertArrayEquals("descriptor of " + ka, a.getDescriptor(i), b.getDescriptor(i), 1f);
        }
    }

    @Test
    public void testRotation() {
        int n = 128;
        double[][] original = twoBlobs(n, 60, 66);
        double[][] rotated = SyntheticImages.rotate90(original);

        ImageFeature a = detector.detectFeatures(original);
        ImageFeature b = detector.detectFeatures(rotated);

        int strongest = strongestIndex(a);
        Keypoint reference = a.getKeyPoints().get(strongest);
        // (x, y) -> (y, n - 1 - x) for pixel indices, keypoints sit a quarter pixel off the pixel grid
        double expectedX = reference.getY();
        double expectedY = n - 0.5 - reference.getX();

        List<Integer> originalCopies = near(a, reference.getX(), reference.getY(), 0.01);
        List<Integer> rotatedCopies = near(b, expectedX, expectedY, 2.5);
        Assert.assertFalse("no keypoint near (" + expectedX + ", " + expectedY + ") after rotation", rotatedCopies.isEmpty());

        boolean matched = false;
        double bestDistance = Double.MAX_VALUE;
        for (int i : originalCopies) {
            double expectedAngle = SiftStage3.floorMod(a.getKeyPoints().get(i).getAngle() - 90, 360);
            for (int j : rotatedCopies) {
                double angle = b.getKeyPoints().get(j).getAngle();
                double angleError = Math.abs(SiftStage3.floorMod(angle - expectedAngle + 180, 360) - 180);
                double distance = distance(a.getDescriptor(i), b.getDescriptor(j));
                if (angleError < 10) {
                    bestDistance = Math.min(bestDistance, distance);
                    matched |= distance < 200;
                }
            }
        }
        Assert.assertTrue("no rotated keypoint matches, best descriptor distance " + bestDistance, matched);
    }

    @Test
    public void testMaxFeaturesKeepsStrongest() {
        double[][] image = SyntheticImages.texture(96, 80);
        ImageFeature all = detector.detectFeatures(image);
        SIFTFeatureDetector limitedDetector =
                new SIFTFeatureDetector(SiftParameters.defaults().toBuilder().maxFeatures(5).build());
        ImageFeature limited = limitedDetector.detectFeatures(image);

        Assert.assertTrue(all.getNumKeypoints() > 5);
        Assert.assertEquals(5, limited.getNumKeypoints());

        List<Keypoint> kept = limited.getKeyPoints();
        double weakestKept = Double.MAX_VALUE;
        int previousIndex = -1;
        for (int i = 0; i < kept.size(); i++) {
            int index = all.getKeyPoints().indexOf(kept.get(i));
            Assert.assertTrue("kept keypoint not found " + kept.get(i), index >= 0);
            Assert.assertTrue("kept keypoints lost their order", index > previousIndex);
            Assert.assertArrayEquals(all.getDescriptor(index), limited.getDescriptor(i), 0f);
            previousIndex = index;
            weakestKept = Math.min(weakestKept, kept.get(i).getResponse());
        }
        for (Keypoint keypoint : all.getKeyPoints()) {
            if (!kept.contains(keypoint)) {
                Assert.assertTrue("dropped " + keypoint + " is stronger than a kept one",
                                  keypoint.getResponse() <= weakestKept);
            }
        }
    }

    @Test
    public void testFilterByResponseScore() {
        int code = OctaveCode.pack(0, 1, 0);
        List<Keypoint> keypoints = new ArrayList<>();
        double[] responses = { 0.1, 0.5, 0.3, 0.5, 0.2 };
        float[][] descriptors = new float[responses.length][];
        for (int i = 0; i < responses.length; i++) {
            keypoints.add(new Keypoint(i, 0, 2, 0, responses[i], code));
            descriptors[i] = new float[] { i };
        }
        ImageFeature features = new ImageFeature(keypoints, descriptors, 1);

        ImageFeature top2 = SIFTFeatureDetector.filterByResponseScore(features, 2);
        Assert.assertEquals(1.0, top2.getKeyPoints().get(0).getX(), 0.0);
        Assert.assertEquals(3.0, top2.getKeyPoints().get(1).getX(), 0.0);
        Assert.assertEquals(3f, top2.getDescriptor(1)[0], 0f);

        ImageFeature top3 = SIFTFeatureDetector.filterByResponseScore(features, 3);
        Assert.assertEquals(3, top3.getNumKeypoints());
        Assert.assertEquals(2.0, top3.getKeyPoints().get(1).getX(), 0.0);
    }

    private static Keypoint assertBlobFound(ImageFeature features, double blobSigma) {
        Assert.assertTrue("no keypoint for blob with sigma " + blobSigma, features.getNumKeypoints() > 0);
        Keypoint strongest = features.getKeyPoints().get(strongestIndex(features));
        Assert.assertEquals("blob centre x", 64.25, strongest.getX(), 2.0);
        Assert.assertEquals("blob centre y", 64.25, strongest.getY(), 2.0);
        for (Keypoint keypoint : features.getKeyPoints()) {
            double d = Math.hypot(keypoint.getX() - 64.25, keypoint.getY() - 64.25);
            Assert.assertTrue("keypoint away from the blob: " + keypoint, d < 4 * blobSigma);
        }
        return strongest;
    }

    private static int strongestIndex(ImageFeature features) {
        int best = 0;
        for (int i = 1; i < features.getNumKeypoints(); i++) {
            if (features.getKeyPoints().get(i).getResponse() > features.getKeyPoints().get(best).getResponse()) {
                best = i;
            }
        }
        return best;
    }

    private static List<Integer> near(ImageFeature features, double x, double y, double radius) {
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < features.getNumKeypoints(); i++) {
            Keypoint keypoint = features.getKeyPoints().get(i);
            if (Math.hypot(keypoint.getX() - x, keypoint.getY() - y) <= radius) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    private static double distance(float[] a, float[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    /**
     * Main blob at (row, col) with a weaker blob below and to its right, so the pattern has no symmetry.
     */
    private static double[][] twoBlobs(int size, double row, double col) {
        double[][] image = SyntheticImages.blob(size, size, row, col, 5);
        return SyntheticImages.addBlob(image, row + 4, col + 8, 3, 100);
    }
}
