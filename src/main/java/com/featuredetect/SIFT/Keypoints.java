package com.featuredetect.SIFT;

import java.util.ArrayList;
import java.util.List;

/**
 * Xử lý danh sách keypoints sau khi gán hướng: loại bỏ trùng lặp và đưa về kích thước ảnh gốc.
 */
public class Keypoints {

    private Keypoints() {
    }

    /**
     * Sorts by {@link Keypoint#BY_ALL} and keeps the first keypoint of every run with identical
     * position, size and angle. Applying it to its own output returns an equal list.
     */
    public static List<Keypoint> removeDuplicateKeypoints(List<Keypoint> keypoints) {
        List<Keypoint> sorted = new ArrayList<>(keypoints);
        sorted.sort(Keypoint.BY_ALL);
        if (sorted.size() < 2) {
            return sorted;
        }

        List<Keypoint> uniqueKeypoints = new ArrayList<>(sorted.size());
        uniqueKeypoints.add(sorted.get(0));
        for (int i = 1; i < sorted.size(); i++) {
            Keypoint lastUniqueKeypoint = uniqueKeypoints.get(uniqueKeypoints.size() - 1);
            Keypoint nextKeypoint = sorted.get(i);
            if (!lastUniqueKeypoint.sameFeature(nextKeypoint)) {
                uniqueKeypoints.add(nextKeypoint);
            }
        }
        return uniqueKeypoints;
    }

    /**
     * Undoes the initial 2x upsample on every keypoint.
     */
    public static List<Keypoint> convertToInputImageSize(List<Keypoint> keypoints) {
        List<Keypoint> converted = new ArrayList<>(keypoints.size());
        for (Keypoint keypoint : keypoints) {
            converted.add(keypoint.toInputImageFrame());
        }
        return converted;
    }
}
