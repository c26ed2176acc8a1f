package com.featuredetect.imageOperator;

import org.bytedeco.javacpp.indexer.DoubleIndexer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Size;

import static org.bytedeco.opencv.global.opencv_core.BORDER_REFLECT_101;
import static org.bytedeco.opencv.global.opencv_core.CV_64F;
import static org.bytedeco.opencv.global.opencv_imgproc.GaussianBlur;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_NEAREST;

/**
 * Image primitives delegated to OpenCV through the JavaCPP presets.
 * Every call copies the gray matrix into a CV_64F {@link Mat} and back.
 */
public class OpenCvImageOperators implements ImageOperators {

    @Override
    public double[][] resize(double[][] image, int width, int height, Interpolation interpolation) {
        JavaImageOperators.checkTargetSize(width, height);
        int flag = switch (interpolation) {
            case LINEAR -> INTER_LINEAR;
            case NEAREST -> INTER_NEAREST;
        };
        try (Mat src = toMat(image); Mat dst = new Mat(); Size size = new Size(width, height)) {
            org.bytedeco.opencv.global.opencv_imgproc.resize(src, dst, size, 0, 0, flag);
            return toMatrix(dst);
        }
    }

    @Override
    public double[][] gaussianBlur(double[][] image, double sigmaX, double sigmaY) {
        if (sigmaX <= 0 || sigmaY <= 0) {
            throw new IllegalArgumentException("blur sigma must be positive, got " + sigmaX + ", " + sigmaY);
        }
        try (Mat src = toMat(image); Mat dst = new Mat(); Size automatic = new Size(0, 0)) {
            GaussianBlur(src, dst, automatic, sigmaX, sigmaY, BORDER_REFLECT_101);
            return toMatrix(dst);
        }
    }

    @Override
    public double[][] subtract(double[][] a, double[][] b) {
        try (Mat first = toMat(a); Mat second = toMat(b); Mat dst = new Mat()) {
            org.bytedeco.opencv.global.opencv_core.subtract(first, second, dst);
            return toMatrix(dst);
        }
    }

    static Mat toMat(double[][] image) {
        int rows = image.length;
        int cols = image[0].length;
        Mat mat = new Mat(rows, cols, CV_64F);
        DoubleIndexer indexer = mat.createIndexer();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                indexer.put(r, c, image[r][c]);
            }
        }
        indexer.release();
        return mat;
    }

    static double[][] toMatrix(Mat mat) {
        int rows = mat.rows();
        int cols = mat.cols();
        double[][] image = new double[rows][cols];
        DoubleIndexer indexer = mat.createIndexer();
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                image[r][c] = indexer.get(r, c);
            }
        }
        indexer.release();
        return image;
    }
}
