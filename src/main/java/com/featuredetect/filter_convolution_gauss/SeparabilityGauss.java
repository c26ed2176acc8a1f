package com.featuredetect.filter_convolution_gauss;

/**
 * Separable Gaussian filtering of a gray matrix.
 * The kernel size and the reflect-101 border follow OpenCV's GaussianBlur for floating point images,
 * so this filter and the OpenCV backed one can be swapped inside the same pyramid.
 */
public class SeparabilityGauss {

    private SeparabilityGauss() {
    }

    /**
     * Kernel size used for a given sigma: cvRound(sigma * 4 * 2 + 1) | 1.
     */
    public static int kernelSize(double sigma) {
        return ((int) Math.rint(sigma * 8.0 + 1.0)) | 1;
    }

    /**
     * Tạo một hạt nhân Gaussian 1D đã được chuẩn hóa.
     *
     * @param sigma Độ lệch chuẩn, phải dương.
     * @return hạt nhân có tổng bằng 1.
     */
    public static double[] create1DGaussianKernel(double sigma) {
        int size = kernelSize(sigma);
        double[] kernel = new double[size];
        double scale2X = -0.5 / (sigma * sigma);
        double sum = 0;
        for (int i = 0; i < size; i++) {
            double x = i - (size - 1) * 0.5;
            double value = Math.exp(scale2X * x * x);
            kernel[i] = value;
            sum += value;
        }
        for (int i = 0; i < size; i++) kernel[i] /= sum;
        return kernel;
    }

    /**
     * Maps an out-of-range index back into [0, length) with reflect-101 (gfedcb|abcdefgh|gfedcba).
     */
    public static int reflect101(int p, int length) {
        if (length == 1) {
            return 0;
        }
        while (p < 0 || p >= length) {
            if (p < 0) {
                p = -p;
            } else {
                p = 2 * length - 2 - p;
            }
        }
        return p;
    }

    public static double[][] seperabilityGauss(double[][] img, double sigma) {
        return seperabilityGauss(img, sigma, sigma);
    }

    public static double[][] seperabilityGauss(double[][] img, double sigmaX, double sigmaY) {
        int height = img.length;
        int width = img[0].length;

        double[] kernelX = create1DGaussianKernel(sigmaX);
        double[] kernelY = create1DGaussianKernel(sigmaY);
        int radiusX = kernelX.length / 2;
        int radiusY = kernelY.length / 2;

        double[][] tempImage = new double[height][width];
        double[][] outputImage = new double[height][width];

        // Lượt 1: Lọc theo chiều ngang
        for (int y = 0; y < height; y++) {
            double[] row = img[y];
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = 0; k < kernelX.length; k++) {
                    int pixelX = x + k - radiusX;
                    if (pixelX < 0 || pixelX >= width) pixelX = reflect101(pixelX, width);
                    sum += row[pixelX] * kernelX[k];
                }
                tempImage[y][x] = sum;
            }
        }

        // Lượt 2: Lọc theo chiều dọc
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = 0; k < kernelY.length; k++) {
                    int pixelY = y + k - radiusY;
                    if (pixelY < 0 || pixelY >= height) pixelY = reflect101(pixelY, height);
                    sum += tempImage[pixelY][x] * kernelY[k];
                }
                outputImage[y][x] = sum;
            }
        }
        return outputImage;
    }
}
