package com.featuredetect.imageOperator;

/****
 * Trong các giai đoạn xây dựng Octave Pyramid, ảnh ban đầu được phóng to gấp đôi bằng nội suy song tuyến tính,
 * còn ảnh gốc của mỗi octave tiếp theo được thu nhỏ bằng lấy mẫu láng giềng gần nhất.
 * Both follow OpenCV's resize conventions (pixel centres at +0.5, edge clamping).
 */
public class Up_DownSample {

    private Up_DownSample() {
    }

    /**
     * Bilinear resize with half-pixel centres, as cv::resize INTER_LINEAR.
     * @param originalImage ma trận ảnh gốc 2 chiều.
     */
    public static double[][] upsampleWithLinearInterpolation(double[][] originalImage, int newWidth, int newHeight) {
        int originalHeight = originalImage.length;
        int originalWidth = originalImage[0].length;

        int[] x0 = new int[newWidth];
        int[] x1 = new int[newWidth];
        double[] fx = new double[newWidth];
        computeLinearTaps(originalWidth, newWidth, x0, x1, fx);

        int[] y0 = new int[newHeight];
        int[] y1 = new int[newHeight];
        double[] fy = new double[newHeight];
        computeLinearTaps(originalHeight, newHeight, y0, y1, fy);

        double[][] upsampledImage = new double[newHeight][newWidth];
        for (int y = 0; y < newHeight; y++) {
            double[] top = originalImage[y0[y]];
            double[] bottom = originalImage[y1[y]];
            double dy = fy[y];
            for (int x = 0; x < newWidth; x++) {
                double dx = fx[x];
                double topInterpolation = top[x0[x]] * (1 - dx) + top[x1[x]] * dx;
                double bottomInterpolation = bottom[x0[x]] * (1 - dx) + bottom[x1[x]] * dx;
                upsampledImage[y][x] = topInterpolation * (1 - dy) + bottomInterpolation * dy;
            }
        }
        return upsampledImage;
    }

    private static void computeLinearTaps(int sourceSize, int targetSize, int[] lower, int[] upper, double[] fraction) {
        double scale = (double) sourceSize / targetSize;
        for (int d = 0; d < targetSize; d++) {
            double f = (d + 0.5) * scale - 0.5;
            int s = (int) Math.floor(f);
            f -= s;
            if (s < 0) {
                s = 0;
                f = 0;
            }
            if (s >= sourceSize - 1) {
                s = sourceSize - 1;
                f = 0;
            }
            lower[d] = s;
            upper[d] = Math.min(s + 1, sourceSize - 1);
            fraction[d] = f;
        }
    }

    /**
     * Nearest neighbour resize, as cv::resize INTER_NEAREST: source index floor(d * src / dst).
     */
    public static double[][] downsample(double[][] image, int newWidth, int newHeight) {
        int height = image.length;
        int width = image[0].length;
        double scaleX = (double) width / newWidth;
        double scaleY = (double) height / newHeight;

        int[] columns = new int[newWidth];
        for (int c = 0; c < newWidth; c++) {
            columns[c] = Math.min((int) Math.floor(c * scaleX), width - 1);
        }

        double[][] newImage = new double[newHeight][newWidth];
        for (int r = 0; r < newHeight; r++) {
            double[] sourceRow = image[Math.min((int) Math.floor(r * scaleY), height - 1)];
            for (int c = 0; c < newWidth; c++) {
                newImage[r][c] = sourceRow[columns[c]];
            }
        }
        return newImage;
    }
}
