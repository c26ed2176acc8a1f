package com.featuredetect.imageOperator;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Chuyển ảnh màu sang ma trận xám: gray = 0.299 R + 0.587 G + 0.114 B.
 * The matrix is row-major, {@code gray[row][col]}, on a 0-255 scale.
 */
public class ColourImageToGray {

    private ColourImageToGray() {
    }

    public static double[][] grayMatrix(BufferedImage picture) {
        int width = picture.getWidth();
        int height = picture.getHeight();
        double[][] matrix = new double[height][width];
        for (int h = 0; h < height; h++) {
            for (int w = 0; w < width; w++) {
                int rgb = picture.getRGB(w, h);
                int red = (rgb >> 16) & 0xFF;
                int green = (rgb >> 8) & 0xFF;
                int blue = rgb & 0xFF;
                matrix[h][w] = 0.299 * red + 0.587 * green + 0.114 * blue;
            }
        }
        return matrix;
    }

    public static double[][] grayMatrix(byte[] encodedImage) throws IOException {
        BufferedImage picture = ImageIO.read(new ByteArrayInputStream(encodedImage));
        if (picture == null) {
            throw new IOException("image format is not supported");
        }
        return grayMatrix(picture);
    }
}
