package com.panelforge.quality;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Laplacian-variance focus measure.
 * <p>
 * The image is reduced to luma ({@code (299 R + 587 G + 114 B) / 1000}), convolved with the 4-neighbour
 * Laplacian {@code [[0,1,0],[1,-4,1],[0,1,0]]} using reflect-101 borders ({@code dcb|abcd|cba}), and the
 * population variance of the response is returned. Summation runs in fixed row-major order so the
 * score is bit-identical for identical pixels.
 */
public final class SharpnessScorer {

    public double score(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        int width = image.getWidth();
        int height = image.getHeight();
        double[] luma = toLuma(image, width, height);

        double[] response = new double[width * height];
        double sum = 0.0;
        for (int y = 0; y < height; y++) {
            int up = reflect(y - 1, height) * width;
            int down = reflect(y + 1, height) * width;
            int row = y * width;
            for (int x = 0; x < width; x++) {
                int left = reflect(x - 1, width);
                int right = reflect(x + 1, width);
                double value = luma[up + x] + luma[down + x] + luma[row + left] + luma[row + right] - 4.0 * luma[row + x];
                response[row + x] = value;
                sum += value;
            }
        }
        double mean = sum / response.length;
        double squares = 0.0;
        for (double value : response) {
            double d = value - mean;
            squares += d * d;
        }
        return squares / response.length;
    }

    private static double[] toLuma(BufferedImage image, int width, int height) {
        int[] rgb = image.getRGB(0, 0, width, height, null, 0, width);
        double[] luma = new double[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            int p = rgb[i];
            int r = (p >> 16) & 0xff;
            int g = (p >> 8) & 0xff;
            int b = p & 0xff;
            luma[i] = (299 * r + 587 * g + 114 * b) / 1000.0;
        }
        return luma;
    }

    static int reflect(int i, int n) {
        if (n == 1) {
            return 0;
        }
        if (i < 0) {
            return -i;
        }
        if (i >= n) {
            return 2 * n - 2 - i;
        }
        return i;
    }
}
