package com.panelforge.imaging;

import java.awt.image.BufferedImage;

/**
 * Separable Lanczos-3 resize: a horizontal pass into a float buffer, then a vertical pass.
 * Java2D has no Lanczos interpolation hint, so {@link PanelUpscaler} routes {@link ResamplingMethod#LANCZOS} here.
 * Taps outside the image are clamped to the edge pixel and every weight set is normalized to sum to 1.
 */
final class LanczosResampler {

    static final int LOBES = 3;

    private LanczosResampler() {
    }

    static BufferedImage resize(BufferedImage src, int width, int height) {
        int srcWidth = src.getWidth();
        int srcHeight = src.getHeight();
        int[] pixels = src.getRGB(0, 0, srcWidth, srcHeight, null, 0, srcWidth);

        Taps horizontal = Taps.compute(srcWidth, width);
        double[] wide = new double[width * srcHeight * 3];
        for (int y = 0; y < srcHeight; y++) {
            int rowOffset = y * srcWidth;
            for (int x = 0; x < width; x++) {
                double r = 0;
                double g = 0;
                double b = 0;
                for (int k = 0; k < horizontal.count; k++) {
                    int rgb = pixels[rowOffset + horizontal.index[x][k]];
                    double w = horizontal.weight[x][k];
                    r += w * ((rgb >> 16) & 0xFF);
                    g += w * ((rgb >> 8) & 0xFF);
                    b += w * (rgb & 0xFF);
                }
                int at = (y * width + x) * 3;
                wide[at] = r;
                wide[at + 1] = g;
                wide[at + 2] = b;
            }
        }

        Taps vertical = Taps.compute(srcHeight, height);
        int[] out = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double r = 0;
                double g = 0;
                double b = 0;
                for (int k = 0; k < vertical.count; k++) {
                    int at = (vertical.index[y][k] * width + x) * 3;
                    double w = vertical.weight[y][k];
                    r += w * wide[at];
                    g += w * wide[at + 1];
                    b += w * wide[at + 2];
                }
                out[y * width + x] = (clamp(r) << 16) | (clamp(g) << 8) | clamp(b);
            }
        }

        BufferedImage result = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        result.setRGB(0, 0, width, height, out, 0, width);
        return result;
    }

    static double kernel(double x) {
        if (x == 0.0) {
            return 1.0;
        }
        if (Math.abs(x) >= LOBES) {
            return 0.0;
        }
        double px = Math.PI * x;
        return LOBES * Math.sin(px) * Math.sin(px / LOBES) / (px * px);
    }

    private static int clamp(double channel) {
        long v = Math.round(channel);
        return (int) Math.max(0, Math.min(255, v));
    }

    /** Source indices and normalized weights for each output coordinate along one axis. */
    private static final class Taps {
        final int count;
        final int[][] index;
        final double[][] weight;

        private Taps(int count, int[][] index, double[][] weight) {
            this.count = count;
            this.index = index;
            this.weight = weight;
        }

        // Upscale only: the kernel is never widened, so 2 * LOBES taps cover its support.
        static Taps compute(int srcLength, int dstLength) {
            int count = 2 * LOBES;
            int[][] index = new int[dstLength][count];
            double[][] weight = new double[dstLength][count];
            double scale = (double) srcLength / dstLength;
            for (int o = 0; o < dstLength; o++) {
                double center = (o + 0.5) * scale - 0.5;
                int first = (int) Math.floor(center) - LOBES + 1;
                double total = 0;
                for (int k = 0; k < count; k++) {
                    int i = first + k;
                    double w = kernel(center - i);
                    index[o][k] = Math.max(0, Math.min(srcLength - 1, i));
                    weight[o][k] = w;
                    total += w;
                }
                for (int k = 0; k < count; k++) {
                    weight[o][k] /= total;
                }
            }
            return new Taps(count, index, weight);
        }
    }
}
