package com.panelforge.quality;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SharpnessScorerTest {

    private static final int SIZE = 64;

    private final SharpnessScorer scorer = new SharpnessScorer();

    @Test
    void score_uniformImageIsZero() {
        assertEquals(0.0, scorer.score(gray(new int[SIZE][SIZE])), 0.0);
    }

    @Test
    void score_singleVerticalEdge() {
        // one column at -128, one at +128, everything else 0: variance = 2 * 128^2 / 64
        assertEquals(512.0, scorer.score(gray(edge())), 1e-9);
    }

    @Test
    void score_unsharpMaskAboveOriginalAboveBlur() {
        int[][] original = edge();
        int[][] blurred = boxBlur(original);
        int[][] sharpened = unsharpMask(original, blurred);

        double sharp = scorer.score(gray(sharpened));
        double base = scorer.score(gray(original));
        double soft = scorer.score(gray(blurred));

        assertTrue(sharp > base, sharp + " > " + base);
        assertTrue(base > soft, base + " > " + soft);
        assertTrue(sharp > QualityTier.ACCEPTABLE_FROM);
    }

    @Test
    void score_usesLumaWeights() {
        BufferedImage red = new BufferedImage(3, 3, BufferedImage.TYPE_INT_RGB);
        red.setRGB(1, 1, 0xFF0000);
        BufferedImage blue = new BufferedImage(3, 3, BufferedImage.TYPE_INT_RGB);
        blue.setRGB(1, 1, 0x0000FF);

        assertTrue(scorer.score(red) > scorer.score(blue));
    }

    @Test
    void reflect_mirrorsWithoutRepeatingEdge() {
        assertEquals(1, SharpnessScorer.reflect(-1, 5));
        assertEquals(3, SharpnessScorer.reflect(5, 5));
        assertEquals(2, SharpnessScorer.reflect(2, 5));
        assertEquals(0, SharpnessScorer.reflect(-1, 1));
    }

    private static int[][] edge() {
        int[][] v = new int[SIZE][SIZE];
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                v[y][x] = x < SIZE / 2 ? 64 : 192;
            }
        }
        return v;
    }

    private static int[][] boxBlur(int[][] src) {
        int[][] out = new int[SIZE][SIZE];
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                int sum = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int yy = Math.min(Math.max(y + dy, 0), SIZE - 1);
                        int xx = Math.min(Math.max(x + dx, 0), SIZE - 1);
                        sum += src[yy][xx];
                    }
                }
                out[y][x] = (int) Math.round(sum / 9.0);
            }
        }
        return out;
    }

    private static int[][] unsharpMask(int[][] src, int[][] blurred) {
        int[][] out = new int[SIZE][SIZE];
        for (int y = 0; y < SIZE; y++) {
            for (int x = 0; x < SIZE; x++) {
                out[y][x] = Math.min(255, Math.max(0, 2 * src[y][x] - blurred[y][x]));
            }
        }
        return out;
    }

    private static BufferedImage gray(int[][] values) {
        int h = values.length;
        int w = values[0].length;
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int v = values[y][x];
                img.setRGB(x, y, (v << 16) | (v << 8) | v);
            }
        }
        return img;
    }
}
