package com.panelforge.imaging;

import java.awt.image.BufferedImage;

/**
 * Pixel-exact region copies. Copies never share a raster with their source.
 */
final class Rasters {

    private Rasters() {
    }

    static BufferedImage copy(BufferedImage source, int x, int y, int width, int height) {
        int[] pixels = source.getRGB(x, y, width, height, null, 0, width);
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, width, height, pixels, 0, width);
        return out;
    }
}
