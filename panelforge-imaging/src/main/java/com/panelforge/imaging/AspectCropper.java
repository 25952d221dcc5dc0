package com.panelforge.imaging;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Normalizes a panel to a target aspect ratio (width / height) by center-fill cropping.
 * Never stretches or scales: the output is a centered sub-region of the input.
 * <p>
 * Inputs below the minimum viable size are first padded with black borders (centered) so
 * the crop can never produce an empty region. Because pixel sizes are integers, a crop whose
 * rounded size misses the target by {@value #RATIO_TOLERANCE} or more is tightened on the other
 * axis until it fits; the output ratio is always within that tolerance.
 */
public class AspectCropper {

    public static final int MIN_WIDTH = 64;
    public static final int MIN_HEIGHT = 36;
    public static final double RATIO_TOLERANCE = 0.01;

    private final int minWidth;
    private final int minHeight;

    public AspectCropper() {
        this(MIN_WIDTH, MIN_HEIGHT);
    }

    public AspectCropper(int minWidth, int minHeight) {
        if (minWidth < 1 || minHeight < 1) {
            throw new IllegalArgumentException("minimum size must be positive");
        }
        this.minWidth = minWidth;
        this.minHeight = minHeight;
    }

    /**
     * Pads (if needed) and center-crops {@code image} to {@code targetRatio}.
     *
     * @throws CropException when no region of that ratio fits the (padded) panel
     */
    public BufferedImage centerFillCrop(BufferedImage image, double targetRatio) {
        Objects.requireNonNull(image, "image");
        BufferedImage padded = padToMinimum(image);
        PanelBounds crop = computeCrop(padded.getWidth(), padded.getHeight(), targetRatio);
        return Rasters.copy(padded, crop.left(), crop.top(), crop.width(), crop.height());
    }

    /**
     * Centered crop rectangle for a {@code width} x {@code height} image. Pure geometry; no padding.
     */
    public PanelBounds computeCrop(int width, int height, double targetRatio) {
        if (!(targetRatio > 0) || Double.isInfinite(targetRatio)) {
            throw new IllegalArgumentException("target ratio must be positive, got " + targetRatio);
        }
        if (width < 1 || height < 1) {
            throw new CropException("cannot crop an empty " + width + "x" + height + " image");
        }
        double currentRatio = (double) width / height;
        int cropWidth;
        int cropHeight;
        if (currentRatio > targetRatio) {
            // too wide: keep height, narrow the width
            cropWidth = clamp((int) Math.round(height * targetRatio), width);
            cropHeight = height;
        } else {
            // too tall (or exact): keep width, shorten the height
            cropWidth = width;
            cropHeight = clamp((int) Math.round(width / targetRatio), height);
        }

        if (deviation(cropWidth, cropHeight, targetRatio) >= RATIO_TOLERANCE) {
            int fittedWidth = -1;
            int fittedHeight = -1;
            for (int h = cropHeight; h >= 1; h--) {
                int w = (int) Math.round(h * targetRatio);
                if (w >= 1 && w <= cropWidth && deviation(w, h, targetRatio) < RATIO_TOLERANCE) {
                    fittedWidth = w;
                    fittedHeight = h;
                    break;
                }
            }
            if (fittedWidth < 0) {
                throw new CropException("no " + targetRatio + " crop fits a " + width + "x" + height + " panel");
            }
            cropWidth = fittedWidth;
            cropHeight = fittedHeight;
        }

        int left = (width - cropWidth) / 2;
        int top = (height - cropHeight) / 2;
        return new PanelBounds(left, top, left + cropWidth, top + cropHeight);
    }

    /**
     * Returns {@code image} when it already meets the minimum size, otherwise a black canvas of at
     * least the minimum size with {@code image} centered on it.
     */
    public BufferedImage padToMinimum(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (width >= minWidth && height >= minHeight) {
            return image;
        }
        int paddedWidth = Math.max(width, minWidth);
        int paddedHeight = Math.max(height, minHeight);
        BufferedImage canvas = new BufferedImage(paddedWidth, paddedHeight, BufferedImage.TYPE_INT_RGB);
        if (width > 0 && height > 0) {
            int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
            canvas.setRGB((paddedWidth - width) / 2, (paddedHeight - height) / 2, width, height, pixels, 0, width);
        }
        return canvas;
    }

    private static double deviation(int width, int height, double targetRatio) {
        return Math.abs((double) width / height - targetRatio);
    }

    private static int clamp(int value, int max) {
        return Math.max(1, Math.min(value, max));
    }
}
