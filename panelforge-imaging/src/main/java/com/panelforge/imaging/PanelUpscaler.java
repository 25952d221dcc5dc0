package com.panelforge.imaging;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Integer-factor upscale of a cropped panel, preserving its aspect ratio exactly.
 */
public final class PanelUpscaler {

    public static final int MAX_FACTOR = 4;

    private final int factor;
    private final ResamplingMethod method;

    public PanelUpscaler(int factor, ResamplingMethod method) {
        if (factor < 1 || factor > MAX_FACTOR) {
            throw new IllegalArgumentException("Invalid scale factor: " + factor + " (must be 1.." + MAX_FACTOR + ")");
        }
        this.factor = factor;
        this.method = Objects.requireNonNull(method, "method");
    }

    public int getFactor() {
        return factor;
    }

    public ResamplingMethod getMethod() {
        return method;
    }

    /** Returns {@code image} itself when the factor is 1. */
    public BufferedImage upscale(BufferedImage image) {
        Objects.requireNonNull(image, "image");
        if (factor == 1) {
            return image;
        }
        int width = image.getWidth() * factor;
        int height = image.getHeight() * factor;
        if (method == ResamplingMethod.LANCZOS) {
            return LanczosResampler.resize(image, width, height);
        }
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = out.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, method.interpolationHint());
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.drawImage(image, 0, 0, width, height, null);
        } finally {
            g2d.dispose();
        }
        return out;
    }
}
