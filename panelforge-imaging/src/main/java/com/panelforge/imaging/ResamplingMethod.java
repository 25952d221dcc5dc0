package com.panelforge.imaging;

import java.awt.RenderingHints;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Interpolation used by {@link PanelUpscaler}. {@link #LANCZOS} has no Java2D hint and is resampled
 * by {@link LanczosResampler}; the others are drawn with their {@link RenderingHints} value.
 */
public enum ResamplingMethod {
    NEAREST(RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR),
    BILINEAR(RenderingHints.VALUE_INTERPOLATION_BILINEAR),
    BICUBIC(RenderingHints.VALUE_INTERPOLATION_BICUBIC),
    LANCZOS(null);

    private final Object interpolationHint;

    ResamplingMethod(Object interpolationHint) {
        this.interpolationHint = interpolationHint;
    }

    Object interpolationHint() {
        return interpolationHint;
    }

    /**
     * Case-insensitive lookup ({@code "lanczos"}, {@code "Bilinear"}, ...).
     *
     * @throws IllegalArgumentException for an unknown name, listing the valid ones
     */
    public static ResamplingMethod fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (ResamplingMethod method : values()) {
                if (method.name().equals(normalized)) {
                    return method;
                }
            }
        }
        String valid = Arrays.stream(values()).map(m -> m.name().toLowerCase(Locale.ROOT)).collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Invalid upscale method: " + name + " (use one of: " + valid + ")");
    }
}
