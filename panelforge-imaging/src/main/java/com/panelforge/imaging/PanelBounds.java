package com.panelforge.imaging;

/**
 * Panel rectangle in source-image pixel space. {@code right} and {@code bottom} are exclusive.
 */
public record PanelBounds(int left, int top, int right, int bottom) {

    public PanelBounds {
        if (right < left || bottom < top) {
            throw new IllegalArgumentException("Invalid bounds (" + left + ", " + top + ", " + right + ", " + bottom + ")");
        }
    }

    public int width() {
        return right - left;
    }

    public int height() {
        return bottom - top;
    }
}
