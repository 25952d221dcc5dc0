package com.panelforge.imaging;

/**
 * Thrown when no crop region of the requested aspect ratio fits the panel. Treated as a
 * per-panel failure by the engine.
 */
public final class CropException extends RuntimeException {

    public CropException(String message) {
        super(message);
    }
}
