package com.panelforge.imaging;

import java.io.IOException;

/**
 * Thrown when an image file exists but cannot be decoded (unsupported format or corrupt data).
 */
public final class ImageReadException extends IOException {

    public ImageReadException(String message) {
        super(message);
    }

    public ImageReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
