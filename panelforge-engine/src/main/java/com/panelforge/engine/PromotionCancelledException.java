package com.panelforge.engine;

/**
 * Thrown when a run is cancelled before its reports are written. Panel files already on disk are
 * complete and are reproduced byte-for-byte on retry; no aggregate report exists for the run.
 */
public final class PromotionCancelledException extends RuntimeException {

    public PromotionCancelledException(String message) {
        super(message);
    }

    public PromotionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
