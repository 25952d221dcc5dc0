package com.panelforge.engine;

import com.panelforge.quality.ValidationStatus;

/**
 * Run lifecycle: {@code VALIDATING_INPUT -> PROCESSING_PANELS -> AGGREGATING -> PASSED | REVIEW_NEEDED | FAILED}.
 */
public enum RunState {
    VALIDATING_INPUT,
    PROCESSING_PANELS,
    AGGREGATING,
    PASSED,
    REVIEW_NEEDED,
    FAILED;

    static RunState fromStatus(ValidationStatus status) {
        return switch (status) {
            case PASSED -> PASSED;
            case REVIEW_NEEDED -> REVIEW_NEEDED;
            case FAILED -> FAILED;
        };
    }
}
