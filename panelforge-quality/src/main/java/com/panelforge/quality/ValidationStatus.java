package com.panelforge.quality;

/** Overall outcome of a run's quality gate. */
public enum ValidationStatus {
    PASSED,
    REVIEW_NEEDED,
    FAILED
}
