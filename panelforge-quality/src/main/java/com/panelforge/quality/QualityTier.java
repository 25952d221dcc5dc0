package com.panelforge.quality;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sharpness band of a panel. Bands are half-open: {@code [lower, upper)}.
 */
public enum QualityTier {
    TOO_SOFT("too_soft"),
    ACCEPTABLE("acceptable"),
    GOOD("good"),
    OVERSHARPEN_RISK("oversharpen_risk");

    public static final double ACCEPTABLE_FROM = 50.0;
    public static final double GOOD_FROM = 100.0;
    public static final double OVERSHARPEN_FROM = 500.0;

    private final String label;

    QualityTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static QualityTier fromScore(double score) {
        if (score < ACCEPTABLE_FROM) {
            return TOO_SOFT;
        }
        if (score < GOOD_FROM) {
            return ACCEPTABLE;
        }
        if (score < OVERSHARPEN_FROM) {
            return GOOD;
        }
        return OVERSHARPEN_RISK;
    }
}
