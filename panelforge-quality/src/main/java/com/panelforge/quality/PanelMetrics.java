package com.panelforge.quality;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Quality measurements of one panel. A panel that failed processing carries only its id and the
 * error; score, tier and ratio are absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"panel_id", "sharpness_score", "quality_tier", "aspect_ratio", "error"})
public record PanelMetrics(
        @JsonProperty("panel_id") String panelId,
        @JsonProperty("sharpness_score") Double sharpnessScore,
        @JsonProperty("quality_tier") QualityTier qualityTier,
        @JsonProperty("aspect_ratio") Double aspectRatio,
        @JsonProperty("error") String error) {

    public PanelMetrics {
        Objects.requireNonNull(panelId, "panelId");
    }

    public static PanelMetrics scored(String panelId, double sharpnessScore, double aspectRatio) {
        return new PanelMetrics(panelId, sharpnessScore, QualityTier.fromScore(sharpnessScore), aspectRatio, null);
    }

    public static PanelMetrics failed(String panelId, String error) {
        return new PanelMetrics(panelId, null, null, null, error == null ? "unknown error" : error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return sharpnessScore == null;
    }
}
