package com.panelforge.quality;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One fired quality rule. {@code panelId} is null for run-level issues.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"severity", "panel_id", "code", "message"})
public record QaIssue(
        @JsonProperty("severity") Severity severity,
        @JsonProperty("panel_id") String panelId,
        @JsonProperty("code") String code,
        @JsonProperty("message") String message) {

    public static final String MEAN_SHARPNESS_BELOW_FLOOR = "mean_sharpness_below_floor";
    public static final String NO_SCORED_PANELS = "no_scored_panels";
    public static final String ASPECT_RATIO_DEVIATION = "aspect_ratio_deviation";
    public static final String PANEL_FAILED = "panel_failed";
    public static final String SOFT_PANEL = "soft_panel";
    public static final String OVERSHARPEN_RISK = "oversharpen_risk";

    public enum Severity {
        FAIL,
        WARN
    }

    public static QaIssue fail(String panelId, String code, String message) {
        return new QaIssue(Severity.FAIL, panelId, code, message);
    }

    public static QaIssue warn(String panelId, String code, String message) {
        return new QaIssue(Severity.WARN, panelId, code, message);
    }
}
