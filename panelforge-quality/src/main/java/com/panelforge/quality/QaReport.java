package com.panelforge.quality;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;

/**
 * Content of {@code qa_report.json}. Holds no paths or timestamps, so two runs over the same plan
 * produce identical reports.
 */
@JsonPropertyOrder({"panel_metrics", "aggregate_stats", "validation_status", "issues"})
public record QaReport(
        @JsonProperty("panel_metrics") List<PanelMetrics> panelMetrics,
        @JsonProperty("aggregate_stats") AggregateStats aggregateStats,
        @JsonProperty("validation_status") ValidationStatus validationStatus,
        @JsonProperty("issues") List<QaIssue> issues) {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public QaReport {
        panelMetrics = List.copyOf(panelMetrics);
        issues = List.copyOf(issues);
    }

    public String toJson() throws JsonProcessingException {
        return MAPPER.writeValueAsString(this);
    }
}
