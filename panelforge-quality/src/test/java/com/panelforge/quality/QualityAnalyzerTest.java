package com.panelforge.quality;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class QualityAnalyzerTest {

    private static final double TARGET = 16.0 / 9.0;
    private static final double CROPPED_RATIO = 300.0 / 169.0;

    private final QualityAnalyzer analyzer = new QualityAnalyzer(TARGET);

    @Test
    void analyze_allGoodPanelsPass() {
        QaReport report = analyzer.analyze(List.of(
                PanelMetrics.scored("panel_02", 200.0, CROPPED_RATIO),
                PanelMetrics.scored("panel_01", 300.0, CROPPED_RATIO)));

        assertEquals(ValidationStatus.PASSED, report.validationStatus());
        assertTrue(report.issues().isEmpty());
        assertEquals("panel_01", report.panelMetrics().get(0).panelId());
        assertEquals(250.0, report.aggregateStats().mean(), 1e-9);
        assertEquals(200.0, report.aggregateStats().min(), 1e-9);
        assertEquals(300.0, report.aggregateStats().max(), 1e-9);
        assertEquals(50.0, report.aggregateStats().std(), 1e-9);
    }

    @Test
    void analyze_softPanelNeedsReview() {
        QaReport report = analyzer.analyze(List.of(
                PanelMetrics.scored("a", 80.0, CROPPED_RATIO),
                PanelMetrics.scored("b", 200.0, CROPPED_RATIO)));

        assertEquals(ValidationStatus.REVIEW_NEEDED, report.validationStatus());
        assertEquals(1, report.issues().size());
        assertEquals(QaIssue.SOFT_PANEL, report.issues().get(0).code());
        assertEquals("a", report.issues().get(0).panelId());
    }

    @Test
    void analyze_oversharpenPanelNeedsReview() {
        QaReport report = analyzer.analyze(List.of(PanelMetrics.scored("a", 500.0, CROPPED_RATIO)));

        assertEquals(ValidationStatus.REVIEW_NEEDED, report.validationStatus());
        assertEquals(QaIssue.OVERSHARPEN_RISK, report.issues().get(0).code());
    }

    @Test
    void analyze_lowMeanFails() {
        QaReport report = analyzer.analyze(List.of(
                PanelMetrics.scored("a", 10.0, CROPPED_RATIO),
                PanelMetrics.scored("b", 60.0, CROPPED_RATIO)));

        assertEquals(ValidationStatus.FAILED, report.validationStatus());
        assertEquals(QaIssue.MEAN_SHARPNESS_BELOW_FLOOR, report.issues().get(0).code());
        assertEquals(QaIssue.Severity.FAIL, report.issues().get(0).severity());
    }

    @Test
    void analyze_aspectDeviationAboveFivePercentFails() {
        QaReport report = analyzer.analyze(List.of(
                PanelMetrics.scored("square", 200.0, 1.0),
                PanelMetrics.scored("close", 200.0, TARGET * 1.04)));

        assertEquals(ValidationStatus.FAILED, report.validationStatus());
        assertEquals(1, report.issues().size());
        assertEquals("square", report.issues().get(0).panelId());
        assertEquals(QaIssue.ASPECT_RATIO_DEVIATION, report.issues().get(0).code());
    }

    @Test
    void analyze_failedPanelIsListedButExcludedFromStats() {
        QaReport report = analyzer.analyze(List.of(
                PanelMetrics.scored("a", 200.0, CROPPED_RATIO),
                PanelMetrics.failed("b", "crop failed")));

        assertEquals(ValidationStatus.FAILED, report.validationStatus());
        assertEquals(2, report.panelMetrics().size());
        assertEquals(1, report.aggregateStats().scoredPanels());
        assertEquals(200.0, report.aggregateStats().mean(), 1e-9);
        assertEquals(QaIssue.PANEL_FAILED, report.issues().get(0).code());
    }

    @Test
    void analyze_noScoredPanelsFails() {
        QaReport report = analyzer.analyze(List.of(PanelMetrics.failed("a", "boom")));

        assertEquals(ValidationStatus.FAILED, report.validationStatus());
        assertEquals(QaIssue.NO_SCORED_PANELS, report.issues().get(0).code());
        assertEquals(0, report.aggregateStats().scoredPanels());
    }

    @Test
    void measure_recordsRatioAndTier() {
        BufferedImage flat = new BufferedImage(300, 169, BufferedImage.TYPE_INT_RGB);

        PanelMetrics metrics = analyzer.measure("flat", flat);

        assertEquals(0.0, metrics.sharpnessScore(), 0.0);
        assertEquals(QualityTier.TOO_SOFT, metrics.qualityTier());
        assertEquals(CROPPED_RATIO, metrics.aspectRatio(), 1e-12);
        assertFalse(metrics.isFailed());
    }

    @Test
    void toJson_usesReportFieldNames() throws Exception {
        QaReport report = analyzer.analyze(List.of(
                PanelMetrics.scored("a", 200.0, CROPPED_RATIO),
                PanelMetrics.failed("b", "crop failed")));

        JsonNode json = new ObjectMapper().readTree(report.toJson());

        assertEquals("FAILED", json.get("validation_status").asText());
        assertEquals("good", json.get("panel_metrics").get(0).get("quality_tier").asText());
        assertTrue(json.get("panel_metrics").get(0).has("aspect_ratio"));
        assertFalse(json.get("panel_metrics").get(0).has("error"));
        assertFalse(json.get("panel_metrics").get(1).has("sharpness_score"));
        assertEquals("crop failed", json.get("panel_metrics").get(1).get("error").asText());
        assertTrue(json.get("aggregate_stats").has("std_sharpness"));
        assertFalse(json.get("panel_metrics").get(0).has("failed"));
    }
}
