package com.panelforge.quality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Scores panels and applies the run-level quality gate.
 * <p>
 * FAIL: mean sharpness below {@value #MEAN_SHARPNESS_FLOOR}, a panel whose ratio deviates from the
 * target by more than {@value #MAX_ASPECT_DEVIATION} (relative), a panel that failed processing, or
 * no scored panel at all. WARN: a panel scoring below {@value #SOFT_WARN_BELOW} or in the
 * oversharpen band. Status is FAILED on any FAIL, REVIEW_NEEDED on any WARN, else PASSED.
 */
public final class QualityAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(QualityAnalyzer.class);

    public static final double MEAN_SHARPNESS_FLOOR = 50.0;
    public static final double SOFT_WARN_BELOW = QualityTier.GOOD_FROM;
    public static final double MAX_ASPECT_DEVIATION = 0.05;

    private final SharpnessScorer scorer;
    private final double targetRatio;

    public QualityAnalyzer(double targetRatio) {
        this(new SharpnessScorer(), targetRatio);
    }

    public QualityAnalyzer(SharpnessScorer scorer, double targetRatio) {
        if (!(targetRatio > 0)) {
            throw new IllegalArgumentException("target ratio must be positive, got " + targetRatio);
        }
        this.scorer = scorer;
        this.targetRatio = targetRatio;
    }

    /** Scores a cropped panel and records its post-crop ratio. */
    public PanelMetrics measure(String panelId, BufferedImage cropped) {
        double score = scorer.score(cropped);
        double ratio = (double) cropped.getWidth() / cropped.getHeight();
        PanelMetrics metrics = PanelMetrics.scored(panelId, score, ratio);
        log.debug("Panel scored | panelId={} | sharpness={} | tier={} | aspectRatio={}",
                panelId, score, metrics.qualityTier().getLabel(), ratio);
        return metrics;
    }

    /**
     * Builds the report for a finished run. Metrics are sorted by panel id first, so the report does
     * not depend on the order panels completed in.
     */
    public QaReport analyze(Collection<PanelMetrics> metrics) {
        List<PanelMetrics> sorted = new ArrayList<>(metrics);
        sorted.sort(Comparator.comparing(PanelMetrics::panelId));

        List<Double> scores = new ArrayList<>();
        List<QaIssue> panelIssues = new ArrayList<>();
        for (PanelMetrics m : sorted) {
            if (m.isFailed()) {
                panelIssues.add(QaIssue.fail(m.panelId(), QaIssue.PANEL_FAILED, "panel processing failed: " + m.error()));
                continue;
            }
            scores.add(m.sharpnessScore());
            double deviation = Math.abs(m.aspectRatio() - targetRatio) / targetRatio;
            if (deviation > MAX_ASPECT_DEVIATION) {
                panelIssues.add(QaIssue.fail(m.panelId(), QaIssue.ASPECT_RATIO_DEVIATION,
                        String.format(Locale.ROOT, "aspect ratio %.4f deviates %.1f%% from target %.4f",
                                m.aspectRatio(), deviation * 100, targetRatio)));
            }
            if (m.qualityTier() == QualityTier.OVERSHARPEN_RISK) {
                panelIssues.add(QaIssue.warn(m.panelId(), QaIssue.OVERSHARPEN_RISK,
                        String.format(Locale.ROOT, "sharpness %.2f is at or above %.1f", m.sharpnessScore(), QualityTier.OVERSHARPEN_FROM)));
            } else if (m.sharpnessScore() < SOFT_WARN_BELOW) {
                panelIssues.add(QaIssue.warn(m.panelId(), QaIssue.SOFT_PANEL,
                        String.format(Locale.ROOT, "sharpness %.2f is below %.1f", m.sharpnessScore(), SOFT_WARN_BELOW)));
            }
        }

        AggregateStats stats = AggregateStats.of(scores);
        List<QaIssue> issues = new ArrayList<>();
        if (scores.isEmpty()) {
            issues.add(QaIssue.fail(null, QaIssue.NO_SCORED_PANELS, "no panel produced a sharpness score"));
        } else if (stats.mean() < MEAN_SHARPNESS_FLOOR) {
            issues.add(QaIssue.fail(null, QaIssue.MEAN_SHARPNESS_BELOW_FLOOR,
                    String.format(Locale.ROOT, "mean sharpness %.2f is below %.1f", stats.mean(), MEAN_SHARPNESS_FLOOR)));
        }
        issues.addAll(panelIssues);

        ValidationStatus status = statusOf(issues);
        for (QaIssue issue : issues) {
            if (issue.severity() == QaIssue.Severity.WARN) {
                log.warn("Quality warning | panelId={} | code={} | message={}", issue.panelId(), issue.code(), issue.message());
            }
        }
        log.info("Quality gate evaluated | panels={} | scored={} | meanSharpness={} | status={}",
                sorted.size(), scores.size(), stats.mean(), status);
        return new QaReport(sorted, stats, status, issues);
    }

    private static ValidationStatus statusOf(List<QaIssue> issues) {
        boolean warned = false;
        for (QaIssue issue : issues) {
            if (issue.severity() == QaIssue.Severity.FAIL) {
                return ValidationStatus.FAILED;
            }
            warned = true;
        }
        return warned ? ValidationStatus.REVIEW_NEEDED : ValidationStatus.PASSED;
    }
}
