package com.panelforge.engine;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.panelforge.imaging.PanelBounds;
import com.panelforge.plan.model.GridPosition;
import com.panelforge.quality.PanelMetrics;
import com.panelforge.quality.QualityTier;
import com.panelforge.refinement.RefinementPayload;
import com.panelforge.seed.SeedDerivation;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of one panel's pipeline. Immutable once built; serialized per panel into
 * {@code promotion_summary.json}. A failed panel keeps everything computed before the failing stage.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"panel_id", "index", "grid_position", "stage", "failed_after", "bounds", "seed",
        "seed_derivation", "promoted_file", "cropped_file", "panel_width", "panel_height",
        "promoted_width", "promoted_height", "sharpness_score", "quality_tier", "aspect_ratio", "error", "payload"})
public final class PanelResult {

    private final String panelId;
    private final int index;
    private final GridPosition gridPosition;
    private final PanelStage stage;
    private final PanelStage failedAfter;
    private final PanelBounds bounds;
    private final SeedDerivation seedDerivation;
    private final Path promotedPath;
    private final Path croppedPath;
    private final Integer promotedWidth;
    private final Integer promotedHeight;
    private final PanelMetrics metrics;
    private final RefinementPayload payload;
    private final String error;

    private PanelResult(Builder b) {
        this.panelId = b.panelId;
        this.index = b.index;
        this.gridPosition = b.gridPosition;
        this.stage = b.error != null ? PanelStage.SKIPPED_ON_FAIL : b.stage;
        this.failedAfter = b.error != null ? b.stage : null;
        this.bounds = b.bounds;
        this.seedDerivation = b.seedDerivation;
        this.promotedPath = b.promotedPath;
        this.croppedPath = b.croppedPath;
        this.promotedWidth = b.promotedWidth;
        this.promotedHeight = b.promotedHeight;
        this.metrics = b.metrics;
        this.payload = b.payload;
        this.error = b.error;
    }

    @JsonProperty("panel_id")
    public String getPanelId() {
        return panelId;
    }

    /** 1-based position of the panel in the plan; used for output file names. */
    @JsonProperty("index")
    public int getIndex() {
        return index;
    }

    @JsonProperty("grid_position")
    public GridPosition getGridPosition() {
        return gridPosition;
    }

    @JsonProperty("stage")
    public PanelStage getStage() {
        return stage;
    }

    /** Last stage completed before the failure; null for panels that did not fail. */
    @JsonProperty("failed_after")
    public PanelStage getFailedAfter() {
        return failedAfter;
    }

    @JsonProperty("bounds")
    public PanelBounds getBounds() {
        return bounds;
    }

    @JsonProperty("seed")
    public Integer getSeed() {
        return seedDerivation != null ? seedDerivation.seed() : null;
    }

    @JsonProperty("seed_derivation")
    public SeedDerivation getSeedDerivation() {
        return seedDerivation;
    }

    @JsonIgnore
    public Path getPromotedPath() {
        return promotedPath;
    }

    @JsonIgnore
    public Path getCroppedPath() {
        return croppedPath;
    }

    /**
     * File name relative to the output directory. The ComfyUI payload's {@code input_image} keeps the
     * resolved path instead, since the dispatcher uploads from it.
     */
    @JsonProperty("promoted_file")
    public String getPromotedFile() {
        return promotedPath != null ? promotedPath.getFileName().toString() : null;
    }

    @JsonProperty("cropped_file")
    public String getCroppedFile() {
        return croppedPath != null ? "cropped/" + croppedPath.getFileName() : null;
    }

    @JsonProperty("panel_width")
    public Integer getPanelWidth() {
        return bounds != null ? bounds.width() : null;
    }

    @JsonProperty("panel_height")
    public Integer getPanelHeight() {
        return bounds != null ? bounds.height() : null;
    }

    @JsonProperty("promoted_width")
    public Integer getPromotedWidth() {
        return promotedWidth;
    }

    @JsonProperty("promoted_height")
    public Integer getPromotedHeight() {
        return promotedHeight;
    }

    @JsonProperty("sharpness_score")
    public Double getSharpnessScore() {
        return metrics != null ? metrics.sharpnessScore() : null;
    }

    @JsonProperty("quality_tier")
    public QualityTier getQualityTier() {
        return metrics != null ? metrics.qualityTier() : null;
    }

    /** Post-crop width / height. */
    @JsonProperty("aspect_ratio")
    public Double getAspectRatio() {
        return metrics != null ? metrics.aspectRatio() : null;
    }

    @JsonProperty("error")
    public String getError() {
        return error;
    }

    @JsonProperty("payload")
    public RefinementPayload getPayload() {
        return payload;
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    /** Metrics fed to the quality gate; a failed panel reports its error instead of a score. */
    @JsonIgnore
    public PanelMetrics toMetrics() {
        return isFailed() ? PanelMetrics.failed(panelId, error) : metrics;
    }

    @Override
    public String toString() {
        return "PanelResult{panelId='" + panelId + "', stage=" + stage + (error != null ? ", error='" + error + "'" : "") + "}";
    }

    static Builder builder(String panelId, int index, GridPosition gridPosition) {
        return new Builder(panelId, index, gridPosition);
    }

    /**
     * Accumulates results as the pipeline advances; {@link #stage} always names the last completed stage.
     */
    static final class Builder {
        private final String panelId;
        private final int index;
        private final GridPosition gridPosition;
        private PanelStage stage = PanelStage.PENDING;
        private PanelBounds bounds;
        private SeedDerivation seedDerivation;
        private Path promotedPath;
        private Path croppedPath;
        private Integer promotedWidth;
        private Integer promotedHeight;
        private PanelMetrics metrics;
        private RefinementPayload payload;
        private String error;

        private Builder(String panelId, int index, GridPosition gridPosition) {
            this.panelId = Objects.requireNonNull(panelId, "panelId");
            this.index = index;
            this.gridPosition = gridPosition;
        }

        PanelStage stage() {
            return stage;
        }

        Builder sliced(PanelBounds bounds) {
            this.bounds = bounds;
            this.stage = PanelStage.SLICED;
            return this;
        }

        Builder cropped(Path promotedPath, Path croppedPath, int promotedWidth, int promotedHeight) {
            this.promotedPath = promotedPath;
            this.croppedPath = croppedPath;
            this.promotedWidth = promotedWidth;
            this.promotedHeight = promotedHeight;
            this.stage = PanelStage.CROPPED;
            return this;
        }

        Builder seeded(SeedDerivation seedDerivation) {
            this.seedDerivation = seedDerivation;
            this.stage = PanelStage.SEEDED;
            return this;
        }

        Builder scored(PanelMetrics metrics) {
            this.metrics = metrics;
            this.stage = PanelStage.SCORED;
            return this;
        }

        Builder payloadBuilt(RefinementPayload payload) {
            this.payload = payload;
            this.stage = PanelStage.PAYLOAD_BUILT;
            return this;
        }

        Builder failed(String error) {
            this.error = error != null ? error : "unknown error";
            return this;
        }

        PanelResult build() {
            return new PanelResult(this);
        }
    }
}
