package com.panelforge.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.panelforge.quality.ValidationStatus;

import java.util.List;

/**
 * Content of {@code promotion_summary.json}: the inputs needed to reproduce the run, plus each
 * panel's seed derivation, bounds and exact refinement payload.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"master_grid", "grid_specification", "columns", "rows", "global_seed", "hash_algorithm",
        "target_aspect_ratio", "upscale_factor", "upscale_method", "refinement_backend", "style_anchor",
        "validation_status", "panels"})
public record PromotionSummary(
        @JsonProperty("master_grid") String masterGrid,
        @JsonProperty("grid_specification") String gridSpecification,
        @JsonProperty("columns") int columns,
        @JsonProperty("rows") int rows,
        @JsonProperty("global_seed") long globalSeed,
        @JsonProperty("hash_algorithm") String hashAlgorithm,
        @JsonProperty("target_aspect_ratio") double targetAspectRatio,
        @JsonProperty("upscale_factor") int upscaleFactor,
        @JsonProperty("upscale_method") String upscaleMethod,
        @JsonProperty("refinement_backend") String refinementBackend,
        @JsonProperty("style_anchor") String styleAnchor,
        @JsonProperty("validation_status") ValidationStatus validationStatus,
        @JsonProperty("panels") List<PanelResult> panels) {

    public PromotionSummary {
        panels = List.copyOf(panels);
    }
}
