package com.panelforge.refinement;

import com.panelforge.config.PanelForgeConfig;

import java.util.Objects;

/**
 * Values shared by every payload of a run. Schema choice only changes field names; the values
 * here are carried identically by both payload shapes.
 */
public record RefinementSettings(
        RefinementBackend backend,
        String styleAnchor,
        String negativePrompt,
        double denoisingStrength,
        double cfgScale,
        int steps,
        String sampler,
        String scheduler,
        String model) {

    public RefinementSettings {
        Objects.requireNonNull(backend, "backend");
        styleAnchor = styleAnchor == null ? "" : styleAnchor;
        negativePrompt = negativePrompt == null ? "" : negativePrompt;
        sampler = sampler == null || sampler.isBlank() ? backend.getDefaultSampler() : sampler;
    }

    public static RefinementSettings fromConfig(PanelForgeConfig config) {
        return new RefinementSettings(
                RefinementBackend.fromId(config.getRefinementBackend()),
                config.getStyleAnchor(),
                config.getNegativePrompt(),
                config.getDenoisingStrength(),
                config.getCfgScale(),
                config.getSteps(),
                config.getSampler(),
                config.getScheduler(),
                config.getModel());
    }

    /** Copy with a plan-level style anchor; blank keeps the configured one. */
    public RefinementSettings withStyleAnchor(String anchor) {
        if (anchor == null || anchor.isBlank()) {
            return this;
        }
        return new RefinementSettings(backend, anchor, negativePrompt, denoisingStrength, cfgScale, steps, sampler, scheduler, model);
    }
}
