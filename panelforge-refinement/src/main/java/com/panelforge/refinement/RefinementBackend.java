package com.panelforge.refinement;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Payload schema / diffusion service family. */
public enum RefinementBackend {
    COMFYUI("comfyui", "euler"),
    AUTOMATIC1111("automatic1111", "Euler a");

    private final String id;
    private final String defaultSampler;

    RefinementBackend(String id, String defaultSampler) {
        this.id = id;
        this.defaultSampler = defaultSampler;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    /** Sampler used when none is configured ({@code sampler_name} vs {@code sampler_index} naming). */
    public String getDefaultSampler() {
        return defaultSampler;
    }

    public static RefinementBackend fromId(String id) {
        if (id != null) {
            String normalized = id.trim().toLowerCase(Locale.ROOT);
            for (RefinementBackend backend : values()) {
                if (backend.id.equals(normalized)) {
                    return backend;
                }
            }
        }
        throw new IllegalArgumentException("Unknown refinement backend: " + id + " (use comfyui or automatic1111)");
    }
}
