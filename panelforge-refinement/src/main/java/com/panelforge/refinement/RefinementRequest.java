package com.panelforge.refinement;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-panel input to {@link RefinementPayloadBuilder}.
 *
 * @param panelId         panel identifier
 * @param imagePath       promoted image on disk
 * @param imagePng        encoded PNG of the promoted image, or null to read {@code imagePath}
 * @param width           promoted width in pixels
 * @param height          promoted height in pixels
 * @param promptExtension panel-specific prompt text
 * @param seed            derived panel seed
 */
public record RefinementRequest(
        String panelId,
        Path imagePath,
        byte[] imagePng,
        int width,
        int height,
        String promptExtension,
        long seed) {

    public RefinementRequest {
        Objects.requireNonNull(panelId, "panelId");
        Objects.requireNonNull(imagePath, "imagePath");
        promptExtension = promptExtension == null ? "" : promptExtension;
    }
}
