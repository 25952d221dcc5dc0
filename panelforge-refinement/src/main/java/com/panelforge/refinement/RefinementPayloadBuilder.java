package com.panelforge.refinement;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds the refinement payload for one panel in the configured schema. No network I/O; the
 * Automatic1111 schema reads the promoted file only when the request carries no encoded bytes.
 */
public final class RefinementPayloadBuilder {

    public static final String PROMPT_SUFFIX = "highly detailed, 8k";

    private final RefinementSettings settings;

    public RefinementPayloadBuilder(RefinementSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public RefinementSettings getSettings() {
        return settings;
    }

    public RefinementPayload build(RefinementRequest request) {
        Objects.requireNonNull(request, "request");
        String prompt = composePrompt(settings.styleAnchor(), request.promptExtension());
        return switch (settings.backend()) {
            case COMFYUI -> new ComfyUiPayload(
                    request.imagePath().toString(),
                    prompt,
                    settings.negativePrompt(),
                    settings.denoisingStrength(),
                    request.seed(),
                    settings.cfgScale(),
                    settings.steps(),
                    settings.sampler(),
                    settings.scheduler(),
                    settings.model(),
                    request.width(),
                    request.height());
            case AUTOMATIC1111 -> new Automatic1111Payload(
                    List.of(Base64.getEncoder().encodeToString(pngBytes(request))),
                    prompt,
                    settings.negativePrompt(),
                    settings.denoisingStrength(),
                    request.seed(),
                    settings.cfgScale(),
                    settings.steps(),
                    settings.sampler(),
                    request.width(),
                    request.height(),
                    false,
                    false);
        };
    }

    /**
     * {@code "{anchor} {extension}, highly detailed, 8k"}. Each part is trimmed and dropped when
     * blank; text inside a part is kept as written.
     */
    public static String composePrompt(String anchor, String extension) {
        StringJoiner head = new StringJoiner(" ");
        for (String part : new String[]{anchor, extension}) {
            if (part != null && !part.isBlank()) {
                head.add(part.trim());
            }
        }
        return head.length() == 0 ? PROMPT_SUFFIX : head + ", " + PROMPT_SUFFIX;
    }

    private static byte[] pngBytes(RefinementRequest request) {
        if (request.imagePng() != null) {
            return request.imagePng();
        }
        try {
            return Files.readAllBytes(request.imagePath());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read promoted image " + request.imagePath(), e);
        }
    }
}
