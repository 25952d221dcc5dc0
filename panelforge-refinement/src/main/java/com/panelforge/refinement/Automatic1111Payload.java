package com.panelforge.refinement;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Automatic1111 {@code /sdapi/v1/img2img} body. {@code init_images} holds the base64 PNG of the
 * promoted image.
 */
@JsonPropertyOrder({"init_images", "prompt", "negative_prompt", "denoising_strength", "seed", "cfg_scale",
        "steps", "sampler_index", "width", "height", "restore_faces", "tiling"})
public record Automatic1111Payload(
        @JsonProperty("init_images") List<String> initImages,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("negative_prompt") String negativePrompt,
        @JsonProperty("denoising_strength") double denoisingStrength,
        @JsonProperty("seed") long seed,
        @JsonProperty("cfg_scale") double cfgScale,
        @JsonProperty("steps") int steps,
        @JsonProperty("sampler_index") String samplerIndex,
        @JsonProperty("width") int width,
        @JsonProperty("height") int height,
        @JsonProperty("restore_faces") boolean restoreFaces,
        @JsonProperty("tiling") boolean tiling) implements RefinementPayload {

    public Automatic1111Payload {
        initImages = List.copyOf(initImages);
    }

    @Override
    public RefinementBackend backend() {
        return RefinementBackend.AUTOMATIC1111;
    }
}
