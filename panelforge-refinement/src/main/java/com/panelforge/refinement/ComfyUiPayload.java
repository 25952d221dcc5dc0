package com.panelforge.refinement;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * ComfyUI-style payload. {@code input_image} is the promoted image path; the dispatcher uploads it.
 */
@JsonPropertyOrder({"input_image", "prompt", "negative_prompt", "denoising_strength", "seed", "cfg_scale",
        "steps", "sampler_name", "scheduler", "model", "width", "height"})
public record ComfyUiPayload(
        @JsonProperty("input_image") String inputImage,
        @JsonProperty("prompt") String prompt,
        @JsonProperty("negative_prompt") String negativePrompt,
        @JsonProperty("denoising_strength") double denoisingStrength,
        @JsonProperty("seed") long seed,
        @JsonProperty("cfg_scale") double cfgScale,
        @JsonProperty("steps") int steps,
        @JsonProperty("sampler_name") String samplerName,
        @JsonProperty("scheduler") String scheduler,
        @JsonProperty("model") String model,
        @JsonProperty("width") int width,
        @JsonProperty("height") int height) implements RefinementPayload {

    @Override
    public RefinementBackend backend() {
        return RefinementBackend.COMFYUI;
    }
}
