package com.panelforge.refinement.dispatch;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.panelforge.refinement.RefinementBackend;

/**
 * Reference to a submitted refinement. Queue-based backends return a job id to poll later;
 * synchronous backends return the refined image directly.
 *
 * @param backend     service the payload was sent to
 * @param jobId       backend job id, or null for synchronous backends
 * @param imageBase64 refined image, or null when the job is still queued
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RefinementHandle(
        @JsonProperty("backend") RefinementBackend backend,
        @JsonProperty("job_id") String jobId,
        @JsonProperty("image_base64") String imageBase64) {
}
