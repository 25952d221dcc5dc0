package com.panelforge.refinement.dispatch;

import com.panelforge.refinement.RefinementBackend;
import com.panelforge.refinement.RefinementPayload;

/**
 * Capability for sending a built payload to a diffusion service. Injected into the engine so the
 * same run can target ComfyUI, Automatic1111 or a test double.
 */
public interface RefinementDispatcher {

    /** Payload schema this dispatcher accepts. */
    RefinementBackend backend();

    /**
     * Submits one payload.
     *
     * @throws Exception on transport errors or a non-success response
     */
    RefinementHandle submitRefinement(RefinementPayload payload) throws Exception;
}
