package com.panelforge.engine;

/**
 * Per-panel lifecycle: {@code PENDING -> SLICED -> CROPPED -> SEEDED -> SCORED -> PAYLOAD_BUILT},
 * or {@code SKIPPED_ON_FAIL} from any stage.
 */
public enum PanelStage {
    PENDING,
    SLICED,
    CROPPED,
    SEEDED,
    SCORED,
    PAYLOAD_BUILT,
    SKIPPED_ON_FAIL
}
