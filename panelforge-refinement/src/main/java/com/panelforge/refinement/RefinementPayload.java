package com.panelforge.refinement;

/**
 * Backend-specific img2img request. Every implementation carries the same logical values under
 * its own field names.
 */
public interface RefinementPayload {

    RefinementBackend backend();

    String prompt();

    String negativePrompt();

    double denoisingStrength();

    long seed();

    double cfgScale();

    int steps();

    int width();

    int height();
}
