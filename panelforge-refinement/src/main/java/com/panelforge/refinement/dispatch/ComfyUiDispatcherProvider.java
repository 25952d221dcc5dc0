package com.panelforge.refinement.dispatch;

import com.panelforge.refinement.RefinementBackend;

import java.util.Map;

/**
 * SPI provider for the ComfyUI dispatcher. Reads COMFYUI_BASE_URL from env; only enabled when it is set.
 */
public final class ComfyUiDispatcherProvider implements RefinementDispatcherProvider {

    static final String ENV_BASE_URL = "COMFYUI_BASE_URL";

    private final String baseUrl;

    public ComfyUiDispatcherProvider() {
        this(System.getenv());
    }

    ComfyUiDispatcherProvider(Map<String, String> env) {
        this.baseUrl = env.get(ENV_BASE_URL);
    }

    @Override
    public RefinementBackend getBackend() {
        return RefinementBackend.COMFYUI;
    }

    @Override
    public RefinementDispatcher createDispatcher() {
        return new ComfyUiRefinementDispatcher(baseUrl);
    }

    @Override
    public boolean isEnabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
