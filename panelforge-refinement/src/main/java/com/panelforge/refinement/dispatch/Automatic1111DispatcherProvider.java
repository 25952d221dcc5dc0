package com.panelforge.refinement.dispatch;

import com.panelforge.refinement.RefinementBackend;

import java.util.Map;

/**
 * SPI provider for the Automatic1111 dispatcher. Reads AUTOMATIC1111_BASE_URL from env; only enabled when it is set.
 */
public final class Automatic1111DispatcherProvider implements RefinementDispatcherProvider {

    static final String ENV_BASE_URL = "AUTOMATIC1111_BASE_URL";

    private final String baseUrl;

    public Automatic1111DispatcherProvider() {
        this(System.getenv());
    }

    Automatic1111DispatcherProvider(Map<String, String> env) {
        this.baseUrl = env.get(ENV_BASE_URL);
    }

    @Override
    public RefinementBackend getBackend() {
        return RefinementBackend.AUTOMATIC1111;
    }

    @Override
    public RefinementDispatcher createDispatcher() {
        return new Automatic1111RefinementDispatcher(baseUrl);
    }

    @Override
    public boolean isEnabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
