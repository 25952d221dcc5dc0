package com.panelforge.refinement.dispatch;

import com.panelforge.refinement.RefinementBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up dispatchers through {@link ServiceLoader}.
 */
public final class RefinementDispatchers {

    private static final Logger log = LoggerFactory.getLogger(RefinementDispatchers.class);

    private RefinementDispatchers() {
    }

    /** All providers on the classpath, enabled or not. */
    public static List<RefinementDispatcherProvider> providers() {
        List<RefinementDispatcherProvider> providers = new ArrayList<>();
        ServiceLoader.load(RefinementDispatcherProvider.class).forEach(providers::add);
        return providers;
    }

    /**
     * First enabled provider for {@code backend}, or empty when none is configured.
     */
    public static Optional<RefinementDispatcher> forBackend(RefinementBackend backend) {
        return forBackend(backend, providers());
    }

    static Optional<RefinementDispatcher> forBackend(RefinementBackend backend, List<RefinementDispatcherProvider> providers) {
        for (RefinementDispatcherProvider provider : providers) {
            if (provider.getBackend() == backend && provider.isEnabled()) {
                log.info("Refinement dispatcher selected | backend={} | provider={}", backend.getId(), provider.getClass().getName());
                return Optional.of(provider.createDispatcher());
            }
        }
        log.debug("No enabled refinement dispatcher | backend={}", backend.getId());
        return Optional.empty();
    }
}
