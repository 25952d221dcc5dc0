package com.panelforge.refinement.dispatch;

import com.panelforge.refinement.RefinementBackend;

/**
 * SPI for refinement dispatchers. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.panelforge.refinement.dispatch.RefinementDispatcherProvider).
 */
public interface RefinementDispatcherProvider {

    RefinementBackend getBackend();

    /** Creates a dispatcher, typically configured from env in the provider constructor. */
    RefinementDispatcher createDispatcher();

    /**
     * Whether this provider should be used. Override to skip it when its env is unset.
     */
    default boolean isEnabled() {
        return true;
    }
}
