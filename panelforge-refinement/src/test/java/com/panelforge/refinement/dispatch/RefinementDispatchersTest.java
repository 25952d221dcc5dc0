package com.panelforge.refinement.dispatch;

import com.panelforge.refinement.RefinementBackend;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RefinementDispatchersTest {

    @Test
    void providers_discoversBothBackendsViaServiceLoader() {
        List<RefinementDispatcherProvider> providers = RefinementDispatchers.providers();

        assertTrue(providers.stream().anyMatch(p -> p.getBackend() == RefinementBackend.COMFYUI));
        assertTrue(providers.stream().anyMatch(p -> p.getBackend() == RefinementBackend.AUTOMATIC1111));
    }

    @Test
    void forBackend_skipsProvidersWithoutBaseUrl() {
        List<RefinementDispatcherProvider> providers = List.of(
                new ComfyUiDispatcherProvider(Map.of()),
                new Automatic1111DispatcherProvider(Map.of()));

        assertFalse(RefinementDispatchers.forBackend(RefinementBackend.COMFYUI, providers).isPresent());
    }

    @Test
    void forBackend_picksEnabledProviderForBackend() {
        List<RefinementDispatcherProvider> providers = List.of(
                new ComfyUiDispatcherProvider(Map.of("COMFYUI_BASE_URL", "http://comfy:8188")),
                new Automatic1111DispatcherProvider(Map.of("AUTOMATIC1111_BASE_URL", "http://sd:7860/")));

        Optional<RefinementDispatcher> comfy = RefinementDispatchers.forBackend(RefinementBackend.COMFYUI, providers);
        Optional<RefinementDispatcher> a1111 = RefinementDispatchers.forBackend(RefinementBackend.AUTOMATIC1111, providers);

        assertInstanceOf(ComfyUiRefinementDispatcher.class, comfy.orElseThrow());
        assertEquals("http://comfy:8188", ((ComfyUiRefinementDispatcher) comfy.get()).getBaseUrl());
        assertEquals("http://sd:7860", ((Automatic1111RefinementDispatcher) a1111.orElseThrow()).getBaseUrl());
    }
}
