package com.panelforge.engine;

import com.panelforge.quality.ValidationStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer meters for panel and run outcomes:
 * timer {@code panelforge.panel.duration} (outcome), counter {@code panelforge.panels} (outcome, tier),
 * counter {@code panelforge.runs} (status).
 * <p>
 * Without an injected registry a process-wide {@link SimpleMeterRegistry} is created lazily via CAS.
 */
final class PromotionMetrics {

    static final String PANEL_DURATION = "panelforge.panel.duration";
    static final String PANELS = "panelforge.panels";
    static final String RUNS = "panelforge.runs";

    private static final AtomicReference<MeterRegistry> DEFAULT_REGISTRY = new AtomicReference<>();

    private final MeterRegistry registry;

    PromotionMetrics(MeterRegistry registry) {
        this.registry = registry != null ? registry : defaultRegistry();
    }

    static MeterRegistry defaultRegistry() {
        MeterRegistry existing = DEFAULT_REGISTRY.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (DEFAULT_REGISTRY.compareAndSet(null, created)) {
            return created;
        }
        return DEFAULT_REGISTRY.get();
    }

    MeterRegistry registry() {
        return registry;
    }

    void recordPanel(PanelResult result, long durationNanos) {
        String outcome = result.isFailed() ? "failed" : "promoted";
        String tier = result.getQualityTier() != null && !result.isFailed() ? result.getQualityTier().getLabel() : "none";
        Timer.builder(PANEL_DURATION)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        registry.counter(PANELS, "outcome", outcome, "tier", tier).increment();
    }

    void recordRun(ValidationStatus status) {
        registry.counter(RUNS, "status", status.name().toLowerCase(Locale.ROOT)).increment();
    }
}
