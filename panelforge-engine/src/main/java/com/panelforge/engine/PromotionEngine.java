package com.panelforge.engine;

import com.panelforge.config.PanelForgeConfig;
import com.panelforge.imaging.AspectCropper;
import com.panelforge.imaging.GridSlicer;
import com.panelforge.imaging.ImageFiles;
import com.panelforge.imaging.PanelUpscaler;
import com.panelforge.imaging.ResamplingMethod;
import com.panelforge.plan.model.GridSpecification;
import com.panelforge.plan.model.PanelSpec;
import com.panelforge.plan.model.PromotionPlan;
import com.panelforge.plan.validation.PlanValidationException;
import com.panelforge.plan.validation.PlanValidator;
import com.panelforge.plan.validation.ValidationResult;
import com.panelforge.quality.PanelMetrics;
import com.panelforge.quality.QaReport;
import com.panelforge.quality.QualityAnalyzer;
import com.panelforge.quality.ValidationStatus;
import com.panelforge.refinement.RefinementPayloadBuilder;
import com.panelforge.refinement.RefinementSettings;
import com.panelforge.refinement.dispatch.RefinementDispatcher;
import com.panelforge.refinement.dispatch.RefinementHandle;
import com.panelforge.seed.StableHash;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Promotes every panel of a plan: validate, fan panels out to a worker pool, wait for all of them,
 * then gate quality and write {@code qa_report.json} and {@code promotion_summary.json}.
 * <p>
 * The engine keeps no state between runs; concurrent {@code processGrid} calls share only the
 * injected collaborators, which are immutable. Output is identical for any worker count because
 * every panel depends only on its own spec, the read-only master image and the global seed.
 */
public final class PromotionEngine {

    private static final Logger log = LoggerFactory.getLogger(PromotionEngine.class);

    private final PanelForgeConfig config;
    private final PlanValidator validator;
    private final GridSlicer slicer;
    private final AspectCropper cropper;
    private final PanelUpscaler upscaler;
    private final RefinementSettings refinementSettings;
    private final RefinementDispatcher dispatcher;
    private final PromotionMetrics metrics;

    private PromotionEngine(Builder b) {
        this.config = b.config;
        this.validator = new PlanValidator();
        this.slicer = new GridSlicer();
        this.cropper = b.cropper != null ? b.cropper : new AspectCropper();
        this.upscaler = new PanelUpscaler(config.getUpscaleFactor(), ResamplingMethod.fromName(config.getUpscaleMethod()));
        this.refinementSettings = RefinementSettings.fromConfig(config);
        this.dispatcher = b.dispatcher;
        this.metrics = new PromotionMetrics(b.meterRegistry);
    }

    public PromotionEngine(PanelForgeConfig config) {
        this(builder(config));
    }

    public static Builder builder(PanelForgeConfig config) {
        return new Builder(config);
    }

    public PanelForgeConfig getConfig() {
        return config;
    }

    public MeterRegistry getMeterRegistry() {
        return metrics.registry();
    }

    public RunResult processGrid(PromotionPlan plan) {
        return processGrid(plan, new CancellationToken());
    }

    /**
     * Runs the plan to completion.
     *
     * @throws PlanValidationException     on any plan-level violation; nothing has been written
     * @throws PromotionCancelledException when {@code token} is cancelled or the caller is interrupted
     *                                     before the reports are written
     * @throws UncheckedIOException        when the output directory or the reports cannot be written
     */
    public RunResult processGrid(PromotionPlan plan, CancellationToken token) {
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(token, "token");
        String runId = UUID.randomUUID().toString();
        List<RunState> states = new ArrayList<>();

        states.add(RunState.VALIDATING_INPUT);
        GridSpecification grid = validator.requireValid(plan);
        BufferedImage master = readMasterGrid(plan, grid);
        long globalSeed = plan.getGlobalSeed();
        Path outputDir = plan.outputDirectoryPath();
        log.info("Promotion run started | runId={} | grid={} | panels={} | master={}x{} | workers={} | globalSeed={}",
                runId, grid, plan.getPanels().size(), master.getWidth(), master.getHeight(), config.getWorkers(), globalSeed);

        token.throwIfCancelled();
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create output directory " + outputDir, e);
        }

        states.add(RunState.PROCESSING_PANELS);
        RefinementSettings settings = refinementSettings.withStyleAnchor(plan.getGlobalStyleAnchor());
        PanelPipeline pipeline = new PanelPipeline(slicer, cropper, upscaler,
                new QualityAnalyzer(config.getTargetAspectRatio()), new RefinementPayloadBuilder(settings),
                config.getTargetAspectRatio(), config.isKeepCropped());
        List<PanelResult> results = runPanels(runId, plan.getPanels(), pipeline, grid, master, globalSeed, outputDir, token);

        // barrier: every panel finished; nothing aggregate is written for a cancelled run
        token.throwIfCancelled();
        states.add(RunState.AGGREGATING);
        results.sort(Comparator.comparing(PanelResult::getPanelId));
        List<PanelMetrics> panelMetrics = new ArrayList<>(results.size());
        for (PanelResult r : results) {
            panelMetrics.add(r.toMetrics());
        }
        QaReport qaReport = new QualityAnalyzer(config.getTargetAspectRatio()).analyze(panelMetrics);
        ValidationStatus status = qaReport.validationStatus();

        PromotionSummary summary = new PromotionSummary(
                plan.masterGridFile().getFileName().toString(),
                grid.toString(),
                grid.getCols(),
                grid.getRows(),
                globalSeed,
                StableHash.ALGORITHM,
                config.getTargetAspectRatio(),
                upscaler.getFactor(),
                upscaler.getMethod().name().toLowerCase(Locale.ROOT),
                settings.backend().getId(),
                settings.styleAnchor(),
                status,
                results);

        List<Path> manifest = new ArrayList<>();
        for (PanelResult r : results) {
            if (r.getCroppedPath() != null) {
                manifest.add(r.getCroppedPath());
            }
            if (r.getPromotedPath() != null) {
                manifest.add(r.getPromotedPath());
            }
        }
        manifest.addAll(new ReportWriter().write(outputDir, qaReport, summary));
        RunState finalState = RunState.fromStatus(status);
        states.add(finalState);
        metrics.recordRun(status);
        log.info("Promotion run finished | runId={} | status={} | panels={} | failedPanels={} | meanSharpness={}",
                runId, status, results.size(), results.stream().filter(PanelResult::isFailed).count(),
                qaReport.aggregateStats().mean());

        Map<String, RefinementHandle> handles = new LinkedHashMap<>();
        Map<String, String> dispatchErrors = new LinkedHashMap<>();
        if (dispatcher != null && status != ValidationStatus.FAILED) {
            dispatch(runId, results, handles, dispatchErrors);
        }
        return new RunResult(runId, states, status, results, qaReport, manifest, handles, dispatchErrors);
    }

    private BufferedImage readMasterGrid(PromotionPlan plan, GridSpecification grid) {
        Path masterFile = plan.masterGridFile();
        BufferedImage master;
        try {
            master = ImageFiles.read(masterFile);
        } catch (IOException e) {
            throw new PlanValidationException(ValidationResult.failure("master grid image is unreadable: " + e.getMessage()), e);
        }
        if (master.getWidth() < grid.getCols() || master.getHeight() < grid.getRows()) {
            throw new PlanValidationException(ValidationResult.failure("master grid image " + master.getWidth() + "x"
                    + master.getHeight() + " is too small for grid " + grid + " (" + grid.getCols() + " columns, "
                    + grid.getRows() + " rows)"));
        }
        return master;
    }

    private List<PanelResult> runPanels(String runId, List<PanelSpec> panels, PanelPipeline pipeline, GridSpecification grid,
                                        BufferedImage master, long globalSeed, Path outputDir, CancellationToken token) {
        int poolSize = Math.max(1, Math.min(config.getWorkers(), panels.size()));
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, workerThreads(runId));
        boolean completed = false;
        try {
            List<Future<PanelResult>> futures = new ArrayList<>(panels.size());
            for (int i = 0; i < panels.size(); i++) {
                PanelSpec panel = panels.get(i);
                int index = i + 1;
                futures.add(executor.submit(() -> {
                    long start = System.nanoTime();
                    PanelResult result = pipeline.process(panel, index, grid, master, globalSeed, outputDir, token);
                    metrics.recordPanel(result, System.nanoTime() - start);
                    return result;
                }));
            }
            List<PanelResult> results = new ArrayList<>(panels.size());
            for (Future<PanelResult> future : futures) {
                try {
                    results.add(future.get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    token.cancel();
                    throw new PromotionCancelledException("Promotion run " + runId + " interrupted");
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (cause instanceof RuntimeException re) throw re;
                    throw new IllegalStateException(cause);
                }
            }
            completed = true;
            return results;
        } finally {
            if (completed) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(1, TimeUnit.MINUTES)) executor.shutdownNow();
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            } else {
                token.cancel();
                executor.shutdownNow();
                log.warn("Promotion run aborted before all panels finished | runId={}", runId);
            }
        }
    }

    private void dispatch(String runId, List<PanelResult> results, Map<String, RefinementHandle> handles,
                          Map<String, String> errors) {
        for (PanelResult r : results) {
            if (r.getStage() != PanelStage.PAYLOAD_BUILT) {
                continue;
            }
            if (r.getPayload().backend() != dispatcher.backend()) {
                String message = "dispatcher accepts " + dispatcher.backend().getId() + " payloads, got " + r.getPayload().backend().getId();
                errors.put(r.getPanelId(), message);
                log.warn("Refinement dispatch skipped | runId={} | panelId={} | reason={}", runId, r.getPanelId(), message);
                continue;
            }
            try {
                handles.put(r.getPanelId(), dispatcher.submitRefinement(r.getPayload()));
            } catch (Exception e) {
                errors.put(r.getPanelId(), e.getClass().getSimpleName() + ": " + e.getMessage());
                log.warn("Refinement dispatch failed | runId={} | panelId={} | error={}", runId, r.getPanelId(), e.getMessage());
            }
        }
        log.info("Refinement dispatch finished | runId={} | submitted={} | failed={}", runId, handles.size(), errors.size());
    }

    private static ThreadFactory workerThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "panelforge-" + runId.substring(0, 8) + "-";
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Builder for {@link PromotionEngine}. Only the config is required.
     */
    public static final class Builder {
        private final PanelForgeConfig config;
        private RefinementDispatcher dispatcher;
        private MeterRegistry meterRegistry;
        private AspectCropper cropper;

        private Builder(PanelForgeConfig config) {
            this.config = Objects.requireNonNull(config, "config");
        }

        /** Sends built payloads after the reports are written; unset means payloads are only recorded. */
        public Builder dispatcher(RefinementDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder cropper(AspectCropper cropper) {
            this.cropper = cropper;
            return this;
        }

        public PromotionEngine build() {
            return new PromotionEngine(this);
        }
    }
}
