package com.panelforge.engine;

import com.panelforge.imaging.AspectCropper;
import com.panelforge.imaging.GridSlicer;
import com.panelforge.imaging.ImageFiles;
import com.panelforge.imaging.PanelBounds;
import com.panelforge.imaging.PanelUpscaler;
import com.panelforge.plan.model.GridSpecification;
import com.panelforge.plan.model.PanelSpec;
import com.panelforge.quality.PanelMetrics;
import com.panelforge.quality.QualityAnalyzer;
import com.panelforge.refinement.RefinementPayload;
import com.panelforge.refinement.RefinementPayloadBuilder;
import com.panelforge.refinement.RefinementRequest;
import com.panelforge.seed.SeedDerivation;
import com.panelforge.seed.SeedDeriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Runs one panel through slice, crop (+ upscale and write), seed, score and payload. Holds no
 * mutable state; one instance serves every worker of a run.
 * <p>
 * Errors are caught per panel and returned as a {@code SKIPPED_ON_FAIL} result. Cancellation is
 * checked between stages and is the only exception that escapes; an error raised once the token is
 * cancelled (an interrupted write, for one) is reported as cancellation, not as a panel failure.
 */
public final class PanelPipeline {

    private static final Logger log = LoggerFactory.getLogger(PanelPipeline.class);

    static final String CROPPED_DIR = "cropped";

    private final GridSlicer slicer;
    private final AspectCropper cropper;
    private final PanelUpscaler upscaler;
    private final QualityAnalyzer analyzer;
    private final RefinementPayloadBuilder payloadBuilder;
    private final double targetRatio;
    private final boolean keepCropped;

    PanelPipeline(GridSlicer slicer, AspectCropper cropper, PanelUpscaler upscaler, QualityAnalyzer analyzer,
                  RefinementPayloadBuilder payloadBuilder, double targetRatio, boolean keepCropped) {
        this.slicer = Objects.requireNonNull(slicer, "slicer");
        this.cropper = Objects.requireNonNull(cropper, "cropper");
        this.upscaler = Objects.requireNonNull(upscaler, "upscaler");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.payloadBuilder = Objects.requireNonNull(payloadBuilder, "payloadBuilder");
        this.targetRatio = targetRatio;
        this.keepCropped = keepCropped;
    }

    /**
     * @param panel      panel to promote
     * @param index      1-based plan position, used in file names
     * @param grid       parsed grid shape
     * @param master     decoded master grid (read only)
     * @param globalSeed plan seed
     * @param outputDir  existing output directory
     * @param token      run cancellation
     * @throws PromotionCancelledException when the run is cancelled while this panel is in flight
     */
    PanelResult process(PanelSpec panel, int index, GridSpecification grid, BufferedImage master,
                        long globalSeed, Path outputDir, CancellationToken token) {
        String panelId = panel.getPanelId();
        PanelResult.Builder result = PanelResult.builder(panelId, index, panel.getGridPosition());
        try {
            token.throwIfCancelled();
            PanelBounds bounds = slicer.computePanelBounds(panel.getGridPosition(), grid, master.getWidth(), master.getHeight());
            BufferedImage sliced = slicer.extract(master, bounds);
            result.sliced(bounds);
            log.debug("Panel sliced | panelId={} | bounds={}", panelId, bounds);

            token.throwIfCancelled();
            BufferedImage cropped = cropper.centerFillCrop(sliced, targetRatio);
            Path croppedPath = null;
            if (keepCropped) {
                croppedPath = outputDir.resolve(CROPPED_DIR).resolve(croppedFileName(index));
                ImageFiles.writePng(cropped, croppedPath);
            }
            BufferedImage promoted = upscaler.upscale(cropped);
            byte[] png = ImageFiles.encodePng(promoted);
            Path promotedPath = outputDir.resolve(promotedFileName(index));
            ImageFiles.writePng(png, promotedPath);
            result.cropped(promotedPath, croppedPath, promoted.getWidth(), promoted.getHeight());
            log.debug("Panel cropped | panelId={} | cropped={}x{} | promoted={}x{} | file={}", panelId,
                    cropped.getWidth(), cropped.getHeight(), promoted.getWidth(), promoted.getHeight(), promotedPath.getFileName());

            token.throwIfCancelled();
            SeedDerivation seed = SeedDeriver.explain(globalSeed, panelId);
            result.seeded(seed);
            log.debug("Panel seeded | panelId={} | seed={} | panelHash={}", panelId, seed.seed(), seed.panelHash());

            token.throwIfCancelled();
            PanelMetrics metrics = analyzer.measure(panelId, cropped);
            result.scored(metrics);

            token.throwIfCancelled();
            RefinementPayload payload = payloadBuilder.build(new RefinementRequest(panelId, promotedPath, png,
                    promoted.getWidth(), promoted.getHeight(), panel.getPromptExtension(), seed.seed()));
            result.payloadBuilt(payload);
            log.debug("Panel payload built | panelId={} | backend={}", panelId, payload.backend().getId());
            return result.build();
        } catch (PromotionCancelledException e) {
            log.info("Panel cancelled | panelId={} | lastStage={}", panelId, result.stage());
            throw e;
        } catch (Exception e) {
            // an interrupted file write surfaces as ClosedByInterruptException
            if (token.isCancelled()) {
                log.info("Panel cancelled | panelId={} | lastStage={} | interruptedBy={}",
                        panelId, result.stage(), e.getClass().getSimpleName());
                throw new PromotionCancelledException("Promotion run cancelled during panel " + panelId, e);
            }
            String message = e.getClass().getSimpleName() + ": " + e.getMessage();
            log.error("Panel failed | panelId={} | lastStage={} | error={}", panelId, result.stage(), message, e);
            return result.failed(message).build();
        }
    }

    static String promotedFileName(int index) {
        return String.format(Locale.ROOT, "panel_%02d_promoted.png", index);
    }

    static String croppedFileName(int index) {
        return String.format(Locale.ROOT, "panel_%02d_cropped.png", index);
    }
}
