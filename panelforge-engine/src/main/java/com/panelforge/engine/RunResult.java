package com.panelforge.engine;

import com.panelforge.quality.QaReport;
import com.panelforge.quality.ValidationStatus;
import com.panelforge.refinement.dispatch.RefinementHandle;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What {@link PromotionEngine#processGrid} returns: final status, the state trail, per-panel results
 * sorted by panel id, the written files and any refinement dispatch outcomes.
 */
public final class RunResult {

    private final String runId;
    private final List<RunState> states;
    private final ValidationStatus validationStatus;
    private final List<PanelResult> panelResults;
    private final QaReport qaReport;
    private final List<Path> manifest;
    private final Map<String, RefinementHandle> dispatchHandles;
    private final Map<String, String> dispatchErrors;

    RunResult(String runId, List<RunState> states, ValidationStatus validationStatus, List<PanelResult> panelResults,
              QaReport qaReport, List<Path> manifest, Map<String, RefinementHandle> dispatchHandles,
              Map<String, String> dispatchErrors) {
        this.runId = runId;
        this.states = List.copyOf(states);
        this.validationStatus = validationStatus;
        this.panelResults = List.copyOf(panelResults);
        this.qaReport = qaReport;
        this.manifest = List.copyOf(manifest);
        this.dispatchHandles = Collections.unmodifiableMap(new LinkedHashMap<>(dispatchHandles));
        this.dispatchErrors = Collections.unmodifiableMap(new LinkedHashMap<>(dispatchErrors));
    }

    public String getRunId() {
        return runId;
    }

    /** States the run passed through, in order; the last one is terminal. */
    public List<RunState> getStates() {
        return states;
    }

    public RunState getFinalState() {
        return states.get(states.size() - 1);
    }

    public ValidationStatus getValidationStatus() {
        return validationStatus;
    }

    public List<PanelResult> getPanelResults() {
        return panelResults;
    }

    public Optional<PanelResult> getPanelResult(String panelId) {
        return panelResults.stream().filter(r -> r.getPanelId().equals(panelId)).findFirst();
    }

    public QaReport getQaReport() {
        return qaReport;
    }

    /** Every file written by the run: promoted (and cropped) panels, then the two reports. */
    public List<Path> getManifest() {
        return manifest;
    }

    public Map<String, RefinementHandle> getDispatchHandles() {
        return dispatchHandles;
    }

    public Map<String, String> getDispatchErrors() {
        return dispatchErrors;
    }

    @Override
    public String toString() {
        return "RunResult{runId='" + runId + "', status=" + validationStatus + ", panels=" + panelResults.size() + "}";
    }
}
