package com.panelforge.plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One panel to promote: unique id, grid address and the prompt text appended to the style anchor.
 */
public final class PanelSpec {

    private final String panelId;
    private final GridPosition gridPosition;
    private final String promptExtension;

    @JsonCreator
    public PanelSpec(
            @JsonProperty("panel_id") String panelId,
            @JsonProperty("grid_position") GridPosition gridPosition,
            @JsonProperty("prompt_extension") String promptExtension) {
        this.panelId = panelId;
        this.gridPosition = gridPosition;
        this.promptExtension = promptExtension != null ? promptExtension : "";
    }

    @JsonProperty("panel_id")
    public String getPanelId() {
        return panelId;
    }

    @JsonProperty("grid_position")
    public GridPosition getGridPosition() {
        return gridPosition;
    }

    @JsonProperty("prompt_extension")
    public String getPromptExtension() {
        return promptExtension;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PanelSpec that = (PanelSpec) o;
        return Objects.equals(panelId, that.panelId)
                && Objects.equals(gridPosition, that.gridPosition)
                && Objects.equals(promptExtension, that.promptExtension);
    }

    @Override
    public int hashCode() {
        return Objects.hash(panelId, gridPosition, promptExtension);
    }

    @Override
    public String toString() {
        return "PanelSpec{" + panelId + " at " + gridPosition + "}";
    }
}
