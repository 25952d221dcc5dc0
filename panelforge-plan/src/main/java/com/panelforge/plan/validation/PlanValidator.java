package com.panelforge.plan.validation;

import com.panelforge.plan.model.GridPosition;
import com.panelforge.plan.model.GridSpecification;
import com.panelforge.plan.model.PanelSpec;
import com.panelforge.plan.model.PromotionPlan;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks plan-level invariants. Collects every violation rather than stopping at the first, so
 * one failed run reports everything the caller has to fix.
 * <p>
 * The master grid is only checked for existence and readability here; decoding it is the
 * engine's first step and a decode failure is reported through the same exception.
 */
public final class PlanValidator {

    public ValidationResult validate(PromotionPlan plan) {
        if (plan == null) {
            return ValidationResult.failure("plan is null");
        }
        List<String> errors = new ArrayList<>();

        GridSpecification grid = null;
        try {
            grid = GridSpecification.parse(plan.getGridSpecification());
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (plan.getGlobalSeed() == null) {
            errors.add("global_seed is required");
        }

        if (plan.getOutputDirectory() == null || plan.getOutputDirectory().isBlank()) {
            errors.add("output_directory is required");
        }

        if (plan.getMasterGridPath() == null || plan.getMasterGridPath().isBlank()) {
            errors.add("master_grid_path is required");
        } else {
            Path master = plan.masterGridFile();
            if (!Files.isRegularFile(master)) {
                errors.add("master grid image not found: " + master);
            } else if (!Files.isReadable(master)) {
                errors.add("master grid image is not readable: " + master);
            }
        }

        List<PanelSpec> panels = plan.getPanels();
        if (panels.isEmpty()) {
            errors.add("plan has no panels");
        }
        Map<String, Integer> seenIds = new HashMap<>();
        Map<GridPosition, String> seenPositions = new HashMap<>();
        for (int i = 0; i < panels.size(); i++) {
            PanelSpec panel = panels.get(i);
            String label = panel.getPanelId() != null && !panel.getPanelId().isBlank()
                    ? "panel \"" + panel.getPanelId() + "\"" : "panel #" + (i + 1);
            if (panel.getPanelId() == null || panel.getPanelId().isBlank()) {
                errors.add(label + " has no panel_id");
            } else {
                Integer first = seenIds.putIfAbsent(panel.getPanelId(), i + 1);
                if (first != null) {
                    errors.add("duplicate panel_id \"" + panel.getPanelId() + "\" (panels #" + first + " and #" + (i + 1) + ")");
                }
            }
            GridPosition position = panel.getGridPosition();
            if (position == null) {
                errors.add(label + " has no grid_position");
                continue;
            }
            String owner = seenPositions.putIfAbsent(position, label);
            if (owner != null) {
                errors.add("duplicate grid_position " + position + " used by " + owner + " and " + label);
            }
            if (grid != null && !grid.contains(position)) {
                errors.add(label + " grid_position " + position + " is outside grid " + grid
                        + " (" + grid.getCols() + " columns, " + grid.getRows() + " rows; valid rows 0.."
                        + (grid.getRows() - 1) + ", cols 0.." + (grid.getCols() - 1) + ")");
            }
        }
        return ValidationResult.of(errors);
    }

    /**
     * Validates and throws {@link PlanValidationException} on any violation.
     *
     * @return the parsed grid specification of the valid plan
     */
    public GridSpecification requireValid(PromotionPlan plan) {
        ValidationResult result = validate(plan);
        if (!result.isValid()) {
            throw new PlanValidationException(result);
        }
        return GridSpecification.parse(plan.getGridSpecification());
    }
}
