package com.panelforge.quality;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Sharpness statistics over the scored panels of a run. {@code std} is the population standard
 * deviation. All values are 0 when no panel was scored.
 */
@JsonPropertyOrder({"mean_sharpness", "min_sharpness", "max_sharpness", "std_sharpness", "scored_panels"})
public record AggregateStats(
        @JsonProperty("mean_sharpness") double mean,
        @JsonProperty("min_sharpness") double min,
        @JsonProperty("max_sharpness") double max,
        @JsonProperty("std_sharpness") double std,
        @JsonProperty("scored_panels") int scoredPanels) {

    /** Scores are summed in the given order; callers pass them sorted for reproducible output. */
    public static AggregateStats of(List<Double> scores) {
        if (scores.isEmpty()) {
            return new AggregateStats(0.0, 0.0, 0.0, 0.0, 0);
        }
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double s : scores) {
            sum += s;
            min = Math.min(min, s);
            max = Math.max(max, s);
        }
        double mean = sum / scores.size();
        double squares = 0.0;
        for (double s : scores) {
            squares += (s - mean) * (s - mean);
        }
        return new AggregateStats(mean, min, max, Math.sqrt(squares / scores.size()), scores.size());
    }
}
