package com.panelforge.plan.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.panelforge.plan.validation.PlanValidationException;
import com.panelforge.plan.validation.ValidationResult;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The unit of work for one promotion run: master grid image, output directory, grid shape,
 * global seed and the ordered panels. Read from snake_case JSON; immutable once built.
 * <p>
 * Malformed JSON is reported as {@link PlanValidationException}, the same fatal path as any
 * other plan-level violation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PromotionPlan {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final String masterGridPath;
    private final String outputDirectory;
    private final String gridSpecification;
    private final Long globalSeed;
    private final String globalStyleAnchor;
    private final List<PanelSpec> panels;

    @JsonCreator
    public PromotionPlan(
            @JsonProperty("master_grid_path") String masterGridPath,
            @JsonProperty("output_directory") String outputDirectory,
            @JsonProperty("grid_specification") String gridSpecification,
            @JsonProperty("global_seed") Long globalSeed,
            @JsonProperty("global_style_anchor") String globalStyleAnchor,
            @JsonProperty("panels") List<PanelSpec> panels) {
        this.masterGridPath = masterGridPath;
        this.outputDirectory = outputDirectory;
        this.gridSpecification = gridSpecification;
        this.globalSeed = globalSeed;
        this.globalStyleAnchor = globalStyleAnchor;
        this.panels = panels != null ? List.copyOf(panels) : List.of();
    }

    @JsonProperty("master_grid_path")
    public String getMasterGridPath() {
        return masterGridPath;
    }

    @JsonProperty("output_directory")
    public String getOutputDirectory() {
        return outputDirectory;
    }

    /** Raw {@code "CxR"} text; parse with {@link GridSpecification#parse(String)}. */
    @JsonProperty("grid_specification")
    public String getGridSpecification() {
        return gridSpecification;
    }

    /** Global seed, or null when the plan omitted it (a validation error). */
    @JsonProperty("global_seed")
    public Long getGlobalSeed() {
        return globalSeed;
    }

    /** Optional per-plan style anchor; null means use the configured default. */
    @JsonProperty("global_style_anchor")
    public String getGlobalStyleAnchor() {
        return globalStyleAnchor;
    }

    @JsonProperty("panels")
    public List<PanelSpec> getPanels() {
        return panels;
    }

    @JsonIgnore
    public Path masterGridFile() {
        return masterGridPath != null ? Path.of(masterGridPath) : null;
    }

    @JsonIgnore
    public Path outputDirectoryPath() {
        return outputDirectory != null ? Path.of(outputDirectory) : null;
    }

    /**
     * Returns a copy whose relative {@code master_grid_path} and {@code output_directory} are
     * resolved against {@code baseDirectory}. Absolute paths are kept.
     */
    public PromotionPlan resolveAgainst(Path baseDirectory) {
        Objects.requireNonNull(baseDirectory, "baseDirectory");
        return new PromotionPlan(resolve(baseDirectory, masterGridPath), resolve(baseDirectory, outputDirectory),
                gridSpecification, globalSeed, globalStyleAnchor, panels);
    }

    private static String resolve(Path base, String path) {
        if (path == null || path.isBlank()) return path;
        Path p = Path.of(path);
        return p.isAbsolute() ? path : base.resolve(p).normalize().toString();
    }

    public static PromotionPlan fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new PlanValidationException(ValidationResult.failure("plan JSON is empty"));
        }
        try {
            PromotionPlan plan = MAPPER.readValue(json, PromotionPlan.class);
            if (plan == null) {
                throw new PlanValidationException(ValidationResult.failure("plan JSON is null"));
            }
            return plan;
        } catch (JsonProcessingException e) {
            throw new PlanValidationException(ValidationResult.failure("plan JSON is malformed: " + e.getOriginalMessage()), e);
        }
    }

    /**
     * Reads a plan file; relative paths inside it are resolved against the file's directory.
     */
    public static PromotionPlan fromFile(Path planFile) {
        Objects.requireNonNull(planFile, "planFile");
        String json;
        try {
            json = Files.readString(planFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PlanValidationException(ValidationResult.failure("plan file " + planFile + " is unreadable: " + e.getMessage()), e);
        }
        Path base = planFile.toAbsolutePath().getParent();
        PromotionPlan plan = fromJson(json);
        return base != null ? plan.resolveAgainst(base) : plan;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for plans assembled in code.
     */
    public static final class Builder {
        private String masterGridPath;
        private String outputDirectory;
        private String gridSpecification;
        private Long globalSeed;
        private String globalStyleAnchor;
        private final List<PanelSpec> panels = new ArrayList<>();

        public Builder masterGridPath(Path masterGridPath) {
            this.masterGridPath = masterGridPath != null ? masterGridPath.toString() : null;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory != null ? outputDirectory.toString() : null;
            return this;
        }

        public Builder gridSpecification(String gridSpecification) {
            this.gridSpecification = gridSpecification;
            return this;
        }

        public Builder globalSeed(long globalSeed) {
            this.globalSeed = globalSeed;
            return this;
        }

        public Builder globalStyleAnchor(String globalStyleAnchor) {
            this.globalStyleAnchor = globalStyleAnchor;
            return this;
        }

        public Builder addPanel(String panelId, int row, int col, String promptExtension) {
            return addPanel(new PanelSpec(panelId, new GridPosition(row, col), promptExtension));
        }

        public Builder addPanel(PanelSpec panel) {
            this.panels.add(Objects.requireNonNull(panel, "panel"));
            return this;
        }

        public PromotionPlan build() {
            return new PromotionPlan(masterGridPath, outputDirectory, gridSpecification, globalSeed,
                    globalStyleAnchor, panels);
        }
    }
}
