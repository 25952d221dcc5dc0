package com.panelforge.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration for the promotion engine, loaded from environment variables or built explicitly.
 * <p>
 * Pool size: PANELFORGE_WORKERS. Geometry: PANELFORGE_TARGET_ASPECT_RATIO (e.g. {@code 16:9} or {@code 1.7778}),
 * PANELFORGE_UPSCALE_FACTOR, PANELFORGE_UPSCALE_METHOD. Refinement: PANELFORGE_REFINEMENT_BACKEND,
 * PANELFORGE_STYLE_ANCHOR, PANELFORGE_NEGATIVE_PROMPT, PANELFORGE_DENOISING_STRENGTH, PANELFORGE_CFG_SCALE,
 * PANELFORGE_STEPS, PANELFORGE_SAMPLER, PANELFORGE_SCHEDULER, PANELFORGE_MODEL.
 * <p>
 * Unset, blank, unparseable or unknown values fall back to defaults. Values passed to the
 * {@link Builder} that are out of range or not a known method/backend name are rejected by {@link Builder#build()}.
 */
public final class PanelForgeConfig {

    static final String ENV_WORKERS = "PANELFORGE_WORKERS";
    static final String ENV_TARGET_ASPECT_RATIO = "PANELFORGE_TARGET_ASPECT_RATIO";
    static final String ENV_UPSCALE_FACTOR = "PANELFORGE_UPSCALE_FACTOR";
    static final String ENV_UPSCALE_METHOD = "PANELFORGE_UPSCALE_METHOD";
    static final String ENV_KEEP_CROPPED = "PANELFORGE_KEEP_CROPPED";
    static final String ENV_STYLE_ANCHOR = "PANELFORGE_STYLE_ANCHOR";
    static final String ENV_NEGATIVE_PROMPT = "PANELFORGE_NEGATIVE_PROMPT";
    static final String ENV_REFINEMENT_BACKEND = "PANELFORGE_REFINEMENT_BACKEND";
    static final String ENV_DENOISING_STRENGTH = "PANELFORGE_DENOISING_STRENGTH";
    static final String ENV_CFG_SCALE = "PANELFORGE_CFG_SCALE";
    static final String ENV_STEPS = "PANELFORGE_STEPS";
    static final String ENV_SAMPLER = "PANELFORGE_SAMPLER";
    static final String ENV_SCHEDULER = "PANELFORGE_SCHEDULER";
    static final String ENV_MODEL = "PANELFORGE_MODEL";

    public static final double DEFAULT_TARGET_ASPECT_RATIO = 16.0 / 9.0;
    public static final int DEFAULT_UPSCALE_FACTOR = 2;
    public static final int MAX_UPSCALE_FACTOR = 4;
    public static final String DEFAULT_UPSCALE_METHOD = "lanczos";
    public static final Set<String> UPSCALE_METHODS = Set.of("nearest", "bilinear", "bicubic", "lanczos");
    public static final String DEFAULT_STYLE_ANCHOR = "cinematic storyboard frame";
    public static final String DEFAULT_NEGATIVE_PROMPT = "blurry, low quality, artifacts, watermark, text";
    public static final String DEFAULT_REFINEMENT_BACKEND = "comfyui";
    public static final Set<String> REFINEMENT_BACKENDS = Set.of("comfyui", "automatic1111");
    public static final double DEFAULT_DENOISING_STRENGTH = 0.35;
    public static final double DEFAULT_CFG_SCALE = 7.5;
    public static final int DEFAULT_STEPS = 30;
    public static final String DEFAULT_SCHEDULER = "normal";
    public static final String DEFAULT_MODEL = "v1-5-pruned-emaonly.safetensors";

    private final int workers;
    private final double targetAspectRatio;
    private final int upscaleFactor;
    private final String upscaleMethod;
    private final boolean keepCropped;
    private final String styleAnchor;
    private final String negativePrompt;
    private final String refinementBackend;
    private final double denoisingStrength;
    private final double cfgScale;
    private final int steps;
    private final String sampler;
    private final String scheduler;
    private final String model;

    private PanelForgeConfig(Builder b) {
        this.workers = b.workers;
        this.targetAspectRatio = b.targetAspectRatio;
        this.upscaleFactor = b.upscaleFactor;
        this.upscaleMethod = b.upscaleMethod;
        this.keepCropped = b.keepCropped;
        this.styleAnchor = b.styleAnchor;
        this.negativePrompt = b.negativePrompt;
        this.refinementBackend = b.refinementBackend;
        this.denoisingStrength = b.denoisingStrength;
        this.cfgScale = b.cfgScale;
        this.steps = b.steps;
        this.sampler = b.sampler;
        this.scheduler = b.scheduler;
        this.model = b.model;
    }

    /** Number of threads in the per-run panel pool. Defaults to the available processors. */
    public int getWorkers() {
        return workers;
    }

    /** Width / height every promoted panel is cropped to. Default 16:9. */
    public double getTargetAspectRatio() {
        return targetAspectRatio;
    }

    /** Integer upscale applied after cropping (1 = none). Default {@value #DEFAULT_UPSCALE_FACTOR}. */
    public int getUpscaleFactor() {
        return upscaleFactor;
    }

    /** Resampling method name for the upscale, one of {@link #UPSCALE_METHODS}. Default lanczos. */
    public String getUpscaleMethod() {
        return upscaleMethod;
    }

    /** Whether the cropped, pre-upscale panel is also written under {@code cropped/}. */
    public boolean isKeepCropped() {
        return keepCropped;
    }

    public String getStyleAnchor() {
        return styleAnchor;
    }

    public String getNegativePrompt() {
        return negativePrompt;
    }

    /** Payload schema name: {@code comfyui} or {@code automatic1111}. */
    public String getRefinementBackend() {
        return refinementBackend;
    }

    public double getDenoisingStrength() {
        return denoisingStrength;
    }

    public double getCfgScale() {
        return cfgScale;
    }

    public int getSteps() {
        return steps;
    }

    /** Sampler override; null means the backend-specific default. */
    public String getSampler() {
        return sampler;
    }

    public String getScheduler() {
        return scheduler;
    }

    public String getModel() {
        return model;
    }

    public static PanelForgeConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds config from the given variables (normally {@link System#getenv()}).
     */
    public static PanelForgeConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .workers(parseInt(env.get(ENV_WORKERS), defaultWorkers()))
                .targetAspectRatio(parseRatio(env.get(ENV_TARGET_ASPECT_RATIO), DEFAULT_TARGET_ASPECT_RATIO))
                .upscaleFactor(parseInt(env.get(ENV_UPSCALE_FACTOR), DEFAULT_UPSCALE_FACTOR))
                .upscaleMethod(getEnvChoice(env, ENV_UPSCALE_METHOD, UPSCALE_METHODS, DEFAULT_UPSCALE_METHOD))
                .keepCropped(parseBoolean(env.get(ENV_KEEP_CROPPED), false))
                .styleAnchor(getEnv(env, ENV_STYLE_ANCHOR, DEFAULT_STYLE_ANCHOR))
                .negativePrompt(getEnv(env, ENV_NEGATIVE_PROMPT, DEFAULT_NEGATIVE_PROMPT))
                .refinementBackend(getEnvChoice(env, ENV_REFINEMENT_BACKEND, REFINEMENT_BACKENDS, DEFAULT_REFINEMENT_BACKEND))
                .denoisingStrength(parseDouble(env.get(ENV_DENOISING_STRENGTH), DEFAULT_DENOISING_STRENGTH))
                .cfgScale(parseDouble(env.get(ENV_CFG_SCALE), DEFAULT_CFG_SCALE))
                .steps(parseInt(env.get(ENV_STEPS), DEFAULT_STEPS))
                .sampler(getEnv(env, ENV_SAMPLER, null))
                .scheduler(getEnv(env, ENV_SCHEDULER, DEFAULT_SCHEDULER))
                .model(getEnv(env, ENV_MODEL, DEFAULT_MODEL))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a ratio written as {@code W:H} (e.g. {@code 16:9}) or as a decimal (e.g. {@code 1.7778}).
     * Returns {@code defaultValue} when the value is blank or malformed.
     */
    static double parseRatio(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        String v = value.trim();
        try {
            int colon = v.indexOf(':');
            if (colon > 0) {
                double w = Double.parseDouble(v.substring(0, colon).trim());
                double h = Double.parseDouble(v.substring(colon + 1).trim());
                return h > 0 ? w / h : defaultValue;
            }
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static int defaultWorkers() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    private static String getEnvChoice(Map<String, String> env, String key, Set<String> choices, String defaultValue) {
        String v = getEnv(env, key, defaultValue).toLowerCase(Locale.ROOT);
        return choices.contains(v) ? v : defaultValue;
    }

    public static final class Builder {
        private int workers = defaultWorkers();
        private double targetAspectRatio = DEFAULT_TARGET_ASPECT_RATIO;
        private int upscaleFactor = DEFAULT_UPSCALE_FACTOR;
        private String upscaleMethod = DEFAULT_UPSCALE_METHOD;
        private boolean keepCropped;
        private String styleAnchor = DEFAULT_STYLE_ANCHOR;
        private String negativePrompt = DEFAULT_NEGATIVE_PROMPT;
        private String refinementBackend = DEFAULT_REFINEMENT_BACKEND;
        private double denoisingStrength = DEFAULT_DENOISING_STRENGTH;
        private double cfgScale = DEFAULT_CFG_SCALE;
        private int steps = DEFAULT_STEPS;
        private String sampler;
        private String scheduler = DEFAULT_SCHEDULER;
        private String model = DEFAULT_MODEL;

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder targetAspectRatio(double targetAspectRatio) {
            this.targetAspectRatio = targetAspectRatio;
            return this;
        }

        public Builder upscaleFactor(int upscaleFactor) {
            this.upscaleFactor = upscaleFactor;
            return this;
        }

        public Builder upscaleMethod(String upscaleMethod) {
            this.upscaleMethod = upscaleMethod != null ? upscaleMethod.trim().toLowerCase(Locale.ROOT) : DEFAULT_UPSCALE_METHOD;
            return this;
        }

        public Builder keepCropped(boolean keepCropped) {
            this.keepCropped = keepCropped;
            return this;
        }

        public Builder styleAnchor(String styleAnchor) {
            this.styleAnchor = styleAnchor != null ? styleAnchor : "";
            return this;
        }

        public Builder negativePrompt(String negativePrompt) {
            this.negativePrompt = negativePrompt != null ? negativePrompt : "";
            return this;
        }

        public Builder refinementBackend(String refinementBackend) {
            this.refinementBackend = refinementBackend != null
                    ? refinementBackend.trim().toLowerCase(Locale.ROOT) : DEFAULT_REFINEMENT_BACKEND;
            return this;
        }

        public Builder denoisingStrength(double denoisingStrength) {
            this.denoisingStrength = denoisingStrength;
            return this;
        }

        public Builder cfgScale(double cfgScale) {
            this.cfgScale = cfgScale;
            return this;
        }

        public Builder steps(int steps) {
            this.steps = steps;
            return this;
        }

        public Builder sampler(String sampler) {
            this.sampler = sampler;
            return this;
        }

        public Builder scheduler(String scheduler) {
            this.scheduler = scheduler != null ? scheduler : DEFAULT_SCHEDULER;
            return this;
        }

        public Builder model(String model) {
            this.model = model != null ? model : DEFAULT_MODEL;
            return this;
        }

        public PanelForgeConfig build() {
            if (workers < 1) {
                throw new IllegalArgumentException("workers must be >= 1, got " + workers);
            }
            if (!(targetAspectRatio > 0) || Double.isInfinite(targetAspectRatio)) {
                throw new IllegalArgumentException("targetAspectRatio must be a positive number, got " + targetAspectRatio);
            }
            if (upscaleFactor < 1 || upscaleFactor > MAX_UPSCALE_FACTOR) {
                throw new IllegalArgumentException("upscaleFactor must be in [1, " + MAX_UPSCALE_FACTOR + "], got " + upscaleFactor);
            }
            if (!UPSCALE_METHODS.contains(upscaleMethod)) {
                throw new IllegalArgumentException("upscaleMethod must be one of " + UPSCALE_METHODS + ", got " + upscaleMethod);
            }
            if (!REFINEMENT_BACKENDS.contains(refinementBackend)) {
                throw new IllegalArgumentException("refinementBackend must be one of " + REFINEMENT_BACKENDS + ", got " + refinementBackend);
            }
            if (denoisingStrength < 0.0 || denoisingStrength > 1.0) {
                throw new IllegalArgumentException("denoisingStrength must be in [0, 1], got " + denoisingStrength);
            }
            if (steps < 1) {
                throw new IllegalArgumentException("steps must be >= 1, got " + steps);
            }
            return new PanelForgeConfig(this);
        }
    }
}
