package de.mirkosertic.mcp.reranklearn.config;

import de.mirkosertic.mcp.reranklearn.adaptation.AdaptationAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Central configuration for the rerank learning server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.reranklearn/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 * <p>
 * The configuration is read once at startup and never mutated afterwards.
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_MODEL_PATH = "RERANKLEARN_MODEL_PATH";
    private static final String ENV_BATCH_THRESHOLD = "RERANKLEARN_BATCH_THRESHOLD";
    private static final String PROP_MODEL_PATH = "reranklearn.model.path";
    private static final String CONFIG_DIR = ".reranklearn";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    /**
     * Default value and initial confidence of one ranking feature.
     */
    public record FeatureDefault(String name, double value, double confidence) {
    }

    private static final List<FeatureDefault> BUILT_IN_FEATURES = List.of(
            new FeatureDefault("semantic", 0.3, 0.8),
            new FeatureDefault("graph", 0.2, 0.7),
            new FeatureDefault("contextual", 0.15, 0.6),
            new FeatureDefault("recency", 0.1, 0.5),
            new FeatureDefault("popularity", 0.1, 0.5),
            new FeatureDefault("original", 0.15, 0.9)
    );

    // Learning settings
    private int batchThreshold = 10;
    private double positiveThreshold = 0.5;
    private int maxHistoryLength = 100;
    private double emaAlpha = 0.3;
    private double regretLearningRate = 0.1;
    private AdaptationAlgorithm algorithm = AdaptationAlgorithm.EXPONENTIAL_MOVING_AVERAGE;
    private long flushIntervalMs = 30000;
    private int flushQueueCapacity = 1000;
    private boolean checkpointOnFlush = true;

    // Model settings
    private String modelPath;
    private String modelStorage = "yaml";
    private List<FeatureDefault> defaultWeights = BUILT_IN_FEATURES;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        config.validate();

        logger.info("Configuration loaded: modelPath={}, storage={}, batchThreshold={}, algorithm={}, deployedMode={}",
                config.modelPath, config.modelStorage, config.batchThreshold, config.algorithm, config.deployedMode);

        return config;
    }

    /**
     * Build a configuration from an already parsed YAML document, without consulting
     * the classpath, the user config file or the environment.
     *
     * @param yamlDocument the parsed document, rooted at the {@code reranklearn} key
     * @return the validated configuration
     */
    public static ApplicationConfig fromYaml(final Map<String, Object> yamlDocument) {
        final ApplicationConfig config = new ApplicationConfig();
        config.applyYamlConfig(yamlDocument);
        if (config.modelPath == null || config.modelPath.isEmpty()) {
            config.modelPath = getConfigDirectory().resolve("models").toString();
        }
        config.validate();
        return config;
    }

    /**
     * Configuration with built-in defaults only.
     */
    public static ApplicationConfig defaults() {
        return fromYaml(Map.of());
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> rootConfig = (Map<String, Object>) config.get("reranklearn");
        if (rootConfig == null) {
            return;
        }

        final Map<String, Object> learningConfig = (Map<String, Object>) rootConfig.get("learning");
        if (learningConfig != null) {
            applyLearningConfig(learningConfig);
        }

        final Map<String, Object> modelConfig = (Map<String, Object>) rootConfig.get("model");
        if (modelConfig != null) {
            applyModelConfig(modelConfig);
        }
    }

    private void applyLearningConfig(final Map<String, Object> learningConfig) {
        if (learningConfig.containsKey("batch-threshold")) {
            this.batchThreshold = ((Number) learningConfig.get("batch-threshold")).intValue();
        }
        if (learningConfig.containsKey("positive-threshold")) {
            this.positiveThreshold = ((Number) learningConfig.get("positive-threshold")).doubleValue();
        }
        if (learningConfig.containsKey("max-history-length")) {
            this.maxHistoryLength = ((Number) learningConfig.get("max-history-length")).intValue();
        }
        if (learningConfig.containsKey("ema-alpha")) {
            this.emaAlpha = ((Number) learningConfig.get("ema-alpha")).doubleValue();
        }
        if (learningConfig.containsKey("regret-learning-rate")) {
            this.regretLearningRate = ((Number) learningConfig.get("regret-learning-rate")).doubleValue();
        }
        if (learningConfig.containsKey("algorithm")) {
            this.algorithm = AdaptationAlgorithm.valueOf(
                    learningConfig.get("algorithm").toString().trim().toUpperCase(Locale.ROOT));
        }
        if (learningConfig.containsKey("flush-interval-ms")) {
            this.flushIntervalMs = ((Number) learningConfig.get("flush-interval-ms")).longValue();
        }
        if (learningConfig.containsKey("flush-queue-capacity")) {
            this.flushQueueCapacity = ((Number) learningConfig.get("flush-queue-capacity")).intValue();
        }
        if (learningConfig.containsKey("checkpoint-on-flush")) {
            this.checkpointOnFlush = (Boolean) learningConfig.get("checkpoint-on-flush");
        }
    }

    @SuppressWarnings("unchecked")
    private void applyModelConfig(final Map<String, Object> modelConfig) {
        final Object path = modelConfig.get("path");
        if (path != null) {
            this.modelPath = resolveVariables(path.toString());
        }
        if (modelConfig.containsKey("storage")) {
            this.modelStorage = modelConfig.get("storage").toString().trim().toLowerCase(Locale.ROOT);
        }
        final Object weights = modelConfig.get("default-weights");
        if (weights instanceof Map) {
            final List<FeatureDefault> features = new ArrayList<>();
            for (final Map.Entry<String, Object> entry : ((Map<String, Object>) weights).entrySet()) {
                features.add(toFeatureDefault(entry.getKey(), entry.getValue()));
            }
            this.defaultWeights = features;
        }
    }

    /**
     * A feature entry is either a bare number (the weight) or a map with
     * {@code value} and {@code confidence}.
     */
    @SuppressWarnings("unchecked")
    private static FeatureDefault toFeatureDefault(final String name, final Object raw) {
        if (raw instanceof Number number) {
            return new FeatureDefault(name, number.doubleValue(), 0.5);
        }
        if (raw instanceof Map) {
            final Map<String, Object> values = (Map<String, Object>) raw;
            final double value = ((Number) values.getOrDefault("value", 0.0)).doubleValue();
            final double confidence = ((Number) values.getOrDefault("confidence", 0.5)).doubleValue();
            return new FeatureDefault(name, value, confidence);
        }
        throw new IllegalArgumentException("Invalid default weight for feature '" + name + "': " + raw);
    }

    private void applyEnvironmentOverrides() {
        final String envModelPath = System.getenv(ENV_MODEL_PATH);
        if (envModelPath != null && !envModelPath.trim().isEmpty()) {
            this.modelPath = envModelPath.trim();
            logger.info("Model path from environment: {}", this.modelPath);
        }

        // Default model path if not set
        if (this.modelPath == null || this.modelPath.isEmpty()) {
            this.modelPath = getConfigDirectory().resolve("models").toString();
        }

        final String envThreshold = System.getenv(ENV_BATCH_THRESHOLD);
        if (envThreshold != null && !envThreshold.trim().isEmpty()) {
            try {
                this.batchThreshold = Integer.parseInt(envThreshold.trim());
                logger.info("Batch threshold from environment: {}", this.batchThreshold);
            } catch (final NumberFormatException e) {
                logger.warn("Ignoring non-numeric {}={}", ENV_BATCH_THRESHOLD, envThreshold);
            }
        }

        final String propModelPath = System.getProperty(PROP_MODEL_PATH);
        if (propModelPath != null && !propModelPath.isEmpty()) {
            this.modelPath = propModelPath;
        }
    }

    private void determineProfile() {
        final String profile = System.getProperty("profile", "default");
        this.deployedMode = "deployed".equalsIgnoreCase(profile);
    }

    private void validate() {
        if (batchThreshold < 1) {
            throw new IllegalArgumentException("batch-threshold must be at least 1, was " + batchThreshold);
        }
        // negated comparisons reject NaN as well
        if (!(positiveThreshold >= 0.0 && positiveThreshold <= 1.0)) {
            throw new IllegalArgumentException("positive-threshold must be within [0,1], was " + positiveThreshold);
        }
        if (!(emaAlpha > 0.0 && emaAlpha <= 1.0)) {
            throw new IllegalArgumentException("ema-alpha must be within (0,1], was " + emaAlpha);
        }
        if (!(regretLearningRate > 0.0 && regretLearningRate <= 1.0)) {
            throw new IllegalArgumentException("regret-learning-rate must be within (0,1], was " + regretLearningRate);
        }
        if (maxHistoryLength < 1) {
            throw new IllegalArgumentException("max-history-length must be at least 1, was " + maxHistoryLength);
        }
        if (flushQueueCapacity < 1) {
            throw new IllegalArgumentException("flush-queue-capacity must be at least 1, was " + flushQueueCapacity);
        }
        if (defaultWeights.isEmpty()) {
            throw new IllegalArgumentException("default-weights must name at least one feature");
        }
        if (!"yaml".equals(modelStorage) && !"memory".equals(modelStorage)) {
            throw new IllegalArgumentException("model storage must be 'yaml' or 'memory', was " + modelStorage);
        }
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String[] parts = result.substring(start + 2, end).split(":", 2);
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(parts[0]);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(parts[0], defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    // Getters
    public int getBatchThreshold() {
        return batchThreshold;
    }

    public double getPositiveThreshold() {
        return positiveThreshold;
    }

    public int getMaxHistoryLength() {
        return maxHistoryLength;
    }

    public double getEmaAlpha() {
        return emaAlpha;
    }

    public double getRegretLearningRate() {
        return regretLearningRate;
    }

    public AdaptationAlgorithm getAlgorithm() {
        return algorithm;
    }

    public long getFlushIntervalMs() {
        return flushIntervalMs;
    }

    public int getFlushQueueCapacity() {
        return flushQueueCapacity;
    }

    public boolean isCheckpointOnFlush() {
        return checkpointOnFlush;
    }

    public String getModelPath() {
        return modelPath;
    }

    public boolean isInMemoryModelStorage() {
        return "memory".equals(modelStorage);
    }

    public List<FeatureDefault> getDefaultWeights() {
        return Collections.unmodifiableList(defaultWeights);
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
