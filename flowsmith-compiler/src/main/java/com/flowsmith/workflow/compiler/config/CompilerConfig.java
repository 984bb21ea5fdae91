/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.config;

import com.flowsmith.workflow.compiler.codegen.GeneratorOptions;
import com.flowsmith.workflow.compiler.codegen.ToolLibraryIndex;
import com.flowsmith.workflow.compiler.validation.ValidationLimits;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Compiler configuration.
 *
 * <p>Values are resolved in three layers, later layers winning:
 * <ol>
 *   <li>built-in defaults;</li>
 *   <li>{@code flowsmith.properties} on the classpath, or an explicit properties file;</li>
 *   <li>environment variables.</li>
 * </ol>
 *
 * <p>Environment variables:
 * <pre>
 * FLOWSMITH_TARGET_PACKAGE=com.acme.workflows
 * FLOWSMITH_MAX_SEQUENCE_STEPS=100
 * FLOWSMITH_MAX_FANOUT_BRANCHES=10
 * FLOWSMITH_MAX_NESTING_DEPTH=32
 * FLOWSMITH_VERIFY_EMITTED_SOURCE=true
 * FLOWSMITH_TOOL_LIBRARY=/etc/flowsmith/tools.json
 * </pre>
 *
 * <p>Usage:
 * <pre>{@code
 * CompilerConfig config = CompilerConfig.load();
 *
 * CompilerConfig custom = CompilerConfig.builder()
 *     .targetPackage("com.acme.workflows")
 *     .verifyEmittedSource(false)
 *     .build();
 * }</pre>
 */
public final class CompilerConfig {

    private static final Logger logger = Logger.getLogger(CompilerConfig.class.getName());

    public static final String DEFAULT_PROPERTIES_RESOURCE = "flowsmith.properties";

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    static final String ENV_TARGET_PACKAGE = "FLOWSMITH_TARGET_PACKAGE";
    static final String ENV_MAX_SEQUENCE_STEPS = "FLOWSMITH_MAX_SEQUENCE_STEPS";
    static final String ENV_MAX_FANOUT_BRANCHES = "FLOWSMITH_MAX_FANOUT_BRANCHES";
    static final String ENV_MAX_NESTING_DEPTH = "FLOWSMITH_MAX_NESTING_DEPTH";
    static final String ENV_VERIFY_EMITTED_SOURCE = "FLOWSMITH_VERIFY_EMITTED_SOURCE";
    static final String ENV_TOOL_LIBRARY = "FLOWSMITH_TOOL_LIBRARY";

    // ========================================================================
    // PROPERTY KEYS
    // ========================================================================

    static final String PROP_TARGET_PACKAGE = "flowsmith.target.package";
    static final String PROP_MAX_SEQUENCE_STEPS = "flowsmith.max.sequence.steps";
    static final String PROP_MAX_FANOUT_BRANCHES = "flowsmith.max.fanout.branches";
    static final String PROP_MAX_NESTING_DEPTH = "flowsmith.max.nesting.depth";
    static final String PROP_VERIFY_EMITTED_SOURCE = "flowsmith.verify.emitted.source";
    static final String PROP_TOOL_LIBRARY = "flowsmith.tool.library";

    private final String targetPackage;
    private final int maxSequenceSteps;
    private final int maxFanoutBranches;
    private final int maxNestingDepth;
    private final boolean verifyEmittedSource;
    private final Path toolLibraryPath;

    private CompilerConfig(Builder builder) {
        this.targetPackage = builder.targetPackage;
        this.maxSequenceSteps = builder.maxSequenceSteps;
        this.maxFanoutBranches = builder.maxFanoutBranches;
        this.maxNestingDepth = builder.maxNestingDepth;
        this.verifyEmittedSource = builder.verifyEmittedSource;
        this.toolLibraryPath = builder.toolLibraryPath;
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    public static CompilerConfig defaults() {
        return builder().build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES_RESOURCE} from the classpath if present,
     * then applies environment overrides.
     */
    public static CompilerConfig load() {
        Properties properties = new Properties();
        try (InputStream in = CompilerConfig.class.getClassLoader()
                .getResourceAsStream(DEFAULT_PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
                logger.fine("Loaded " + properties.size() + " properties from classpath: "
                        + DEFAULT_PROPERTIES_RESOURCE);
            }
        } catch (IOException e) {
            logger.warning("Could not read " + DEFAULT_PROPERTIES_RESOURCE + " from classpath: " + e.getMessage());
        }
        return builder().properties(properties).environment(System.getenv()).build();
    }

    /**
     * Loads an explicit properties file, then applies environment overrides.
     *
     * @throws IOException if the file cannot be read
     */
    public static CompilerConfig load(Path propertiesFile) throws IOException {
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(propertiesFile)) {
            properties.load(in);
        }
        logger.info("Loaded " + properties.size() + " properties from file: " + propertiesFile);
        return builder().properties(properties).environment(System.getenv()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.targetPackage = targetPackage;
        builder.maxSequenceSteps = maxSequenceSteps;
        builder.maxFanoutBranches = maxFanoutBranches;
        builder.maxNestingDepth = maxNestingDepth;
        builder.verifyEmittedSource = verifyEmittedSource;
        builder.toolLibraryPath = toolLibraryPath;
        return builder;
    }

    // ========================================================================
    // DERIVED VALUES
    // ========================================================================

    public ValidationLimits toValidationLimits() {
        return new ValidationLimits(maxSequenceSteps, maxFanoutBranches, maxNestingDepth);
    }

    public GeneratorOptions toGeneratorOptions() {
        return new GeneratorOptions(targetPackage);
    }

    /**
     * Loads the configured tool library file, or the bundled
     * {@value ToolLibraryIndex#DEFAULT_RESOURCE} when no file is configured.
     *
     * @throws IOException if the library cannot be read or is malformed
     */
    public ToolLibraryIndex loadToolLibrary() throws IOException {
        if (toolLibraryPath != null) {
            return ToolLibraryIndex.load(toolLibraryPath);
        }
        return ToolLibraryIndex.loadResource(ToolLibraryIndex.DEFAULT_RESOURCE);
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    public String getTargetPackage() {
        return targetPackage;
    }

    public int getMaxSequenceSteps() {
        return maxSequenceSteps;
    }

    public int getMaxFanoutBranches() {
        return maxFanoutBranches;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public boolean isVerifyEmittedSource() {
        return verifyEmittedSource;
    }

    public Optional<Path> getToolLibraryPath() {
        return Optional.ofNullable(toolLibraryPath);
    }

    @Override
    public String toString() {
        return "CompilerConfig{" +
                "targetPackage='" + targetPackage + '\'' +
                ", maxSequenceSteps=" + maxSequenceSteps +
                ", maxFanoutBranches=" + maxFanoutBranches +
                ", maxNestingDepth=" + maxNestingDepth +
                ", verifyEmittedSource=" + verifyEmittedSource +
                ", toolLibraryPath=" + toolLibraryPath +
                '}';
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static final class Builder {
        private String targetPackage = GeneratorOptions.DEFAULT_PACKAGE;
        private int maxSequenceSteps = ValidationLimits.DEFAULT.maxSequenceSteps();
        private int maxFanoutBranches = ValidationLimits.DEFAULT.maxFanoutBranches();
        private int maxNestingDepth = ValidationLimits.DEFAULT.maxNestingDepth();
        private boolean verifyEmittedSource = true;
        private Path toolLibraryPath;

        private Builder() {
        }

        public Builder targetPackage(String targetPackage) {
            this.targetPackage = targetPackage;
            return this;
        }

        public Builder maxSequenceSteps(int maxSequenceSteps) {
            this.maxSequenceSteps = maxSequenceSteps;
            return this;
        }

        public Builder maxFanoutBranches(int maxFanoutBranches) {
            this.maxFanoutBranches = maxFanoutBranches;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder verifyEmittedSource(boolean verifyEmittedSource) {
            this.verifyEmittedSource = verifyEmittedSource;
            return this;
        }

        public Builder toolLibraryPath(Path toolLibraryPath) {
            this.toolLibraryPath = toolLibraryPath;
            return this;
        }

        /**
         * Applies values from a properties source. Malformed values are logged and ignored.
         */
        public Builder properties(Properties properties) {
            apply(properties::getProperty, PROP_TARGET_PACKAGE, PROP_MAX_SEQUENCE_STEPS, PROP_MAX_FANOUT_BRANCHES,
                    PROP_MAX_NESTING_DEPTH, PROP_VERIFY_EMITTED_SOURCE, PROP_TOOL_LIBRARY);
            return this;
        }

        /**
         * Applies {@code FLOWSMITH_*} overrides from an environment map. Malformed values are logged and ignored.
         */
        public Builder environment(Map<String, String> environment) {
            apply(environment::get, ENV_TARGET_PACKAGE, ENV_MAX_SEQUENCE_STEPS, ENV_MAX_FANOUT_BRANCHES,
                    ENV_MAX_NESTING_DEPTH, ENV_VERIFY_EMITTED_SOURCE, ENV_TOOL_LIBRARY);
            return this;
        }

        private void apply(Function<String, String> source, String packageKey, String stepsKey, String branchesKey,
                           String depthKey, String verifyKey, String libraryKey) {
            getString(source, packageKey).ifPresent(val -> this.targetPackage = val);
            getInt(source, stepsKey).ifPresent(val -> this.maxSequenceSteps = val);
            getInt(source, branchesKey).ifPresent(val -> this.maxFanoutBranches = val);
            getInt(source, depthKey).ifPresent(val -> this.maxNestingDepth = val);
            getBoolean(source, verifyKey).ifPresent(val -> this.verifyEmittedSource = val);
            getString(source, libraryKey).ifPresent(val -> this.toolLibraryPath = Paths.get(val));
        }

        public CompilerConfig build() {
            // both throw IllegalArgumentException on bad values
            new ValidationLimits(maxSequenceSteps, maxFanoutBranches, maxNestingDepth);
            new GeneratorOptions(targetPackage);
            return new CompilerConfig(this);
        }

        // ====================================================================
        // VALUE PARSING
        // ====================================================================

        private static Optional<String> getString(Function<String, String> source, String key) {
            String value = source.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded config value: " + key + "=" + value.trim());
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getInt(Function<String, String> source, String key) {
            return getString(source, key).flatMap(val -> {
                try {
                    return Optional.of(Integer.parseInt(val));
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return Optional.empty();
                }
            });
        }

        private static Optional<Boolean> getBoolean(Function<String, String> source, String key) {
            return getString(source, key).flatMap(val -> {
                String normalized = val.toLowerCase(Locale.ROOT);
                if ("true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized)) {
                    return Optional.of(Boolean.TRUE);
                }
                if ("false".equals(normalized) || "0".equals(normalized) || "no".equals(normalized)) {
                    return Optional.of(Boolean.FALSE);
                }
                logger.warning("Invalid boolean value for " + key + ": " + val);
                return Optional.empty();
            });
        }
    }
}
