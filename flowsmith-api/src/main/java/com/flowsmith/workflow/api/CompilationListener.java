/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api;

import java.util.Locale;
import java.util.Map;

/**
 * Receives progress events while a workflow document is compiled.
 *
 * <p>A compile passes through the {@link Stage}s in declaration order. A
 * call to {@code validate} stops after {@link Stage#SCOPE_ANALYSIS}, and a
 * rejected document stops at the stage that found its issues. Every hook has
 * an empty default, so an implementation overrides only what it watches:
 *
 * <pre>
 * compiler.setCompilationListener(new CompilationListener() {
 *     {@literal @}Override
 *     public void onStageComplete(Stage stage, StageResult result) {
 *         log.fine(stage.number() + "/" + Stage.count() + " " + stage + ": " + result.metrics());
 *     }
 * });
 * </pre>
 *
 * <p>Hooks run on the compiling thread. An exception thrown by a hook
 * aborts the compile.
 */
public interface CompilationListener {

    /** Listener that ignores every event. */
    CompilationListener NONE = new CompilationListener() {
    };

    /**
     * Stages of a compile.
     */
    enum Stage {
        /** JSON text to workflow tree; metrics {@code issueCount}, {@code complete}. */
        PARSING,
        /** Identifiers, types, conditions, credentials and caps; metric {@code issueCount}. */
        VALIDATION,
        /** Availability of every {@code {{reference}}}; metrics {@code issueCount}, {@code skipped}. */
        SCOPE_ANALYSIS,
        /** Java source emission; metrics {@code toolCount}, {@code secretCount}, {@code sourceLength}. */
        GENERATION,
        /** In-memory compile of the emitted source; metric {@code sourceVerified}. */
        VERIFICATION;

        /**
         * 1-based position of the stage.
         */
        public int number() {
            return ordinal() + 1;
        }

        /**
         * Span name used when the stage is traced, e.g. {@code scope-analysis}.
         */
        public String spanName() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }

        public static int count() {
            return values().length;
        }
    }

    default void onStageStart(Stage stage) {
    }

    default void onStageComplete(Stage stage, StageResult result) {
    }

    /**
     * Called once when a compile fails, with the stage the failure is charged to.
     * A document rejected for scope issues alone is charged to
     * {@link Stage#SCOPE_ANALYSIS}; any other rejection to {@link Stage#VALIDATION}.
     */
    default void onError(Stage stage, RuntimeException error) {
    }

    /**
     * Outcome of a completed stage.
     *
     * @param stage the stage
     * @param durationNanos wall-clock time spent in the stage
     * @param metrics stage-specific values, see {@link Stage}
     */
    record StageResult(Stage stage, long durationNanos, Map<String, Object> metrics) {

        public StageResult {
            metrics = Map.copyOf(metrics);
        }

        public long durationMicros() {
            return durationNanos / 1_000;
        }

        public Object metric(String name) {
            return metrics.get(name);
        }
    }
}
