/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Output of a successful compilation. Serializes to a summary without the
 * tree or the source text.
 *
 * @param workflow the accepted AST the program was generated from
 * @param packageName package of the generated class, empty for the default package
 * @param className simple name of the generated class
 * @param source generated Java source text
 * @param secretParameters names of inputs classified secret, sorted
 * @param toolNames distinct tool names used by the workflow, sorted
 */
public record CompiledWorkflow(
        @JsonIgnore WorkflowSpec workflow,
        @JsonProperty("packageName") String packageName,
        @JsonProperty("className") String className,
        @JsonIgnore String source,
        @JsonProperty("secretParameters") SortedSet<String> secretParameters,
        @JsonProperty("toolNames") SortedSet<String> toolNames
) {
    public CompiledWorkflow {
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(source, "source");
        packageName = packageName == null ? "" : packageName;
        secretParameters = Collections.unmodifiableSortedSet(new TreeSet<>(secretParameters));
        toolNames = Collections.unmodifiableSortedSet(new TreeSet<>(toolNames));
    }

    public String qualifiedClassName() {
        return packageName.isEmpty() ? className : packageName + "." + className;
    }

    /**
     * Path of the source file relative to a source root, e.g. {@code com/acme/OrderWorkflow.java}.
     */
    public String sourceFileName() {
        return qualifiedClassName().replace('.', '/') + ".java";
    }
}
