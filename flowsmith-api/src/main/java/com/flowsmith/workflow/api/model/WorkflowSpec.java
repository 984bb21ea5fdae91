/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Root of an accepted workflow document.
 *
 * <p>Instances handed out by the compiler have passed validation and scope
 * analysis as a whole; a partially valid tree is never returned.
 *
 * @param name workflow identifier
 * @param description human-readable purpose
 * @param version semantic version {@code X.Y.Z}
 * @param inputs declared inputs, in order
 * @param outputs declared outputs, in order
 * @param workflow root node
 * @param metadata free-form metadata
 */
public record WorkflowSpec(
        String name,
        String description,
        String version,
        List<InputParam> inputs,
        List<OutputParam> outputs,
        WorkflowNode workflow,
        Map<String, Object> metadata
) {
    public static final String DEFAULT_VERSION = "1.0.0";

    public WorkflowSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(workflow, "workflow");
        version = version == null ? DEFAULT_VERSION : version;
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        metadata = ParameterValues.freezeMap(metadata == null ? Map.of() : metadata);
    }

    /**
     * Names of inputs classified as secret, sorted.
     */
    public Set<String> secretInputNames() {
        Set<String> names = new TreeSet<>();
        for (InputParam input : inputs) {
            if (input.secret()) {
                names.add(input.name());
            }
        }
        return names;
    }
}
