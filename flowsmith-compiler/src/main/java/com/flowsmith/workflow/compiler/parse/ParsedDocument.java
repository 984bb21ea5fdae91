/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.parse;

import com.flowsmith.workflow.api.exceptions.ValidationIssue;
import com.flowsmith.workflow.api.model.InputParam;
import com.flowsmith.workflow.api.model.OutputParam;
import com.flowsmith.workflow.api.model.WorkflowNode;
import com.flowsmith.workflow.api.model.WorkflowSpec;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything the reader could recover from a document, together with the
 * structural issues it found.
 *
 * <p>Fields are null when absent or unreadable. {@code complete} is false
 * when a node had to be dropped, in which case the recovered tree has holes
 * and flow-sensitive checks over it would be unreliable.
 *
 * <p>{@code aliasedPaths} maps the canonical path of a field to the path the
 * document actually used, for fields read under an accepted alias such as
 * {@code workflow} for {@code workflow_name} in a routing rule.
 */
public record ParsedDocument(
        String name,
        String description,
        String version,
        List<InputParam> inputs,
        List<OutputParam> outputs,
        WorkflowNode workflow,
        Map<String, Object> metadata,
        List<ValidationIssue> issues,
        boolean complete,
        Map<String, String> aliasedPaths
) {
    public ParsedDocument {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        metadata = metadata == null ? Map.of() : metadata;
        issues = List.copyOf(issues);
        aliasedPaths = aliasedPaths == null ? Map.of() : Map.copyOf(aliasedPaths);
    }

    public ParsedDocument(String name, String description, String version, List<InputParam> inputs,
                          List<OutputParam> outputs, WorkflowNode workflow, Map<String, Object> metadata,
                          List<ValidationIssue> issues, boolean complete) {
        this(name, description, version, inputs, outputs, workflow, metadata, issues, complete, Map.of());
    }

    public static ParsedDocument of(WorkflowSpec spec) {
        return new ParsedDocument(spec.name(), spec.description(), spec.version(), spec.inputs(), spec.outputs(),
                spec.workflow(), spec.metadata(), List.of(), true);
    }

    /**
     * Path to report for a field, following the key the document used.
     */
    public String sourcePath(String canonicalPath) {
        return aliasedPaths.getOrDefault(canonicalPath, canonicalPath);
    }

    /**
     * The recovered tree as a workflow, when the root node and name could be read.
     */
    public Optional<WorkflowSpec> toSpec() {
        if (workflow == null || name == null) {
            return Optional.empty();
        }
        return Optional.of(new WorkflowSpec(name, description, version, inputs, outputs, workflow, metadata));
    }
}
