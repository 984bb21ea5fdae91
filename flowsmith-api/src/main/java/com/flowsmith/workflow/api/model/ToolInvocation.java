/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Calls one opaque tool operation.
 *
 * @param toolName name of the tool operation
 * @param parameters ordered argument map; values are JSON literals whose strings may carry references
 * @param bindsTo context key receiving the result, may be null
 * @param description optional description, may be null
 */
public record ToolInvocation(
        String toolName,
        Map<String, Object> parameters,
        String bindsTo,
        String description
) implements WorkflowNode {

    public ToolInvocation {
        Objects.requireNonNull(toolName, "toolName");
        parameters = ParameterValues.freezeMap(parameters == null ? Map.of() : parameters);
    }

    public ToolInvocation(String toolName, Map<String, Object> parameters, String bindsTo) {
        this(toolName, parameters, bindsTo, null);
    }

    public Optional<String> binding() {
        return Optional.ofNullable(bindsTo);
    }

    @Override
    public NodeType type() {
        return NodeType.TOOL_CALL;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A argument) {
        return visitor.visitToolInvocation(this, argument);
    }
}
