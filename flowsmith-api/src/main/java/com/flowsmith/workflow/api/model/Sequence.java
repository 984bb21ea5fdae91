/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.List;

/**
 * Runs its steps in order over the shared context.
 */
public record Sequence(List<WorkflowNode> steps, String description) implements WorkflowNode {

    public Sequence {
        steps = List.copyOf(steps);
    }

    public Sequence(List<WorkflowNode> steps) {
        this(steps, null);
    }

    @Override
    public NodeType type() {
        return NodeType.SEQUENTIAL;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A argument) {
        return visitor.visitSequence(this, argument);
    }
}
