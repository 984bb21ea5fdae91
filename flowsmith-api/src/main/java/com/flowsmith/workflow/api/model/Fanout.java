/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.List;
import java.util.Objects;

/**
 * Runs its branches concurrently and joins them according to {@link JoinPolicy}.
 */
public record Fanout(List<WorkflowNode> branches, JoinPolicy joinPolicy, String description)
        implements WorkflowNode {

    public Fanout {
        branches = List.copyOf(branches);
        Objects.requireNonNull(joinPolicy, "joinPolicy");
    }

    public Fanout(List<WorkflowNode> branches, JoinPolicy joinPolicy) {
        this(branches, joinPolicy, null);
    }

    @Override
    public NodeType type() {
        return NodeType.PARALLEL;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A argument) {
        return visitor.visitFanout(this, argument);
    }
}
