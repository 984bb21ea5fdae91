/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Two-way conditional. The else-arm is optional; without it nothing bound
 * inside the if-arm is guaranteed after the branch.
 */
public record Branch(
        String condition,
        WorkflowNode ifBranch,
        WorkflowNode elseBranch,
        String description
) implements WorkflowNode {

    public Branch {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(ifBranch, "ifBranch");
    }

    public Branch(String condition, WorkflowNode ifBranch, WorkflowNode elseBranch) {
        this(condition, ifBranch, elseBranch, null);
    }

    public Optional<WorkflowNode> elseArm() {
        return Optional.ofNullable(elseBranch);
    }

    @Override
    public NodeType type() {
        return NodeType.CONDITIONAL;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A argument) {
        return visitor.visitBranch(this, argument);
    }
}
