/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

/**
 * A node of the workflow tree.
 *
 * <p>The hierarchy is closed: every traversal implements {@link NodeVisitor},
 * so adding a node kind fails compilation in each traversal until it is
 * handled. Nodes own their children by value; the tree has no sharing and no
 * back-references.
 */
public sealed interface WorkflowNode permits ToolInvocation, Sequence, Branch, Fanout, Dispatcher {

    NodeType type();

    /**
     * Optional human-readable description, may be null.
     */
    String description();

    <R, A> R accept(NodeVisitor<R, A> visitor, A argument);
}
