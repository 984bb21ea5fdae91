/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

/**
 * Exhaustive traversal over {@link WorkflowNode} variants.
 *
 * @param <R> result type
 * @param <A> argument threaded through the traversal
 */
public interface NodeVisitor<R, A> {

    R visitToolInvocation(ToolInvocation node, A argument);

    R visitSequence(Sequence node, A argument);

    R visitBranch(Branch node, A argument);

    R visitFanout(Fanout node, A argument);

    R visitDispatcher(Dispatcher node, A argument);
}
