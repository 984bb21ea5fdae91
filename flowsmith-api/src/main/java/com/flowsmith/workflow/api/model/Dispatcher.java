/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes to exactly one named sub-workflow. Rules are evaluated in declared
 * order and the first match wins; the default applies when none match.
 */
public record Dispatcher(
        Map<String, WorkflowNode> subWorkflows,
        List<RoutingRule> routingRules,
        String defaultWorkflow,
        String description
) implements WorkflowNode {

    public Dispatcher {
        subWorkflows = Collections.unmodifiableMap(new LinkedHashMap<>(subWorkflows));
        routingRules = List.copyOf(routingRules);
    }

    public Dispatcher(Map<String, WorkflowNode> subWorkflows, List<RoutingRule> routingRules, String defaultWorkflow) {
        this(subWorkflows, routingRules, defaultWorkflow, null);
    }

    public Optional<String> fallback() {
        return Optional.ofNullable(defaultWorkflow);
    }

    @Override
    public NodeType type() {
        return NodeType.ORCHESTRATOR;
    }

    @Override
    public <R, A> R accept(NodeVisitor<R, A> visitor, A argument) {
        return visitor.visitDispatcher(this, argument);
    }
}
