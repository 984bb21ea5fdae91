/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.Objects;

/**
 * Routes to the named sub-workflow when the condition holds.
 */
public record RoutingRule(
        String condition,
        String target
) {
    public RoutingRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(target, "target");
    }
}
