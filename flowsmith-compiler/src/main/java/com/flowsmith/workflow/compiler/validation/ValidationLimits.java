/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.validation;

/**
 * Complexity caps applied during validation.
 *
 * @param maxSequenceSteps most steps a sequential node may hold
 * @param maxFanoutBranches most branches a parallel node may hold
 * @param maxNestingDepth deepest node nesting allowed, the root being depth 1
 */
public record ValidationLimits(int maxSequenceSteps, int maxFanoutBranches, int maxNestingDepth) {

    public static final ValidationLimits DEFAULT = new ValidationLimits(100, 10, 32);

    public ValidationLimits {
        if (maxSequenceSteps < 1) {
            throw new IllegalArgumentException("maxSequenceSteps must be at least 1");
        }
        if (maxFanoutBranches < 2) {
            throw new IllegalArgumentException("maxFanoutBranches must be at least 2");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be at least 1");
        }
    }
}
