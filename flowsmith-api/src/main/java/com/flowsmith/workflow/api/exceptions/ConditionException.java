/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.exceptions;

/**
 * A routing or branch condition was rejected.
 */
public class ConditionException extends CompilationException {

    private final String condition;

    public ConditionException(String message, String condition) {
        super(message);
        this.condition = condition;
    }

    public String getCondition() {
        return condition;
    }
}
