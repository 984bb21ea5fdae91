/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.exceptions;

/**
 * Base exception for workflow compilation failures.
 *
 * This is a RuntimeException to avoid forcing checked exception handling
 * throughout the pipeline while still giving callers one type to catch.
 */
public class CompilationException extends RuntimeException {

    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
