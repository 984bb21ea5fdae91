/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.exceptions;

/**
 * Internal compiler failure during or after code generation.
 *
 * <p>An accepted workflow must always generate; this exception therefore
 * signals a compiler bug and is never reported as a document defect.
 */
public class GenerationException extends CompilationException {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
