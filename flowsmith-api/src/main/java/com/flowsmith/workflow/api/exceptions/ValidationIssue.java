/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.exceptions;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One defect found in a workflow document.
 *
 * @param kind defect category
 * @param path location in the document, e.g. {@code workflow.steps[1].condition}
 * @param message description in domain terms
 */
public record ValidationIssue(
        @JsonProperty("kind") ErrorKind kind,
        @JsonProperty("path") String path,
        @JsonProperty("message") String message
) {
    public ValidationIssue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(message, "message");
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
