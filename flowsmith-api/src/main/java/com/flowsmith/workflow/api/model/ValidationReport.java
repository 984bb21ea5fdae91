/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.workflow.api.exceptions.ErrorKind;
import com.flowsmith.workflow.api.exceptions.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of validating a document without generating code.
 */
public record ValidationReport(@JsonProperty("issues") List<ValidationIssue> issues) {

    public ValidationReport {
        issues = List.copyOf(issues);
    }

    public static ValidationReport valid() {
        return new ValidationReport(List.of());
    }

    @JsonProperty("valid")
    public boolean isValid() {
        return issues.isEmpty();
    }

    @JsonIgnore
    public List<ValidationIssue> issuesOfKind(ErrorKind kind) {
        return issues.stream().filter(issue -> issue.kind() == kind).toList();
    }

    /**
     * Renders the issues as one {@code path: message} line each, suitable for
     * returning to the author of the document so it can be corrected.
     */
    public String formatForFeedback() {
        if (issues.isEmpty()) {
            return "The workflow is valid.";
        }
        return issues.stream()
                .map(issue -> "- " + issue.path() + ": " + issue.message())
                .collect(Collectors.joining("\n", "The workflow has " + issues.size() + " problem(s):\n", ""));
    }
}
