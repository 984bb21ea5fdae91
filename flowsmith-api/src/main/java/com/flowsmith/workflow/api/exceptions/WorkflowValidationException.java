/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.exceptions;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a workflow document is rejected. Carries every issue found in
 * the validation pass, not just the first.
 */
public class WorkflowValidationException extends CompilationException {

    private final List<ValidationIssue> issues;

    public WorkflowValidationException(List<ValidationIssue> issues) {
        super(summarize(issues));
        this.issues = List.copyOf(issues);
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }

    private static String summarize(List<ValidationIssue> issues) {
        return "Workflow validation failed with " + issues.size() + " issue(s):\n"
                + issues.stream().map(issue -> "  - " + issue).collect(Collectors.joining("\n"));
    }
}
