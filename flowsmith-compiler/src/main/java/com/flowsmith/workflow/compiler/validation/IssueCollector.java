/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.validation;

import com.flowsmith.workflow.api.exceptions.ErrorKind;
import com.flowsmith.workflow.api.exceptions.ValidationIssue;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates issues across the reading, validation and scope passes.
 */
public final class IssueCollector {

    private final List<ValidationIssue> issues = new ArrayList<>();

    public void add(ErrorKind kind, String path, String message) {
        issues.add(new ValidationIssue(kind, path, message));
    }

    public void addAll(List<ValidationIssue> more) {
        issues.addAll(more);
    }

    public boolean isEmpty() {
        return issues.isEmpty();
    }

    public int size() {
        return issues.size();
    }

    public List<ValidationIssue> toList() {
        return List.copyOf(issues);
    }

    /**
     * Appends a field to a document path: {@code child("workflow", "steps")} is {@code workflow.steps}.
     */
    public static String child(String path, String field) {
        return path.isEmpty() ? field : path + "." + field;
    }

    public static String index(String path, int index) {
        return path + "[" + index + "]";
    }
}
