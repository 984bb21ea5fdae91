/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.analysis;

import com.flowsmith.workflow.api.exceptions.ErrorKind;
import com.flowsmith.workflow.api.exceptions.ScopeException;
import com.flowsmith.workflow.api.exceptions.ValidationIssue;

import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Outcome of scope analysis: the names guaranteed after the analysed node and
 * every violation found on the way.
 */
public record ScopeAnalysis(SortedSet<String> outgoing, List<ScopeViolation> violations) {

    public ScopeAnalysis {
        outgoing = Collections.unmodifiableSortedSet(new TreeSet<>(outgoing));
        violations = List.copyOf(violations);
    }

    public boolean isSound() {
        return violations.isEmpty();
    }

    /**
     * Fails with the first violation when the tree is not sound.
     *
     * @throws ScopeException naming the missing identifier and the available names
     */
    public ScopeAnalysis requireSound() {
        if (!violations.isEmpty()) {
            ScopeViolation first = violations.get(0);
            String message = first.path() + ": " + first.message();
            if (violations.size() > 1) {
                message += " (and " + (violations.size() - 1) + " more scope error(s))";
            }
            throw new ScopeException(message, first.missingName(), first.available());
        }
        return this;
    }

    public List<ValidationIssue> toIssues() {
        return violations.stream()
                .map(violation -> new ValidationIssue(ErrorKind.SCOPE, violation.path(), violation.message()))
                .toList();
    }
}
