/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.exceptions;

import java.util.List;
import java.util.Set;

/**
 * A reference names a variable that is not guaranteed to be available at
 * the point of use.
 */
public class ScopeException extends CompilationException {

    private final String missingName;
    private final List<String> availableNames;

    public ScopeException(String message, String missingName, Set<String> availableNames) {
        super(message);
        this.missingName = missingName;
        this.availableNames = availableNames.stream().sorted().toList();
    }

    public String getMissingName() {
        return missingName;
    }

    public List<String> getAvailableNames() {
        return availableNames;
    }
}
