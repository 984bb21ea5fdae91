/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.analysis;

import java.util.SortedSet;

/**
 * A reference whose root name is not guaranteed to be available where it is used.
 *
 * @param path document path of the offending field
 * @param reference the reference as written
 * @param missingName the unavailable root name
 * @param available names that are available at that point
 * @param message description naming the missing identifier and the available names
 */
public record ScopeViolation(
        String path,
        String reference,
        String missingName,
        SortedSet<String> available,
        String message
) {
}
