/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome reported by the external runtime that executed a generated program.
 * The compiler passes it through unchanged.
 *
 * @param success whether the program completed
 * @param result declared outputs on success, may be null
 * @param failureReason failure description, null on success
 * @param logLines log output captured by the runtime
 */
public record ExecutionReport(
        boolean success,
        Map<String, Object> result,
        String failureReason,
        List<String> logLines
) {
    public ExecutionReport {
        logLines = logLines == null ? List.of() : List.copyOf(logLines);
    }

    public static ExecutionReport succeeded(Map<String, Object> result, List<String> logLines) {
        return new ExecutionReport(true, result, null, logLines);
    }

    public static ExecutionReport failed(String failureReason, List<String> logLines) {
        return new ExecutionReport(false, null, failureReason, logLines);
    }
}
