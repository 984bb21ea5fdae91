/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api;

import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.flowsmith.workflow.api.model.ExecutionReport;

import java.util.Map;

/**
 * Runtime that executes generated programs. Implemented outside the compiler;
 * the compiler never executes anything itself.
 */
@FunctionalInterface
public interface IProgramExecutor {

    /**
     * Executes a generated program.
     *
     * @param program the compiled program
     * @param parameters input values with credentials already resolved
     * @return the execution outcome
     */
    ExecutionReport execute(CompiledWorkflow program, Map<String, Object> parameters);
}
