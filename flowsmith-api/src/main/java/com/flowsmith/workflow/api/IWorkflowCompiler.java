/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api;

import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.flowsmith.workflow.api.model.ExecutionReport;
import com.flowsmith.workflow.api.model.ValidationReport;
import com.flowsmith.workflow.api.model.WorkflowSpec;

import io.opentelemetry.api.trace.Tracer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Contract for validating workflow documents and compiling them into
 * executable programs.
 *
 * <p>Document defects surface as
 * {@link com.flowsmith.workflow.api.exceptions.WorkflowValidationException}
 * carrying every issue of one pass; internal failures surface as
 * {@link com.flowsmith.workflow.api.exceptions.GenerationException}.
 */
public interface IWorkflowCompiler {

    /**
     * Validates a document and reports every issue found. Never throws for
     * document defects.
     */
    ValidationReport validate(String document);

    /**
     * Reads and validates a document as an atomic whole.
     *
     * @return the accepted workflow tree
     */
    WorkflowSpec parse(String document);

    /**
     * Compiles a JSON document held in memory.
     */
    CompiledWorkflow compile(String document);

    /**
     * Compiles a JSON document file.
     *
     * @throws IOException if the file cannot be read
     */
    CompiledWorkflow compile(Path documentPath) throws IOException;

    /**
     * Compiles a workflow tree built in code. The tree is validated first.
     */
    CompiledWorkflow compile(WorkflowSpec workflow);

    /**
     * Writes a workflow tree as a canonical JSON document.
     */
    String write(WorkflowSpec workflow);

    /**
     * Hands a compiled program to the runtime executor and returns its report unchanged.
     */
    ExecutionReport run(CompiledWorkflow program, Map<String, Object> parameters, IProgramExecutor executor);

    /**
     * Sets the tracer for observability.
     *
     * @param tracer the OpenTelemetry tracer
     */
    default void setTracer(Tracer tracer) {
    }

    /**
     * Sets a compilation listener for tracking compilation progress.
     *
     * @param listener the compilation listener (null to disable)
     */
    default void setCompilationListener(CompilationListener listener) {
    }
}
