/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowsmith.workflow.api.model.ValidationReport;
import com.flowsmith.workflow.compiler.WorkflowCompiler;
import com.flowsmith.workflow.compiler.codegen.ToolLibraryIndex;
import com.flowsmith.workflow.compiler.config.CompilerConfig;
import io.opentelemetry.api.OpenTelemetry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Checks a workflow document and prints every issue found.
 */
@Command(name = "validate", description = "Validates a workflow document and lists every problem found.",
        mixinStandardHelpOptions = true)
public final class ValidateCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Workflow JSON document")
    private Path document;

    @Option(names = "--json", description = "Print the report as JSON")
    private boolean json;

    public ValidateCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        String text;
        try {
            text = Files.readString(document, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Could not read " + document + ": " + e.getMessage());
            err.flush();
            return FlowsmithCli.EXIT_IO_ERROR;
        }

        // validation needs neither tools nor tracing
        WorkflowCompiler compiler = new WorkflowCompiler(OpenTelemetry.noop().getTracer("flowsmith-cli"),
                CompilerConfig.load(), ToolLibraryIndex.empty());
        ValidationReport report = compiler.validate(text);

        if (json) {
            try {
                out.println(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(report));
            } catch (JsonProcessingException e) {
                err.println("Could not render report: " + e.getMessage());
                err.flush();
                return FlowsmithCli.EXIT_INTERNAL_ERROR;
            }
        } else {
            out.println(report.formatForFeedback());
        }
        out.flush();
        return report.isValid() ? FlowsmithCli.EXIT_OK : FlowsmithCli.EXIT_INVALID;
    }
}
