/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowsmith.workflow.api.exceptions.GenerationException;
import com.flowsmith.workflow.api.exceptions.WorkflowValidationException;
import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.flowsmith.workflow.api.model.ValidationReport;
import com.flowsmith.workflow.compiler.WorkflowCompiler;
import com.flowsmith.workflow.compiler.config.CompilerConfig;
import com.flowsmith.workflow.compiler.telemetry.TracingService;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compiles a workflow document and writes the generated class below the
 * output directory, in the directory of its package.
 */
@Command(name = "compile", description = "Compiles a workflow document into a Java source file.",
        mixinStandardHelpOptions = true)
public final class CompileCommand implements Callable<Integer> {
    private static final Logger logger = Logger.getLogger(CompileCommand.class.getName());

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", paramLabel = "FILE", description = "Workflow JSON document")
    private Path document;

    @Option(names = {"-o", "--output-dir"}, paramLabel = "DIR", description = "Source root to write to (default: .)")
    private Path outputDir = Path.of(".");

    @Option(names = {"-p", "--package"}, paramLabel = "NAME", description = "Package of the generated class")
    private String packageName;

    @Option(names = "--tool-library", paramLabel = "FILE", description = "JSON index of tool implementations")
    private Path toolLibrary;

    @Option(names = "--no-verify", description = "Skip compile-checking the generated source")
    private boolean noVerify;

    @Option(names = "--json", description = "Print the compilation summary as JSON")
    private boolean json;

    public CompileCommand() {
        // for picocli
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        TracingService tracing = TracingService.getInstance();
        try {
            WorkflowCompiler compiler = new WorkflowCompiler(tracing.getTracer(), configuration());
            CompiledWorkflow program = compiler.compile(document);

            Path target = outputDir.resolve(program.sourceFileName());
            Files.createDirectories(target.getParent());
            Files.writeString(target, program.source(), StandardCharsets.UTF_8);

            if (json) {
                out.println(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT)
                        .writeValueAsString(program));
            } else {
                out.println("Wrote " + target);
                out.println("Class: " + program.qualifiedClassName());
                out.println("Secret parameters: " + describe(program.secretParameters()));
                out.println("Tools: " + describe(program.toolNames()));
            }
            out.flush();
            return FlowsmithCli.EXIT_OK;
        } catch (WorkflowValidationException e) {
            err.println(new ValidationReport(e.getIssues()).formatForFeedback());
            err.flush();
            return FlowsmithCli.EXIT_INVALID;
        } catch (GenerationException e) {
            logger.log(Level.SEVERE, "Generator failed on " + document, e);
            err.println("Internal compiler error: " + e.getMessage());
            err.flush();
            return FlowsmithCli.EXIT_INTERNAL_ERROR;
        } catch (JsonProcessingException e) {
            err.println("Could not render summary: " + e.getMessage());
            err.flush();
            return FlowsmithCli.EXIT_INTERNAL_ERROR;
        } catch (IOException | UncheckedIOException e) {
            logger.log(Level.FINE, "I/O failure while compiling " + document, e);
            err.println("I/O error: " + e.getMessage());
            err.flush();
            return FlowsmithCli.EXIT_IO_ERROR;
        } finally {
            tracing.shutdown();
        }
    }

    private CompilerConfig configuration() {
        CompilerConfig.Builder builder = CompilerConfig.load().toBuilder();
        if (packageName != null) {
            builder.targetPackage(packageName);
        }
        if (toolLibrary != null) {
            builder.toolLibraryPath(toolLibrary);
        }
        if (noVerify) {
            builder.verifyEmittedSource(false);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private static String describe(Iterable<String> names) {
        String joined = String.join(", ", names);
        return joined.isEmpty() ? "(none)" : joined;
    }
}
