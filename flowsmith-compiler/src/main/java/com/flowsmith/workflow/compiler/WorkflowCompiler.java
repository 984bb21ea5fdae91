/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler;

import com.flowsmith.workflow.api.CompilationListener;
import com.flowsmith.workflow.api.CompilationListener.Stage;
import com.flowsmith.workflow.api.CompilationListener.StageResult;
import com.flowsmith.workflow.api.IProgramExecutor;
import com.flowsmith.workflow.api.IWorkflowCompiler;
import com.flowsmith.workflow.api.exceptions.ErrorKind;
import com.flowsmith.workflow.api.exceptions.GenerationException;
import com.flowsmith.workflow.api.exceptions.ValidationIssue;
import com.flowsmith.workflow.api.exceptions.WorkflowValidationException;
import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.flowsmith.workflow.api.model.ExecutionReport;
import com.flowsmith.workflow.api.model.ValidationReport;
import com.flowsmith.workflow.api.model.WorkflowSpec;
import com.flowsmith.workflow.compiler.codegen.EmittedSourceVerifier;
import com.flowsmith.workflow.compiler.codegen.JavaProgramGenerator;
import com.flowsmith.workflow.compiler.codegen.ToolLibraryIndex;
import com.flowsmith.workflow.compiler.config.CompilerConfig;
import com.flowsmith.workflow.compiler.parse.ParsedDocument;
import com.flowsmith.workflow.compiler.parse.WorkflowDocumentReader;
import com.flowsmith.workflow.compiler.parse.WorkflowDocumentWriter;
import com.flowsmith.workflow.compiler.validation.WorkflowValidator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates workflow documents and compiles them into Java programs.
 *
 * <p>Compilation runs five stages, each traced as a span and reported to
 * the {@link CompilationListener}: parsing, structural validation, scope
 * analysis, generation and verification. Document defects from the first
 * three stages are collected into one {@link WorkflowValidationException};
 * a {@link GenerationException} from the last two is an internal error and
 * is logged as such.
 *
 * <p>Instances are not thread-safe while a listener or tracer is being
 * replaced; compiling itself keeps no state between calls.
 */
public class WorkflowCompiler implements IWorkflowCompiler {
    private static final Logger logger = Logger.getLogger(WorkflowCompiler.class.getName());

    private final CompilerConfig config;
    private final ToolLibraryIndex toolLibrary;
    private final WorkflowDocumentReader reader = new WorkflowDocumentReader();
    private final WorkflowDocumentWriter writer = new WorkflowDocumentWriter();
    private final WorkflowValidator validator;
    private final JavaProgramGenerator generator;
    private final EmittedSourceVerifier verifier;

    private Tracer tracer;
    private CompilationListener listener = CompilationListener.NONE;

    public WorkflowCompiler(Tracer tracer) {
        this(tracer, CompilerConfig.load());
    }

    /**
     * Creates a compiler using the tool library named by the configuration.
     *
     * @throws UncheckedIOException if the tool library cannot be loaded
     */
    public WorkflowCompiler(Tracer tracer, CompilerConfig config) {
        this(tracer, config, loadToolLibrary(config));
    }

    public WorkflowCompiler(Tracer tracer, CompilerConfig config, ToolLibraryIndex toolLibrary) {
        this(tracer, config, toolLibrary, new EmittedSourceVerifier());
    }

    WorkflowCompiler(Tracer tracer, CompilerConfig config, ToolLibraryIndex toolLibrary,
                     EmittedSourceVerifier verifier) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
        this.config = Objects.requireNonNull(config, "config");
        this.toolLibrary = Objects.requireNonNull(toolLibrary, "toolLibrary");
        this.validator = new WorkflowValidator(config.toValidationLimits());
        this.generator = new JavaProgramGenerator(config.toGeneratorOptions());
        this.verifier = verifier;
    }

    private static ToolLibraryIndex loadToolLibrary(CompilerConfig config) {
        try {
            return config.loadToolLibrary();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not load tool library: " + e.getMessage(), e);
        }
    }

    @Override
    public void setTracer(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer");
    }

    @Override
    public void setCompilationListener(CompilationListener listener) {
        this.listener = listener == null ? CompilationListener.NONE : listener;
    }

    public CompilerConfig getConfig() {
        return config;
    }

    public ToolLibraryIndex getToolLibrary() {
        return toolLibrary;
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    @Override
    public ValidationReport validate(String document) {
        Span span = tracer.spanBuilder("validate-workflow").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            List<ValidationIssue> issues = check(document).issues();
            span.setAttribute("issueCount", issues.size());
            logger.fine(() -> "Validation found " + issues.size() + " issue(s)");
            return new ValidationReport(issues);
        } finally {
            span.end();
        }
    }

    @Override
    public WorkflowSpec parse(String document) {
        Span span = tracer.spanBuilder("parse-workflow").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            return accept(check(document));
        } catch (WorkflowValidationException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * Runs the first three stages and collects every issue.
     */
    private Checked check(String document) {
        ParsedDocument parsed = stage(Stage.PARSING, () -> reader.read(document),
                doc -> Map.of("issueCount", doc.issues().size(), "complete", doc.complete()));

        List<ValidationIssue> structural = stage(Stage.VALIDATION, () -> validator.validateStructure(parsed),
                issues -> Map.of("issueCount", issues.size()));

        List<ValidationIssue> scope = stage(Stage.SCOPE_ANALYSIS, () -> validator.validateScope(parsed),
                issues -> Map.of("issueCount", issues.size(), "skipped", !parsed.complete()));

        List<ValidationIssue> all = new ArrayList<>(structural);
        all.addAll(scope);
        return new Checked(parsed, List.copyOf(all));
    }

    private WorkflowSpec accept(Checked checked) {
        if (!checked.issues().isEmpty()) {
            WorkflowValidationException error = new WorkflowValidationException(checked.issues());
            listener.onError(checked.issues().stream().allMatch(issue -> issue.kind() == ErrorKind.SCOPE)
                    ? Stage.SCOPE_ANALYSIS : Stage.VALIDATION, error);
            logger.info("Workflow rejected with " + checked.issues().size() + " issue(s)");
            throw error;
        }
        return checked.document().toSpec().orElseThrow(() -> new IllegalStateException(
                "Document without issues must have a name and a workflow"));
    }

    private record Checked(ParsedDocument document, List<ValidationIssue> issues) {
    }

    // ========================================================================
    // COMPILATION
    // ========================================================================

    @Override
    public CompiledWorkflow compile(Path documentPath) throws IOException {
        logger.info("Compiling workflow document: " + documentPath);
        return compile(Files.readString(documentPath, StandardCharsets.UTF_8));
    }

    /**
     * Compiles a tree built in code. The tree is written and read back so that
     * it passes exactly the checks a document does, including secret
     * classification of its inputs.
     */
    @Override
    public CompiledWorkflow compile(WorkflowSpec workflow) {
        return compile(write(workflow));
    }

    @Override
    public CompiledWorkflow compile(String document) {
        Span span = tracer.spanBuilder("compile-workflow").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            long startTime = System.nanoTime();

            WorkflowSpec workflow = accept(check(document));
            span.setAttribute("workflowName", workflow.name());

            CompiledWorkflow program = stage(Stage.GENERATION, () -> generator.generate(workflow, toolLibrary),
                    result -> Map.of("toolCount", result.toolNames().size(),
                            "secretCount", result.secretParameters().size(),
                            "sourceLength", result.source().length()));

            stage(Stage.VERIFICATION, () -> verify(workflow, program),
                    verified -> Map.of("sourceVerified", verified));

            long elapsed = System.nanoTime() - startTime;
            span.setAttribute("className", program.qualifiedClassName());
            span.setAttribute("toolCount", program.toolNames().size());
            logger.info(String.format("Compiled workflow '%s' to %s in %d ms",
                    workflow.name(), program.qualifiedClassName(), elapsed / 1_000_000));
            return program;
        } catch (GenerationException e) {
            logger.log(Level.SEVERE, "Internal compiler error; please report this together with the workflow", e);
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, "internal compiler error");
            throw e;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /**
     * @return whether the emitted source was compiled in memory
     */
    private boolean verify(WorkflowSpec workflow, CompiledWorkflow program) {
        checkRoundTrip(workflow);
        return config.isVerifyEmittedSource() && verifier.verify(program);
    }

    private void checkRoundTrip(WorkflowSpec workflow) {
        String written = writer.write(workflow);
        WorkflowSpec reread = reader.read(written).toSpec().orElseThrow(() -> new GenerationException(
                "Written document for workflow '" + workflow.name() + "' could not be read back"));
        if (!reread.equals(workflow) || !writer.write(reread).equals(written)) {
            throw new GenerationException("Workflow '" + workflow.name()
                    + "' does not survive a write/read round trip");
        }
    }

    @Override
    public String write(WorkflowSpec workflow) {
        return writer.write(workflow);
    }

    // ========================================================================
    // EXECUTION HAND-OFF
    // ========================================================================

    @Override
    public ExecutionReport run(CompiledWorkflow program, Map<String, Object> parameters, IProgramExecutor executor) {
        Objects.requireNonNull(program, "program");
        Objects.requireNonNull(executor, "executor");
        Span span = tracer.spanBuilder("run-workflow").startSpan();
        try (Scope ignored = span.makeCurrent()) {
            span.setAttribute("className", program.qualifiedClassName());
            ExecutionReport report = executor.execute(program, parameters == null ? Map.of() : parameters);
            span.setAttribute("success", report.success());
            if (report.success()) {
                logger.info("Workflow " + program.qualifiedClassName() + " completed");
            } else {
                logger.warning("Workflow " + program.qualifiedClassName() + " failed: " + report.failureReason());
            }
            return report;
        } finally {
            span.end();
        }
    }

    // ========================================================================
    // STAGES
    // ========================================================================

    private <T> T stage(Stage stage, Supplier<T> body, Function<T, Map<String, Object>> metrics) {
        listener.onStageStart(stage);
        Span span = tracer.spanBuilder(stage.spanName()).startSpan();
        long start = System.nanoTime();
        try (Scope ignored = span.makeCurrent()) {
            T result = body.get();
            listener.onStageComplete(stage, new StageResult(stage, System.nanoTime() - start, metrics.apply(result)));
            return result;
        } catch (RuntimeException e) {
            span.recordException(e);
            listener.onError(stage, e);
            throw e;
        } finally {
            span.end();
        }
    }
}
