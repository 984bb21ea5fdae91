/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.api.exceptions.GenerationException;
import com.flowsmith.workflow.api.model.CompiledWorkflow;
import com.sun.source.util.JavacTask;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Checks that generated source text is valid Java and compiles.
 *
 * <p>The source is parsed first, then compiled in memory against the
 * classpath of the running JVM; class files are discarded. Library tool
 * classes may be missing from that classpath, so unresolved symbol errors
 * do not fail the check. Every other error does, including limits the
 * class file format imposes such as the size of a method. When the running
 * JVM has no system compiler (a JRE) the check is skipped with a warning.
 */
public class EmittedSourceVerifier {
    private static final Logger logger = Logger.getLogger(EmittedSourceVerifier.class.getName());

    private static final String UNRESOLVED_SYMBOL = "compiler.err.cant.resolve";
    private static final String MISSING_PACKAGE = "compiler.err.doesnt.exist";

    private final JavaCompiler compiler;

    public EmittedSourceVerifier() {
        this(ToolProvider.getSystemJavaCompiler());
    }

    public EmittedSourceVerifier(JavaCompiler compiler) {
        this.compiler = compiler;
    }

    public boolean isAvailable() {
        return compiler != null;
    }

    /**
     * @return {@code true} if the source was checked, {@code false} if the check was skipped
     * @throws GenerationException if the source does not parse or does not compile
     */
    public boolean verify(CompiledWorkflow program) {
        if (compiler == null) {
            logger.warning("No system Java compiler available; skipping verification of "
                    + program.qualifiedClassName());
            return false;
        }

        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        JavaFileObject unit = new SourceText(program.sourceFileName(), program.source());
        try (StandardJavaFileManager standard =
                     compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            JavacTask task = (JavacTask) compiler.getTask(null, new DiscardingFileManager(standard), diagnostics,
                    List.of("-proc:none"), null, List.of(unit));
            task.parse();
            List<Diagnostic<? extends JavaFileObject>> syntaxErrors = errors(diagnostics);
            if (!syntaxErrors.isEmpty()) {
                throw new GenerationException("Generated source for " + program.qualifiedClassName()
                        + " is not valid Java: " + describe(syntaxErrors));
            }

            task.generate();
        } catch (IOException e) {
            throw new GenerationException("Could not compile generated source for " + program.qualifiedClassName(), e);
        }

        List<Diagnostic<? extends JavaFileObject>> errors = errors(diagnostics);
        List<Diagnostic<? extends JavaFileObject>> defects = errors.stream()
                .filter(d -> !isMissingLibrary(d))
                .collect(Collectors.toList());
        if (!defects.isEmpty()) {
            throw new GenerationException("Generated source for " + program.qualifiedClassName()
                    + " does not compile: " + describe(defects));
        }
        if (!errors.isEmpty()) {
            logger.fine(() -> "Library classes of " + program.qualifiedClassName()
                    + " are not on the classpath; checked syntax only");
        } else {
            logger.fine(() -> "Verified generated source " + program.sourceFileName());
        }
        return true;
    }

    private static List<Diagnostic<? extends JavaFileObject>> errors(DiagnosticCollector<JavaFileObject> diagnostics) {
        return diagnostics.getDiagnostics().stream()
                .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                .collect(Collectors.toList());
    }

    private static boolean isMissingLibrary(Diagnostic<?> diagnostic) {
        String code = diagnostic.getCode();
        return code != null && (code.startsWith(UNRESOLVED_SYMBOL) || code.equals(MISSING_PACKAGE));
    }

    private static String describe(List<Diagnostic<? extends JavaFileObject>> errors) {
        return errors.stream()
                .map(d -> "line " + d.getLineNumber() + ": " + d.getMessage(Locale.ROOT))
                .collect(Collectors.joining("; "));
    }

    private static final class SourceText extends SimpleJavaFileObject {
        private final String text;

        SourceText(String fileName, String text) {
            super(URI.create("string:///" + fileName), Kind.SOURCE);
            this.text = text;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return text;
        }
    }

    /**
     * Accepts class file output in memory and drops it.
     */
    private static final class DiscardingFileManager extends ForwardingJavaFileManager<JavaFileManager> {

        DiscardingFileManager(JavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className, JavaFileObject.Kind kind,
                                                   FileObject sibling) {
            URI uri = URI.create("mem:///" + className.replace('.', '/') + kind.extension);
            return new SimpleJavaFileObject(uri, kind) {
                @Override
                public OutputStream openOutputStream() {
                    return new ByteArrayOutputStream();
                }
            };
        }
    }
}
