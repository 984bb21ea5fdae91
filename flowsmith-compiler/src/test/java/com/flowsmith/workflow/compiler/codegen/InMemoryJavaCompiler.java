/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.api.model.CompiledWorkflow;

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
import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compiles generated programs in memory and runs them through reflection.
 */
final class InMemoryJavaCompiler {

    private InMemoryJavaCompiler() {
    }

    static Class<?> compile(CompiledWorkflow program) {
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("Tests need a JDK with the system Java compiler");
        }
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        Map<String, ByteArrayOutputStream> classes = new HashMap<>();
        try (StandardJavaFileManager standard =
                     compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            JavaFileManager manager = new ForwardingJavaFileManager<>(standard) {
                @Override
                public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                           JavaFileObject.Kind kind, FileObject sibling) {
                    URI uri = URI.create("mem:///" + className.replace('.', '/') + kind.extension);
                    return new SimpleJavaFileObject(uri, kind) {
                        @Override
                        public OutputStream openOutputStream() {
                            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
                            classes.put(className, bytes);
                            return bytes;
                        }
                    };
                }
            };
            JavaFileObject source = new SimpleJavaFileObject(
                    URI.create("string:///" + program.sourceFileName()), JavaFileObject.Kind.SOURCE) {
                @Override
                public CharSequence getCharContent(boolean ignoreEncodingErrors) {
                    return program.source();
                }
            };
            Boolean compiled = compiler.getTask(null, manager, diagnostics, List.of("-proc:none"), null,
                    List.of(source)).call();
            if (!Boolean.TRUE.equals(compiled)) {
                throw new AssertionError("Generated source does not compile: " + diagnostics.getDiagnostics()
                        + "\n" + program.source());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }

        ClassLoader loader = new ClassLoader(InMemoryJavaCompiler.class.getClassLoader()) {
            @Override
            protected Class<?> findClass(String name) throws ClassNotFoundException {
                ByteArrayOutputStream bytes = classes.get(name);
                if (bytes == null) {
                    throw new ClassNotFoundException(name);
                }
                byte[] code = bytes.toByteArray();
                return defineClass(name, code, 0, code.length);
            }
        };
        try {
            return loader.loadClass(program.qualifiedClassName());
        } catch (ClassNotFoundException e) {
            throw new AssertionError("Compiled program has no class " + program.qualifiedClassName(), e);
        }
    }

    /**
     * Calls {@code executeWorkflow} on a fresh instance, rethrowing whatever the program threw.
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> execute(Class<?> type, Map<String, Object> inputs) throws Throwable {
        Object instance = type.getDeclaredConstructor().newInstance();
        Method entry = type.getMethod("executeWorkflow", Map.class);
        try {
            return (Map<String, Object>) entry.invoke(instance, inputs);
        } catch (InvocationTargetException e) {
            throw e.getCause();
        }
    }

    static Object property(Object target, String getter) throws ReflectiveOperationException {
        return target.getClass().getMethod(getter).invoke(target);
    }
}
