/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import java.util.Objects;

/**
 * A library implementation of a tool: a public static method taking the
 * argument map, written {@code com.acme.Tools#method}.
 *
 * @param className fully qualified class name
 * @param methodName static method name
 */
public record ToolBinding(String className, String methodName) {

    public ToolBinding {
        Objects.requireNonNull(className, "className");
        Objects.requireNonNull(methodName, "methodName");
        if (className.isEmpty() || !JavaNames.isQualifiedName(className)) {
            throw new IllegalArgumentException("Invalid class name in tool binding: '" + className + "'");
        }
        if (!JavaNames.isQualifiedName(methodName) || methodName.isEmpty() || methodName.contains(".")) {
            throw new IllegalArgumentException("Invalid method name in tool binding: '" + methodName + "'");
        }
    }

    /**
     * Parses {@code Class#method}; without {@code #} the method defaults to the tool name.
     */
    public static ToolBinding parse(String toolName, String target) {
        int hash = target.indexOf('#');
        if (hash < 0) {
            return new ToolBinding(target.trim(), toolName);
        }
        return new ToolBinding(target.substring(0, hash).trim(), target.substring(hash + 1).trim());
    }

    public String invocationTarget() {
        return className + "." + methodName;
    }

    @Override
    public String toString() {
        return className + "#" + methodName;
    }
}
