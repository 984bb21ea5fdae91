/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

/**
 * Options for {@link JavaProgramGenerator}.
 *
 * @param targetPackage package of the generated class
 */
public record GeneratorOptions(String targetPackage) {

    public static final String DEFAULT_PACKAGE = "com.flowsmith.generated";

    public static final GeneratorOptions DEFAULT = new GeneratorOptions(DEFAULT_PACKAGE);

    public GeneratorOptions {
        targetPackage = targetPackage == null ? "" : targetPackage.trim();
        if (!JavaNames.isQualifiedName(targetPackage)) {
            throw new IllegalArgumentException("Invalid target package name: '" + targetPackage + "'");
        }
    }

    public GeneratorOptions withTargetPackage(String packageName) {
        return new GeneratorOptions(packageName);
    }
}
