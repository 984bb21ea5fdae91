/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import javax.lang.model.SourceVersion;
import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps workflow identifiers onto Java names.
 *
 * <p>Workflow identifiers are lowercase snake case, while every helper in a
 * generated class is camel case, so tool methods can never collide with
 * helpers. Tool names that are Java keywords or restricted identifiers get
 * a trailing underscore.
 */
public final class JavaNames {

    private static final Set<String> RESTRICTED = Set.of("var", "yield", "record", "sealed", "permits");

    private JavaNames() {
    }

    /**
     * {@code expense_approval} becomes {@code ExpenseApprovalWorkflow}.
     */
    public static String className(String workflowName) {
        StringBuilder name = new StringBuilder();
        for (String part : workflowName.split("_")) {
            if (!part.isEmpty()) {
                name.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
            }
        }
        name.append("Workflow");
        if (!Character.isJavaIdentifierStart(name.charAt(0))) {
            name.insert(0, 'W');
        }
        return name.toString();
    }

    /**
     * Assigns a distinct method name to every tool, in sorted tool order.
     */
    public static Map<String, String> methodNames(Collection<String> toolNames) {
        Map<String, String> methods = new TreeMap<>();
        Set<String> taken = new HashSet<>();
        for (String tool : new TreeSet<>(toolNames)) {
            String method = tool;
            if (isReserved(method)) {
                method = method + "_";
            }
            while (taken.contains(method) || (toolNames.contains(method) && !method.equals(tool))) {
                method = method + "_";
            }
            taken.add(method);
            methods.put(tool, method);
        }
        return methods;
    }

    public static boolean isReserved(String name) {
        return SourceVersion.isKeyword(name) || RESTRICTED.contains(name);
    }

    public static boolean isQualifiedName(String name) {
        if (name.isEmpty()) {
            return true;
        }
        for (String segment : name.split("\\.", -1)) {
            if (!SourceVersion.isIdentifier(segment) || isReserved(segment)) {
                return false;
            }
        }
        return true;
    }
}
