/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.validation;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Identifier and version grammar shared by every named element of a workflow.
 */
public final class Identifiers {

    public static final int MAX_LENGTH = 64;

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]*$");
    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+\\.\\d+$");

    private Identifiers() {
    }

    public static boolean isValid(String name) {
        return name != null && name.length() <= MAX_LENGTH && IDENTIFIER.matcher(name).matches();
    }

    /**
     * Explains why a name is not a valid identifier, or empty when it is valid.
     */
    public static Optional<String> problem(String name, String what) {
        if (name == null || name.isEmpty()) {
            return Optional.of(what + " cannot be empty");
        }
        if (name.length() > MAX_LENGTH) {
            return Optional.of(what + " '" + name + "' is longer than " + MAX_LENGTH + " characters");
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            return Optional.of(what + " '" + name
                    + "' must start with a lowercase letter or underscore and contain only lowercase letters,"
                    + " digits and underscores");
        }
        return Optional.empty();
    }

    public static boolean isVersion(String version) {
        return version != null && VERSION.matcher(version).matches();
    }
}
