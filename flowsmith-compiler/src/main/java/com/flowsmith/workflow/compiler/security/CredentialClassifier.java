/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.security;

import java.util.List;
import java.util.Locale;

/**
 * Name-based credential heuristic.
 *
 * <p>A name is credential-like when it contains one of {@link #PATTERNS},
 * ignoring case. The heuristic has blind spots (a secret named {@code pin}
 * or {@code passphrase_hint} is not caught), which is why documents can also
 * mark inputs secret explicitly.
 */
public final class CredentialClassifier {

    static final List<String> PATTERNS = List.of(
            "api_key", "apikey", "token", "password", "secret", "credential",
            "auth", "authorization", "bearer", "database_url", "db_url",
            "connection_string", "dsn", "private_key", "secret_key", "access_key",
            "webhook");

    private CredentialClassifier() {
    }

    public static boolean isCredentialName(String name) {
        if (name == null) {
            return false;
        }
        String lowered = name.toLowerCase(Locale.ROOT);
        return PATTERNS.stream().anyMatch(lowered::contains);
    }

    /**
     * Classifies an input: explicitly tagged inputs stay secret, the heuristic can only add the flag.
     */
    public static boolean isSecretInput(String name, boolean explicitlyTagged) {
        return explicitlyTagged || isCredentialName(name);
    }

    public static String environmentVariable(String name) {
        return name.toUpperCase(Locale.ROOT);
    }
}
