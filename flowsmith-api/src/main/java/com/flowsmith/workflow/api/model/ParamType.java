/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Closed set of declared parameter types.
 *
 * <p>Reading is case-insensitive and accepts the aliases used by inference
 * prompts ({@code str}, {@code bool}); writing always uses {@link #jsonName()}.
 */
public enum ParamType {
    STRING("string", "str"),
    INT("int"),
    FLOAT("float"),
    NUMBER("number"),
    BOOLEAN("boolean", "bool"),
    DICT("dict"),
    OBJECT("object"),
    LIST("list"),
    ARRAY("array"),
    ANY("any");

    private final String jsonName;
    private final List<String> aliases;

    ParamType(String jsonName, String... aliases) {
        this.jsonName = jsonName;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    public static Optional<ParamType> fromJson(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.jsonName.equals(normalized) || type.aliases.contains(normalized))
                .findFirst();
    }

    /**
     * All accepted spellings, in declaration order, for error messages.
     */
    public static List<String> acceptedNames() {
        return Arrays.stream(values())
                .flatMap(type -> Stream.concat(Stream.of(type.jsonName), type.aliases.stream()))
                .toList();
    }
}
