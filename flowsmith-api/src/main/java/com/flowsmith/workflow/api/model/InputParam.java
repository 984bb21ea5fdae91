/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * A declared workflow input.
 *
 * <p>{@code secret} is fixed when the parameter is read and never changes
 * afterwards; secret inputs are supplied by the caller or the process
 * environment and never appear as literals in generated programs.
 *
 * @param name identifier of the input
 * @param type declared type
 * @param description optional human-readable description, may be null
 * @param secret whether the input carries a credential
 */
public record InputParam(
        @JsonProperty("name") String name,
        @JsonProperty("type") ParamType type,
        @JsonProperty("description") String description,
        @JsonProperty("is_secret") boolean secret
) {
    public InputParam {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    /**
     * Name of the environment variable a secret input falls back to.
     */
    public String environmentVariable() {
        return name.toUpperCase(Locale.ROOT);
    }
}
