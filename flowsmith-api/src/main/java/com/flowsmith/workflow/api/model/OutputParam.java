/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A declared workflow output, read from the shared context after execution.
 */
public record OutputParam(
        @JsonProperty("name") String name,
        @JsonProperty("type") ParamType type,
        @JsonProperty("description") String description
) {
    public OutputParam {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
