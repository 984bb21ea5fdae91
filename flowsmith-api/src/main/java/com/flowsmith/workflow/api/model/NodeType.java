/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Document tags of the five node kinds.
 */
public enum NodeType {
    TOOL_CALL("tool_call"),
    SEQUENTIAL("sequential"),
    CONDITIONAL("conditional"),
    PARALLEL("parallel"),
    ORCHESTRATOR("orchestrator");

    private final String tag;

    NodeType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static Optional<NodeType> fromTag(String tag) {
        return Arrays.stream(values()).filter(type -> type.tag.equals(tag)).findFirst();
    }
}
