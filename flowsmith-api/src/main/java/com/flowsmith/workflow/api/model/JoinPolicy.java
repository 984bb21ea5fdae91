/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * How a {@link Fanout} joins its concurrent branches.
 */
public enum JoinPolicy {
    /** Start every branch and block until all of them complete. */
    WAIT_FOR_ALL("wait-for-all"),
    /** Start every branch, keep the first to complete and cancel the rest. */
    FIRST_TO_FINISH("first-to-finish");

    private final String tag;

    JoinPolicy(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static Optional<JoinPolicy> fromTag(String tag) {
        return Arrays.stream(values()).filter(policy -> policy.tag.equals(tag)).findFirst();
    }

    public static JoinPolicy fromWaitForAll(boolean waitForAll) {
        return waitForAll ? WAIT_FOR_ALL : FIRST_TO_FINISH;
    }
}
