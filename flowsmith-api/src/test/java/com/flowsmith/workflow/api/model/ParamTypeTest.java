/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

class ParamTypeTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "string, STRING",
            "str, STRING",
            "STR, STRING",
            "bool, BOOLEAN",
            "Boolean, BOOLEAN",
            "int, INT",
            "dict, DICT",
            "array, ARRAY",
            "any, ANY"
    })
    @DisplayName("Should read type names case-insensitively, including aliases")
    void shouldReadTypeNames(String name, ParamType expected) {
        assertThat(ParamType.fromJson(name)).contains(expected);
    }

    @Test
    @DisplayName("Should reject unknown type names")
    void shouldRejectUnknownTypeNames() {
        assertThat(ParamType.fromJson("integer")).isEmpty();
        assertThat(ParamType.fromJson("")).isEmpty();
    }

    @Test
    @DisplayName("Should write the canonical spelling")
    void shouldWriteCanonicalSpelling() {
        assertThat(ParamType.fromJson("str").orElseThrow().jsonName()).isEqualTo("string");
        assertThat(ParamType.fromJson("bool").orElseThrow().jsonName()).isEqualTo("boolean");
    }
}
