/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReferencesTest {

    @Test
    @DisplayName("Should find plain and nested references in order")
    void shouldFindReferences() {
        List<Reference> found = References.find("Dear {{customer.name}}, order {{order_id}} shipped");

        assertThat(found).extracting(Reference::root).containsExactly("customer", "order_id");
        assertThat(found.get(0).fields()).containsExactly("name");
        assertThat(found.get(0).isNested()).isTrue();
        assertThat(found.get(1).isNested()).isFalse();
    }

    @Test
    @DisplayName("Should skip references quoted inside a condition")
    void shouldSkipQuotedReferencesInConditions() {
        List<Reference> found = References.findInCondition(
                "{{a}} == 'it\\'s {{b}}' or {{c.d}} in [\"{{e}}\", {{f}}]");

        assertThat(found).extracting(Reference::root).containsExactly("a", "c", "f");
    }

    @Test
    @DisplayName("Should collect references from nested lists and map values only")
    void shouldCollectFromStructures() {
        Object value = Map.of("{{ignored_key}}", List.of("{{a}}", Map.of("k", "x {{b.c}}")));

        assertThat(References.collect(value)).extracting(Reference::text).containsExactly("{{a}}", "{{b.c}}");
    }

    @Test
    @DisplayName("Should tell whole references from templates")
    void shouldDetectWholeReference() {
        assertThat(References.isWholeReference("{{user.id}}")).isTrue();
        assertThat(References.isWholeReference("id={{user.id}}")).isFalse();
    }

    @Test
    @DisplayName("Should detect malformed templates but allow single braces in text")
    void shouldDetectMalformedTemplates() {
        assertThat(References.hasMalformedTemplate("{{Name}}")).isTrue();
        assertThat(References.hasMalformedTemplate("{{name}")).isTrue();
        assertThat(References.hasMalformedTemplate("{\"json\": 1}")).isFalse();
        assertThat(References.hasMalformedTemplate("ok {{name}}")).isFalse();
    }
}
