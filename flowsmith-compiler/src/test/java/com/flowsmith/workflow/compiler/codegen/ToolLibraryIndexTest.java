/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolLibraryIndexTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Should parse bindings with and without an explicit method")
    void shouldParseBindings() {
        ToolLibraryIndex index = ToolLibraryIndex.of(Map.of(
                "summarize_text", "com.acme.tools.TextTools#summarize",
                "send_notification", "com.acme.tools.Notifications"));

        assertThat(index.size()).isEqualTo(2);
        assertThat(index.find("summarize_text")).contains(new ToolBinding("com.acme.tools.TextTools", "summarize"));
        assertThat(index.find("send_notification").map(ToolBinding::invocationTarget))
                .contains("com.acme.tools.Notifications.send_notification");
        assertThat(index.contains("unknown")).isFalse();
        assertThat(index.bindings().keySet()).containsExactly("send_notification", "summarize_text");
    }

    @Test
    @DisplayName("Should reject a binding that does not name a Java method")
    void shouldRejectInvalidBinding() {
        assertThatThrownBy(() -> ToolLibraryIndex.of(Map.of("bad", "com.acme.Tools#not-a-method")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid method name in tool binding: 'not-a-method'");
    }

    @Test
    @DisplayName("Should read the JSON form")
    void shouldReadJson() throws IOException {
        ToolLibraryIndex index = ToolLibraryIndex.fromJson(json("""
                {"tools": {"echo": "java.util.Objects#requireNonNull"}}
                """));

        assertThat(index.find("echo")).contains(new ToolBinding("java.util.Objects", "requireNonNull"));
    }

    @Test
    @DisplayName("Should treat a missing tools field as an empty library")
    void shouldTreatMissingToolsAsEmpty() throws IOException {
        assertThat(ToolLibraryIndex.fromJson(json("{}")).size()).isZero();
    }

    @Test
    @DisplayName("Should fail on malformed library files")
    void shouldFailOnMalformedLibrary() {
        assertThatThrownBy(() -> ToolLibraryIndex.fromJson(json("{\"tools\": [\"a\"]}")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("must be an object");
        assertThatThrownBy(() -> ToolLibraryIndex.fromJson(json("{\"tools\": {\"a\": 1}}")))
                .isInstanceOf(IOException.class)
                .hasMessage("Tool library entry 'a' must be a string");
        assertThatThrownBy(() -> ToolLibraryIndex.fromJson(json("{\"tools\": {\"a\": \"#run\"}}")))
                .isInstanceOf(IOException.class)
                .hasMessageStartingWith("Invalid tool library: ");
    }

    @Test
    @DisplayName("Should load a library file and the bundled empty default")
    void shouldLoadFromFileAndClasspath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tools.json");
        Files.writeString(file, "{\"tools\": {\"describe\": \"java.util.Objects#toString\"}}");

        assertThat(ToolLibraryIndex.load(file).contains("describe")).isTrue();
        assertThat(ToolLibraryIndex.loadResource(ToolLibraryIndex.DEFAULT_RESOURCE).size()).isZero();
        assertThat(ToolLibraryIndex.loadResource("no-such-library.json").size()).isZero();
    }
}
