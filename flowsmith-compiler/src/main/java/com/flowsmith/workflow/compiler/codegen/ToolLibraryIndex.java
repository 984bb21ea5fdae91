/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * Known library implementations of tools, keyed by tool name.
 *
 * <p>The index is an immutable value handed to the generator on each call.
 * Tools found here are generated as delegations; all others get a stub.
 *
 * <p>JSON form:
 * <pre>
 * {
 *   "tools": {
 *     "summarize_text": "com.acme.tools.TextTools#summarize",
 *     "send_notification": "com.acme.tools.Notifications"
 *   }
 * }
 * </pre>
 */
public final class ToolLibraryIndex {
    private static final Logger logger = Logger.getLogger(ToolLibraryIndex.class.getName());

    public static final String DEFAULT_RESOURCE = "tool-library.json";

    private static final ToolLibraryIndex EMPTY = new ToolLibraryIndex(new TreeMap<>());

    private final SortedMap<String, ToolBinding> bindings;

    private ToolLibraryIndex(SortedMap<String, ToolBinding> bindings) {
        this.bindings = Collections.unmodifiableSortedMap(bindings);
    }

    public static ToolLibraryIndex empty() {
        return EMPTY;
    }

    /**
     * Builds an index from {@code toolName -> "Class#method"} entries.
     *
     * @throws IllegalArgumentException if an entry does not name a valid class or method
     */
    public static ToolLibraryIndex of(Map<String, String> entries) {
        SortedMap<String, ToolBinding> bindings = new TreeMap<>();
        entries.forEach((tool, target) -> bindings.put(tool, ToolBinding.parse(tool, target)));
        return new ToolLibraryIndex(bindings);
    }

    public static ToolLibraryIndex fromJson(InputStream input) throws IOException {
        JsonNode root = new ObjectMapper().readTree(input);
        JsonNode tools = root == null ? null : root.get("tools");
        if (tools == null || tools.isNull()) {
            return empty();
        }
        if (!tools.isObject()) {
            throw new IOException("Tool library 'tools' must be an object mapping tool names to Class#method");
        }
        Map<String, String> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tools.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isTextual()) {
                throw new IOException("Tool library entry '" + field.getKey() + "' must be a string");
            }
            entries.put(field.getKey(), field.getValue().textValue());
        }
        try {
            return of(entries);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid tool library: " + e.getMessage(), e);
        }
    }

    public static ToolLibraryIndex load(Path path) throws IOException {
        try (InputStream input = Files.newInputStream(path)) {
            ToolLibraryIndex index = fromJson(input);
            logger.info("Loaded " + index.size() + " tool binding(s) from " + path);
            return index;
        }
    }

    /**
     * Loads an index from the classpath, or returns the empty index when the resource is absent.
     */
    public static ToolLibraryIndex loadResource(String resource) throws IOException {
        try (InputStream input = ToolLibraryIndex.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                logger.fine("No tool library resource " + resource + " on the classpath");
                return empty();
            }
            return fromJson(input);
        }
    }

    public Optional<ToolBinding> find(String toolName) {
        return Optional.ofNullable(bindings.get(toolName));
    }

    public boolean contains(String toolName) {
        return bindings.containsKey(toolName);
    }

    public int size() {
        return bindings.size();
    }

    public SortedMap<String, ToolBinding> bindings() {
        return bindings;
    }
}
