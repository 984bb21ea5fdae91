/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code {{name}}} and {@code {{name.field}}} references in strings and
 * in nested parameter values.
 */
public final class References {

    public static final Pattern REFERENCE =
            Pattern.compile("\\{\\{([a-z_][a-z0-9_]*(?:\\.[a-z_][a-z0-9_]*)*)\\}\\}");

    private References() {
    }

    public static List<Reference> find(String text) {
        List<Reference> found = new ArrayList<>();
        Matcher matcher = REFERENCE.matcher(text);
        while (matcher.find()) {
            found.add(toReference(matcher.group(1), matcher.group()));
        }
        return found;
    }

    /**
     * References of a condition. Text inside a quoted string literal is a
     * literal, so {@code {{x}}} there is not a reference. Quoting follows the
     * condition grammar: single or double quotes, backslash escapes.
     */
    public static List<Reference> findInCondition(String condition) {
        StringBuilder unquoted = new StringBuilder(condition.length());
        char quote = 0;
        for (int i = 0; i < condition.length(); i++) {
            char c = condition.charAt(i);
            if (quote == 0) {
                if (c == '\'' || c == '"') {
                    quote = c;
                    unquoted.append(' ');
                } else {
                    unquoted.append(c);
                }
            } else {
                if (c == '\\') {
                    unquoted.append(' ');
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                unquoted.append(' ');
            }
        }
        return find(unquoted.toString());
    }

    /**
     * Collects references from a parameter value, descending into lists and maps.
     * Map keys are never treated as references.
     */
    public static List<Reference> collect(Object value) {
        List<Reference> found = new ArrayList<>();
        collectInto(value, found);
        return found;
    }

    /**
     * True when the whole string is exactly one reference, e.g. {@code "{{order.id}}"}.
     */
    public static boolean isWholeReference(String text) {
        return REFERENCE.matcher(text).matches();
    }

    /**
     * Strict check used for conditions: every brace must belong to a well-formed reference.
     */
    public static boolean hasMalformedReference(String text) {
        String remainder = REFERENCE.matcher(text).replaceAll("");
        return remainder.indexOf('{') >= 0 || remainder.indexOf('}') >= 0;
    }

    /**
     * Lenient check used for parameter strings: single braces are ordinary text,
     * but a leftover double brace means a reference was mistyped.
     */
    public static boolean hasMalformedTemplate(String text) {
        String remainder = REFERENCE.matcher(text).replaceAll("");
        return remainder.contains("{{") || remainder.contains("}}");
    }

    static Reference toReference(String path, String text) {
        String[] parts = path.split("\\.");
        return new Reference(parts[0], Arrays.asList(parts).subList(1, parts.length), text);
    }

    private static void collectInto(Object value, List<Reference> found) {
        if (value instanceof String text) {
            found.addAll(find(text));
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(nested -> collectInto(nested, found));
        } else if (value instanceof List<?> list) {
            list.forEach(item -> collectInto(item, found));
        }
    }
}
