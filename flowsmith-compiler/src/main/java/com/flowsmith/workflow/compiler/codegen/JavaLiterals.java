/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.compiler.analysis.Reference;
import com.flowsmith.workflow.compiler.analysis.References;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Renders JSON-shaped values, references and comment text as Java source.
 *
 * <p>String literals are emitted as pure ASCII: control characters become
 * octal escapes and non-ASCII characters become unicode escapes, so the
 * generated text compiles regardless of the source encoding. Control
 * characters are never written as unicode escapes because javac translates
 * those before lexing.
 */
final class JavaLiterals {

    private JavaLiterals() {
    }

    static String quote(String text) {
        StringBuilder out = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\%03o", (int) c));
                    } else if (c > 0x7e) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    /**
     * Java expression for a scalar constant: string, number, boolean or null.
     */
    static String constant(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String text) {
            return quote(text);
        }
        if (value instanceof Boolean flag) {
            return flag ? "Boolean.TRUE" : "Boolean.FALSE";
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return value.toString();
        }
        if (value instanceof Long) {
            return value + "L";
        }
        if (value instanceof Double number) {
            return Double.toString(number) + "d";
        }
        if (value instanceof Float number) {
            return Float.toString(number) + "f";
        }
        if (value instanceof BigInteger number) {
            return "new BigInteger(" + quote(number.toString()) + ")";
        }
        if (value instanceof BigDecimal number) {
            return "new BigDecimal(" + quote(number.toString()) + ")";
        }
        throw new IllegalArgumentException("Unsupported constant of type " + value.getClass().getName());
    }

    /**
     * Java expression for a tool parameter value. References inside strings
     * become context lookups on {@code scopeVariable}; lists and maps are
     * rebuilt element by element.
     */
    static String parameterValue(Object value, String scopeVariable) {
        if (value instanceof String text) {
            return template(text, scopeVariable);
        }
        if (value instanceof Map<?, ?> map) {
            List<String> parts = new ArrayList<>();
            map.forEach((key, nested) -> {
                parts.add(quote(String.valueOf(key)));
                parts.add(parameterValue(nested, scopeVariable));
            });
            return "mapOf(new Object[] {" + String.join(", ", parts) + "})";
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            list.forEach(item -> parts.add(parameterValue(item, scopeVariable)));
            return "listOf(new Object[] {" + String.join(", ", parts) + "})";
        }
        return constant(value);
    }

    /**
     * A whole-string reference yields the referenced value itself; text mixing
     * literals and references yields a string concatenation.
     */
    static String template(String text, String scopeVariable) {
        if (References.isWholeReference(text)) {
            return lookup(References.find(text).get(0), scopeVariable);
        }
        Matcher matcher = References.REFERENCE.matcher(text);
        List<String> parts = new ArrayList<>();
        int last = 0;
        while (matcher.find()) {
            if (matcher.start() > last) {
                parts.add(quote(text.substring(last, matcher.start())));
            }
            parts.add("String.valueOf(" + lookup(References.find(matcher.group()).get(0), scopeVariable) + ")");
            last = matcher.end();
        }
        if (parts.isEmpty()) {
            return quote(text);
        }
        if (last < text.length()) {
            parts.add(quote(text.substring(last)));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return "(" + String.join(" + ", parts) + ")";
    }

    static String lookup(Reference reference, String scopeVariable) {
        StringBuilder call = new StringBuilder("resolveRef(").append(scopeVariable).append(", ")
                .append(quote(reference.root()));
        for (String field : reference.fields()) {
            call.append(", ").append(quote(field));
        }
        return call.append(')').toString();
    }

    /**
     * Makes arbitrary text safe inside a comment: line breaks are flattened,
     * backslashes doubled so no unicode escape can form, and comment
     * terminators broken up.
     */
    static String commentText(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                out.append("\\\\");
            } else if (c == '\n' || c == '\r' || c == '\t' || Character.isISOControl(c)) {
                out.append(' ');
            } else {
                out.append(c);
            }
        }
        return out.toString().replace("*/", "* /").strip();
    }
}
