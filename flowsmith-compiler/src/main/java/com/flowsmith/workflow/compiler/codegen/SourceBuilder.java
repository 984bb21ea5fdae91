/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

/**
 * Line-oriented text builder with block indentation. Lines always end in
 * {@code \n}, independent of the platform.
 */
final class SourceBuilder {

    private static final String INDENT = "    ";

    private final StringBuilder text = new StringBuilder();
    private int depth;

    SourceBuilder line(String line) {
        if (!line.isEmpty()) {
            text.append(INDENT.repeat(depth)).append(line);
        }
        text.append('\n');
        return this;
    }

    SourceBuilder blank() {
        return line("");
    }

    /**
     * Writes the header followed by an opening brace and indents the following lines.
     */
    SourceBuilder open(String header) {
        line(header + " {");
        depth++;
        return this;
    }

    /**
     * Closes the current block and opens a continuation such as an else-arm.
     */
    SourceBuilder reopen(String continuation) {
        depth--;
        line("} " + continuation + " {");
        depth++;
        return this;
    }

    SourceBuilder close() {
        return close("}");
    }

    /**
     * Closes the current block with custom text, e.g. {@code });} for a lambda argument.
     */
    SourceBuilder close(String closing) {
        depth--;
        line(closing);
        return this;
    }

    /**
     * Appends pre-formatted lines, each indented at the current depth.
     */
    SourceBuilder lines(String block) {
        block.lines().forEach(this::line);
        return this;
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
