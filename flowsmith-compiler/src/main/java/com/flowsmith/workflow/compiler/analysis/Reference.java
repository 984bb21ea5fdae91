/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.analysis;

import java.util.List;

/**
 * A {@code {{root.field...}}} reference found in a template string or condition.
 *
 * @param root context key the reference reads
 * @param fields nested field names below the root, possibly empty
 * @param text the reference as written, including braces
 */
public record Reference(String root, List<String> fields, String text) {

    public Reference {
        fields = List.copyOf(fields);
    }

    public boolean isNested() {
        return !fields.isEmpty();
    }
}
