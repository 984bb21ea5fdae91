/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.condition;

import com.flowsmith.workflow.api.exceptions.ConditionException;
import com.flowsmith.workflow.compiler.analysis.References;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Screens branch and routing conditions before they are parsed.
 *
 * <p>Checks run in a fixed order: empty, deny-listed tokens, dunder names,
 * allow-listed operators, reference syntax. The deny-list is matched as a
 * case-insensitive substring and always runs before the allow-list, so a
 * condition mentioning a denied token is rejected even if it also contains
 * an operator.
 */
public final class ConditionGrammar {

    static final List<String> DENIED_TOKENS = List.of(
            "import", "from", "exec", "eval", "lambda", "compile", "open", "file",
            "input", "raw_input", "globals", "locals", "vars", "dir", "getattr",
            "setattr", "delattr", "hasattr", "os.", "sys.", "subprocess", "__builtins__");

    static final List<String> ALLOWED_OPERATORS = List.of(
            ">", "<", "==", "!=", ">=", "<=", "and", "or", "not", "in", "is");

    private static final Pattern DUNDER = Pattern.compile("\\b__\\w+__\\b");

    private ConditionGrammar() {
    }

    /**
     * Validates a condition string.
     *
     * @param condition the condition text
     * @param context label naming where the condition appears, used in messages
     * @return the condition unchanged
     * @throws ConditionException if the condition is rejected
     */
    public static String validate(String condition, String context) {
        if (condition == null || condition.isBlank()) {
            throw new ConditionException(context + " cannot be empty", condition);
        }

        String lowered = condition.toLowerCase(Locale.ROOT);
        for (String token : DENIED_TOKENS) {
            if (lowered.contains(token)) {
                throw new ConditionException(
                        context + " contains forbidden token '" + token + "': " + condition, condition);
            }
        }

        Matcher dunder = DUNDER.matcher(condition);
        if (dunder.find()) {
            throw new ConditionException(
                    context + " contains forbidden name '" + dunder.group() + "': " + condition, condition);
        }

        boolean hasOperator = ALLOWED_OPERATORS.stream().anyMatch(condition::contains);
        if (!hasOperator) {
            throw new ConditionException(
                    context + " must use a comparison or logical operator (" + String.join(", ", ALLOWED_OPERATORS)
                            + "): " + condition, condition);
        }

        if (References.hasMalformedReference(condition) || condition.indexOf('$') >= 0) {
            throw new ConditionException(
                    context + " has an invalid variable reference; use {{name}} or {{name.field}}: " + condition,
                    condition);
        }

        return condition;
    }
}
