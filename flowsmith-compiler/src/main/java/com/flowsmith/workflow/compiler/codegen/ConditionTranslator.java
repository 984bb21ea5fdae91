/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.codegen;

import com.flowsmith.workflow.compiler.condition.ConditionExpression;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.ComparisonOperator;
import com.flowsmith.workflow.compiler.condition.ConditionParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Translates parsed conditions into Java boolean expressions over the
 * generated runtime helpers ({@code isTruthy}, {@code sameValue},
 * {@code compareValues}, {@code containsValue}, {@code isIdentical}).
 */
final class ConditionTranslator {

    private final String scopeVariable;

    ConditionTranslator(String scopeVariable) {
        this.scopeVariable = scopeVariable;
    }

    String translate(String condition) {
        return translate(ConditionParser.parse(condition, "Condition"));
    }

    String translate(ConditionExpression expression) {
        return expression.accept(new Emitter()).asBoolean();
    }

    /**
     * Java code for a sub-expression, tagged with whether it already has type boolean.
     */
    private record Code(String text, boolean isBoolean) {
        String asBoolean() {
            return isBoolean ? text : "isTruthy(" + text + ")";
        }
    }

    private final class Emitter implements ConditionExpression.Visitor<Code> {

        @Override
        public Code visitReference(ConditionExpression.Ref expression) {
            return new Code(JavaLiterals.lookup(expression.reference(), scopeVariable), false);
        }

        @Override
        public Code visitLiteral(ConditionExpression.Literal expression) {
            return new Code(JavaLiterals.constant(expression.value()), false);
        }

        @Override
        public Code visitList(ConditionExpression.ListLiteral expression) {
            List<String> items = new ArrayList<>();
            for (ConditionExpression item : expression.items()) {
                items.add(item.accept(this).text());
            }
            return new Code("listOf(new Object[] {" + String.join(", ", items) + "})", false);
        }

        @Override
        public Code visitNot(ConditionExpression.Not expression) {
            return new Code("!" + parenthesize(expression.operand().accept(this).asBoolean()), true);
        }

        @Override
        public Code visitLogical(ConditionExpression.Logical expression) {
            String joiner = expression.operator() == ConditionExpression.LogicalOperator.AND ? " && " : " || ";
            List<String> operands = new ArrayList<>();
            for (ConditionExpression operand : expression.operands()) {
                operands.add(operand.accept(this).asBoolean());
            }
            return new Code("(" + String.join(joiner, operands) + ")", true);
        }

        @Override
        public Code visitComparison(ConditionExpression.Comparison expression) {
            List<String> operands = new ArrayList<>();
            for (ConditionExpression operand : expression.operands()) {
                operands.add(operand.accept(this).text());
            }
            List<String> pairs = new ArrayList<>();
            for (int i = 0; i < expression.operators().size(); i++) {
                pairs.add(compare(expression.operators().get(i), operands.get(i), operands.get(i + 1)));
            }
            return new Code(pairs.size() == 1 ? pairs.get(0) : "(" + String.join(" && ", pairs) + ")", true);
        }

        private String compare(ComparisonOperator operator, String left, String right) {
            return switch (operator) {
                case EQ -> "sameValue(" + left + ", " + right + ")";
                case NE -> "!sameValue(" + left + ", " + right + ")";
                case LT -> "compareValues(" + left + ", " + right + ") < 0";
                case LE -> "compareValues(" + left + ", " + right + ") <= 0";
                case GT -> "compareValues(" + left + ", " + right + ") > 0";
                case GE -> "compareValues(" + left + ", " + right + ") >= 0";
                case IN -> "containsValue(" + right + ", " + left + ")";
                case NOT_IN -> "!containsValue(" + right + ", " + left + ")";
                case IS -> "isIdentical(" + left + ", " + right + ")";
                case IS_NOT -> "!isIdentical(" + left + ", " + right + ")";
            };
        }

        private String parenthesize(String code) {
            return code.startsWith("(") && code.endsWith(")") ? code : "(" + code + ")";
        }
    }
}
