/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.condition;

import com.flowsmith.workflow.compiler.analysis.Reference;

import java.util.List;
import java.util.Objects;

/**
 * Parsed form of a condition. Produced by {@link ConditionParser} and consumed
 * by the code generator.
 */
public sealed interface ConditionExpression {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitReference(Ref expression);

        R visitLiteral(Literal expression);

        R visitList(ListLiteral expression);

        R visitNot(Not expression);

        R visitLogical(Logical expression);

        R visitComparison(Comparison expression);
    }

    enum LogicalOperator {
        AND, OR
    }

    enum ComparisonOperator {
        EQ("=="), NE("!="), LT("<"), LE("<="), GT(">"), GE(">="),
        IN("in"), NOT_IN("not in"), IS("is"), IS_NOT("is not");

        private final String symbol;

        ComparisonOperator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    /** A context lookup. */
    record Ref(Reference reference) implements ConditionExpression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReference(this);
        }
    }

    /** A string, integral ({@link Long}), decimal ({@link Double}), boolean or null constant. */
    record Literal(Object value) implements ConditionExpression {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record ListLiteral(List<ConditionExpression> items) implements ConditionExpression {
        public ListLiteral {
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitList(this);
        }
    }

    record Not(ConditionExpression operand) implements ConditionExpression {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNot(this);
        }
    }

    /** Two or more operands joined by the same logical operator. */
    record Logical(LogicalOperator operator, List<ConditionExpression> operands) implements ConditionExpression {
        public Logical {
            operands = List.copyOf(operands);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLogical(this);
        }
    }

    /**
     * A comparison chain: {@code a < b <= c} holds when every adjacent pair holds.
     * There is always one more operand than operators.
     */
    record Comparison(List<ConditionExpression> operands, List<ComparisonOperator> operators)
            implements ConditionExpression {
        public Comparison {
            operands = List.copyOf(operands);
            operators = List.copyOf(operators);
            if (operands.size() != operators.size() + 1) {
                throw new IllegalArgumentException("Comparison needs exactly one more operand than operators");
            }
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitComparison(this);
        }
    }
}
