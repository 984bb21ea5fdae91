/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.condition;

import com.flowsmith.workflow.api.exceptions.ConditionException;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.Comparison;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.ComparisonOperator;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.ListLiteral;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.Literal;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.Logical;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.LogicalOperator;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.Not;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.Ref;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConditionParserTest {

    @Test
    @DisplayName("Should parse a comparison between a reference and a number")
    void shouldParseComparison() {
        ConditionExpression expression = ConditionParser.parse("{{x}} > 5", "Condition");

        assertThat(expression).isInstanceOf(Comparison.class);
        Comparison comparison = (Comparison) expression;
        assertThat(comparison.operators()).containsExactly(ComparisonOperator.GT);
        assertThat(((Ref) comparison.operands().get(0)).reference().root()).isEqualTo("x");
        assertThat(((Literal) comparison.operands().get(1)).value()).isEqualTo(5L);
    }

    @Test
    @DisplayName("Should bind 'and' tighter than 'or'")
    void shouldRespectPrecedence() {
        ConditionExpression expression = ConditionParser.parse("{{a}} == 1 or {{b}} == 2 and {{c}} == 3", "Condition");

        Logical or = (Logical) expression;
        assertThat(or.operator()).isEqualTo(LogicalOperator.OR);
        assertThat(or.operands()).hasSize(2);
        assertThat(((Logical) or.operands().get(1)).operator()).isEqualTo(LogicalOperator.AND);
    }

    @Test
    @DisplayName("Should parse 'not in' and 'is not' as single operators")
    void shouldParseNegatedOperators() {
        Comparison notIn = (Comparison) ConditionParser.parse("{{tag}} not in ['a', 'b']", "Condition");
        Comparison isNot = (Comparison) ConditionParser.parse("{{user}} is not None", "Condition");

        assertThat(notIn.operators()).containsExactly(ComparisonOperator.NOT_IN);
        assertThat(notIn.operands().get(1)).isInstanceOf(ListLiteral.class);
        assertThat(isNot.operators()).containsExactly(ComparisonOperator.IS_NOT);
        assertThat(((Literal) isNot.operands().get(1)).value()).isNull();
    }

    @Test
    @DisplayName("Should keep comparison chains together")
    void shouldParseChains() {
        Comparison chain = (Comparison) ConditionParser.parse("0 < {{score}} <= 10", "Condition");

        assertThat(chain.operators()).containsExactly(ComparisonOperator.LT, ComparisonOperator.LE);
        assertThat(chain.operands()).hasSize(3);
    }

    @Test
    @DisplayName("Should parse literals of every kind")
    void shouldParseLiterals() {
        Comparison comparison = (Comparison) ConditionParser.parse(
                "[True, false, None, -2, 1.5, 'it\\'s', \"q\"] == {{values}}", "Condition");

        ListLiteral list = (ListLiteral) comparison.operands().get(0);
        assertThat(list.items()).extracting(item -> ((Literal) item).value())
                .containsExactly(true, false, null, -2L, 1.5d, "it's", "q");
    }

    @Test
    @DisplayName("Should parse negation and parentheses")
    void shouldParseNot() {
        ConditionExpression expression = ConditionParser.parse("not ({{a}} or {{b}})", "Condition");

        assertThat(expression).isInstanceOf(Not.class);
        assertThat(((Not) expression).operand()).isInstanceOf(Logical.class);
    }

    @Test
    @DisplayName("Should reject bare names and point to the reference syntax")
    void shouldRejectBareNames() {
        assertThatThrownBy(() -> ConditionParser.parse("amount > 5", "Condition"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("bare name 'amount' is not allowed; reference context values as {{amount}}");
    }

    @ParameterizedTest
    @ValueSource(strings = {"{{x}} >", "({{x}} > 1", "{{x}} > 1)", "{{x}} == 'open", "{{x}} == 1 ; 2", "== 1"})
    @DisplayName("Should reject malformed expressions")
    void shouldRejectMalformedExpressions(String condition) {
        assertThatThrownBy(() -> ConditionParser.parse(condition, "Condition"))
                .isInstanceOf(ConditionException.class)
                .hasMessageStartingWith("Condition is not a well-formed expression");
    }
}
