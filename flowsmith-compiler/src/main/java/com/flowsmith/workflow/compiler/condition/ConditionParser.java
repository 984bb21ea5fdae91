/*
 * Copyright (c) 2025 Flowsmith Workflow Compiler
 * Licensed under the Apache License, Version 2.0
 */
package com.flowsmith.workflow.compiler.condition;

import com.flowsmith.workflow.api.exceptions.ConditionException;
import com.flowsmith.workflow.compiler.analysis.Reference;
import com.flowsmith.workflow.compiler.analysis.References;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.ComparisonOperator;
import com.flowsmith.workflow.compiler.condition.ConditionExpression.LogicalOperator;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for conditions that passed {@link ConditionGrammar}.
 *
 * <p>Precedence, loosest first: {@code or}, {@code and}, {@code not},
 * comparisons ({@code == != < <= > >= in not in is is not}, chainable),
 * then operands: references, numbers, quoted strings, {@code True False None}
 * (lowercase spellings accepted), list literals and parenthesized expressions.
 * Bare names are rejected so that every context read is an explicit reference.
 */
public final class ConditionParser {

    private static final Pattern NUMBER = Pattern.compile("\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

    private final String condition;
    private final String context;
    private final List<Token> tokens;
    private int position;

    private ConditionParser(String condition, String context) {
        this.condition = condition;
        this.context = context;
        this.tokens = tokenize();
    }

    /**
     * Parses a condition.
     *
     * @throws ConditionException if the condition is not a well-formed expression
     */
    public static ConditionExpression parse(String condition, String context) {
        ConditionParser parser = new ConditionParser(condition, context);
        ConditionExpression expression = parser.parseOr();
        if (!parser.peek().is(TokenKind.END)) {
            throw parser.error("unexpected '" + parser.peek().text() + "'");
        }
        return expression;
    }

    // ==================== Grammar ====================

    private ConditionExpression parseOr() {
        List<ConditionExpression> operands = new ArrayList<>();
        operands.add(parseAnd());
        while (peek().isWord("or")) {
            position++;
            operands.add(parseAnd());
        }
        return operands.size() == 1 ? operands.get(0) : new ConditionExpression.Logical(LogicalOperator.OR, operands);
    }

    private ConditionExpression parseAnd() {
        List<ConditionExpression> operands = new ArrayList<>();
        operands.add(parseNot());
        while (peek().isWord("and")) {
            position++;
            operands.add(parseNot());
        }
        return operands.size() == 1 ? operands.get(0) : new ConditionExpression.Logical(LogicalOperator.AND, operands);
    }

    private ConditionExpression parseNot() {
        if (peek().isWord("not")) {
            position++;
            return new ConditionExpression.Not(parseNot());
        }
        return parseComparison();
    }

    private ConditionExpression parseComparison() {
        List<ConditionExpression> operands = new ArrayList<>();
        List<ComparisonOperator> operators = new ArrayList<>();
        operands.add(parseOperand());
        ComparisonOperator operator;
        while ((operator = comparisonOperator()) != null) {
            operators.add(operator);
            operands.add(parseOperand());
        }
        return operators.isEmpty() ? operands.get(0) : new ConditionExpression.Comparison(operands, operators);
    }

    /**
     * Consumes a comparison operator if one is next, otherwise returns null.
     */
    private ComparisonOperator comparisonOperator() {
        Token token = peek();
        if (token.is(TokenKind.OPERATOR)) {
            position++;
            return switch (token.text()) {
                case "==" -> ComparisonOperator.EQ;
                case "!=" -> ComparisonOperator.NE;
                case "<" -> ComparisonOperator.LT;
                case "<=" -> ComparisonOperator.LE;
                case ">" -> ComparisonOperator.GT;
                case ">=" -> ComparisonOperator.GE;
                default -> throw error("unknown operator '" + token.text() + "'");
            };
        }
        if (token.isWord("in")) {
            position++;
            return ComparisonOperator.IN;
        }
        if (token.isWord("is")) {
            position++;
            if (peek().isWord("not")) {
                position++;
                return ComparisonOperator.IS_NOT;
            }
            return ComparisonOperator.IS;
        }
        if (token.isWord("not") && peekAhead(1).isWord("in")) {
            position += 2;
            return ComparisonOperator.NOT_IN;
        }
        return null;
    }

    private ConditionExpression parseOperand() {
        Token token = next();
        switch (token.kind()) {
            case REFERENCE:
                return new ConditionExpression.Ref(referenceOf(token));
            case NUMBER:
                return new ConditionExpression.Literal(numberOf(token.text(), false));
            case MINUS:
                Token number = next();
                if (!number.is(TokenKind.NUMBER)) {
                    throw error("expected a number after '-'");
                }
                return new ConditionExpression.Literal(numberOf(number.text(), true));
            case STRING:
                return new ConditionExpression.Literal(token.text());
            case WORD:
                return constantOf(token);
            case LEFT_PAREN:
                ConditionExpression inner = parseOr();
                expect(TokenKind.RIGHT_PAREN, "')'");
                return inner;
            case LEFT_BRACKET:
                return parseList();
            case END:
                throw error("expression ends unexpectedly");
            default:
                throw error("unexpected '" + token.text() + "'");
        }
    }

    private ConditionExpression parseList() {
        List<ConditionExpression> items = new ArrayList<>();
        while (!peek().is(TokenKind.RIGHT_BRACKET)) {
            items.add(parseOr());
            if (peek().is(TokenKind.COMMA)) {
                position++;
            } else {
                break;
            }
        }
        expect(TokenKind.RIGHT_BRACKET, "']'");
        return new ConditionExpression.ListLiteral(items);
    }

    private ConditionExpression constantOf(Token token) {
        return switch (token.text()) {
            case "True", "true" -> new ConditionExpression.Literal(Boolean.TRUE);
            case "False", "false" -> new ConditionExpression.Literal(Boolean.FALSE);
            case "None", "null" -> new ConditionExpression.Literal(null);
            case "and", "or", "not", "in", "is" -> throw error("operator '" + token.text() + "' is missing an operand");
            default -> throw error("bare name '" + token.text() + "' is not allowed; reference context values as {{"
                    + token.text() + "}}");
        };
    }

    private Reference referenceOf(Token token) {
        List<Reference> found = References.find(token.text());
        if (found.size() != 1 || !References.isWholeReference(token.text())) {
            throw error("invalid reference '" + token.text() + "'");
        }
        return found.get(0);
    }

    private Object numberOf(String text, boolean negative) {
        String signed = negative ? "-" + text : text;
        if (text.indexOf('.') >= 0 || text.indexOf('e') >= 0 || text.indexOf('E') >= 0) {
            return Double.valueOf(signed);
        }
        BigInteger value = new BigInteger(signed);
        return value.bitLength() < 64 ? (Object) value.longValue() : (Object) value.doubleValue();
    }

    // ==================== Tokens ====================

    private enum TokenKind {
        REFERENCE, NUMBER, STRING, WORD, OPERATOR, MINUS,
        LEFT_PAREN, RIGHT_PAREN, LEFT_BRACKET, RIGHT_BRACKET, COMMA, END
    }

    private record Token(TokenKind kind, String text) {
        boolean is(TokenKind expected) {
            return kind == expected;
        }

        boolean isWord(String word) {
            return kind == TokenKind.WORD && text.equals(word);
        }
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(position);
        if (!token.is(TokenKind.END)) {
            position++;
        }
        return token;
    }

    private void expect(TokenKind kind, String description) {
        if (!next().is(kind)) {
            throw error("expected " + description);
        }
    }

    private List<Token> tokenize() {
        List<Token> result = new ArrayList<>();
        int i = 0;
        int length = condition.length();
        while (i < length) {
            char c = condition.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (condition.startsWith("{{", i)) {
                int end = condition.indexOf("}}", i);
                if (end < 0) {
                    throw error("unterminated reference");
                }
                result.add(new Token(TokenKind.REFERENCE, condition.substring(i, end + 2)));
                i = end + 2;
            } else if (Character.isDigit(c)) {
                Matcher matcher = NUMBER.matcher(condition).region(i, length);
                matcher.lookingAt();
                result.add(new Token(TokenKind.NUMBER, matcher.group()));
                i = matcher.end();
            } else if (c == '\'' || c == '"') {
                i = readString(i, c, result);
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(condition.charAt(i)) || condition.charAt(i) == '_')) {
                    i++;
                }
                result.add(new Token(TokenKind.WORD, condition.substring(start, i)));
            } else if (condition.startsWith("==", i) || condition.startsWith("!=", i)
                    || condition.startsWith(">=", i) || condition.startsWith("<=", i)) {
                result.add(new Token(TokenKind.OPERATOR, condition.substring(i, i + 2)));
                i += 2;
            } else if (c == '<' || c == '>') {
                result.add(new Token(TokenKind.OPERATOR, String.valueOf(c)));
                i++;
            } else {
                TokenKind kind = switch (c) {
                    case '(' -> TokenKind.LEFT_PAREN;
                    case ')' -> TokenKind.RIGHT_PAREN;
                    case '[' -> TokenKind.LEFT_BRACKET;
                    case ']' -> TokenKind.RIGHT_BRACKET;
                    case ',' -> TokenKind.COMMA;
                    case '-' -> TokenKind.MINUS;
                    default -> throw error("unexpected character '" + c + "'");
                };
                result.add(new Token(kind, String.valueOf(c)));
                i++;
            }
        }
        result.add(new Token(TokenKind.END, "end of condition"));
        return result;
    }

    private int readString(int start, char quote, List<Token> result) {
        StringBuilder text = new StringBuilder();
        int i = start + 1;
        while (i < condition.length()) {
            char c = condition.charAt(i);
            if (c == quote) {
                result.add(new Token(TokenKind.STRING, text.toString()));
                return i + 1;
            }
            if (c == '\\' && i + 1 < condition.length()) {
                char escaped = condition.charAt(i + 1);
                switch (escaped) {
                    case 'n' -> text.append('\n');
                    case 't' -> text.append('\t');
                    case 'r' -> text.append('\r');
                    default -> text.append(escaped);
                }
                i += 2;
            } else {
                text.append(c);
                i++;
            }
        }
        throw error("unterminated string literal");
    }

    private ConditionException error(String detail) {
        return new ConditionException(context + " is not a well-formed expression (" + detail + "): " + condition,
                condition);
    }
}
