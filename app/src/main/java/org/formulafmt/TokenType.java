package org.formulafmt;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

public enum TokenType {
    // unary or binary
    PLUS, MINUS,
    // binary only
    MULTIPLY, DIVIDE, XOR, CONCAT,
    EQUAL, NOT_EQUAL, LESS, GREATER, LESS_OR_EQUAL, GREATER_OR_EQUAL,
    // punctuation
    COMMA, SEMICOLON, L_PAREN, R_PAREN, L_BRACKET, R_BRACKET,
    // literals
    LITERAL, IDENTIFIER, NUMBER, STRING, RANGE,
    // anything the tokenizer couldn't make sense of
    ERROR;

    static final Set<TokenType> UNARY_OPERATORS = EnumSet.of(PLUS, MINUS);

    static final Set<TokenType> BINARY_OPERATORS = EnumSet.of(
        PLUS, MINUS,
        MULTIPLY, DIVIDE, XOR, CONCAT,
        EQUAL, NOT_EQUAL, LESS, GREATER, LESS_OR_EQUAL, GREATER_OR_EQUAL
    );

    // Things that may stand alone as a term
    static final Set<TokenType> LITERALS = EnumSet.of(
        IDENTIFIER, NUMBER, STRING, RANGE, LITERAL, ERROR
    );

    // Things a unary operator may be applied to directly
    static final Set<TokenType> UNARY_OPERANDS = EnumSet.of(
        LITERAL, IDENTIFIER, NUMBER, RANGE
    );

    static final Map<String, TokenType> SINGLE_CHAR = Map.ofEntries(
        Map.entry("+", PLUS),
        Map.entry("-", MINUS),
        Map.entry("*", MULTIPLY),
        Map.entry("/", DIVIDE),
        Map.entry("^", XOR),
        Map.entry("&", CONCAT),
        Map.entry("=", EQUAL),
        Map.entry("<", LESS),
        Map.entry(">", GREATER),
        Map.entry(",", COMMA),
        Map.entry(";", SEMICOLON),
        Map.entry("(", L_PAREN),
        Map.entry(")", R_PAREN),
        Map.entry("{", L_BRACKET),
        Map.entry("}", R_BRACKET)
    );

    static final Map<String, TokenType> DOUBLE_CHAR = Map.of(
        "<=", LESS_OR_EQUAL,
        ">=", GREATER_OR_EQUAL,
        "<>", NOT_EQUAL
    );

    public boolean isBinaryOperator() {
        return BINARY_OPERATORS.contains(this);
    }

    public boolean isUnaryOperator() {
        return UNARY_OPERATORS.contains(this);
    }
}
