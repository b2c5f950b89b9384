package org.formulafmt;

/**
 * Everything that can go wrong with a single token.
 *
 * Lexical errors come from the tokenizer, the rest are attached by the parser
 * to the token that caused them.
 */
public enum TokenError {
    UNKNOWN_TOKEN("unknown token", false),
    UNCLOSED_STRING("unclosed string", true),
    UNCLOSED_QUOTES("unclosed quoted name", true),

    UNCLOSED_ARRAY_LITERAL("unclosed array literal", false),
    UNCLOSED_FUNCTION_CALL("unclosed function call", false),
    UNCLOSED_PARENTHESES("unclosed parentheses", false),
    UNEXPECTED_TOKEN("unexpected token", false),
    INVALID_UNARY_OPERAND("invalid unary operand", false);

    private final String message;
    private final boolean blocksFormatting;

    TokenError(String message, boolean blocksFormatting) {
        this.message = message;
        this.blocksFormatting = blocksFormatting;
    }

    public String message() {
        return message;
    }

    // An unclosed string or quoted name swallowed the rest of its line, so
    // printing the tree back would lose text.
    public boolean blocksFormatting() {
        return blocksFormatting;
    }
}
