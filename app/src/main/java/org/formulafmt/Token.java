package org.formulafmt;

import java.util.Objects;

/**
 * A single lexeme with its inclusive span.
 *
 * Tokens are values; an error annotation produces a new token via
 * {@link #withError(TokenError)}.
 */
public record Token(
    TokenType type,
    String content,
    Position startPosition,
    Position endPosition,
    TokenError error
) {
    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(startPosition, "startPosition");
        Objects.requireNonNull(endPosition, "endPosition");
    }

    public Token(TokenType type, String content, Position startPosition, Position endPosition) {
        this(type, content, startPosition, endPosition, null);
    }

    // Builds a token from the position of its last character
    static Token ending(TokenType type, String content, int lineNum, int endCol) {
        return new Token(
            type,
            content,
            new Position(lineNum, endCol - content.length() + 1),
            new Position(lineNum, endCol)
        );
    }

    public boolean hasError() {
        return type == TokenType.ERROR || error != null;
    }

    public Token withError(TokenError newError) {
        return new Token(type, content, startPosition, endPosition, newError);
    }

    public boolean isType(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        var errorTag = error == null ? "" : " !" + error.message();
        return type + ": " + '"' + content + '"' + " @ " + startPosition + ".." + endPosition + errorTag;
    }
}
