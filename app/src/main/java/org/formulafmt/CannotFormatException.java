package org.formulafmt;

// Thrown when asked to format a parse whose source text can't be rebuilt
public class CannotFormatException extends RuntimeException {
    private final Token token;

    CannotFormatException(Token token) {
        super("cannot format: " + token.error().message() + " at " + token.startPosition());
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
