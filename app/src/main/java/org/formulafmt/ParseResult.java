package org.formulafmt;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Everything one parse produced.
 *
 * @param tokens              every token, in source order, with errors attached
 * @param hasError            whether any token is an ERROR or carries an error
 * @param errors              the erroneous subset of {@code tokens}, same order
 * @param canFormatExpression false when a lexical error swallowed source text
 * @param expression          empty only when no term could be parsed, which for
 *                            valid input means it was all whitespace
 * @param consumedTokens      how many leading tokens the expression covers; the
 *                            rest start with an "unexpected token"
 */
public record ParseResult(
    List<Token> tokens,
    boolean hasError,
    List<Token> errors,
    boolean canFormatExpression,
    Optional<ST.Expression> expression,
    int consumedTokens
) {
    public ParseResult {
        tokens = List.copyOf(tokens);
        errors = List.copyOf(errors);
    }

    static ParseResult of(List<Token> tokens, Optional<ST.Expression> expression, int consumedTokens) {
        var errors = tokens.stream()
            .filter(Token::hasError)
            .collect(Collectors.toList());

        var canFormat = errors.stream()
            .noneMatch(token -> token.error() != null && token.error().blocksFormatting());

        return new ParseResult(tokens, !errors.isEmpty(), errors, canFormat, expression, consumedTokens);
    }

    // Tokens the expression didn't reach
    public List<Token> trailingTokens() {
        return tokens.subList(consumedTokens, tokens.size());
    }
}
