package org.formulafmt;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry points of the formula front end.
 *
 * All three are pure: every call starts again from the given input and
 * shares nothing with any other call.
 */
public final class Formatter {
    private static final Logger log = LogManager.getLogger("formatter");

    private Formatter() {}

    public static List<Token> tokenize(List<String> lines) {
        return Tokenizer.tokenize(lines);
    }

    public static ParseResult parse(List<String> lines) {
        return Parser.parseLines(lines);
    }

    /**
     * Formats a parse back into lines, without the leading "=".
     *
     * @throws CannotFormatException if {@code parseResult.canFormatExpression()} is false
     */
    public static List<String> format(ParseResult parseResult, FormatOptions options) {
        if (!parseResult.canFormatExpression()) {
            var blocking = parseResult.errors().stream()
                .filter(token -> token.error() != null && token.error().blocksFormatting())
                .findFirst()
                .orElseThrow();
            throw new CannotFormatException(blocking);
        }

        var document = DocumentBuilder.buildDocument(parseResult);
        log.debug("document width {}", document.width());
        return Renderer.render(document, options);
    }

    public static List<String> format(List<String> lines, FormatOptions options) {
        return format(parse(lines), options);
    }
}
