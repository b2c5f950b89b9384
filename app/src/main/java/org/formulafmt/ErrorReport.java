package org.formulafmt;

import java.text.MessageFormat;
import java.util.List;
import java.util.stream.Collectors;

// Human readable lines for the errors of a parse, as shown next to an editor
// whose first line starts with a fixed "=".
public class ErrorReport {
    private ErrorReport() {}

    public static List<String> describe(ParseResult parseResult) {
        return parseResult.errors().stream()
            .map(ErrorReport::describe)
            .collect(Collectors.toList());
    }

    public static String describe(Token token) {
        var start = token.startPosition();
        int lineNum = start.lineNum() + 1;
        int colNum = start.colNum() + 1;
        if (lineNum == 1) {
            // Shifted by the "="
            colNum++;
        }

        // ERROR tokens always carry their lexical error
        var message = token.error() == null
            ? TokenError.UNKNOWN_TOKEN.message()
            : token.error().message();

        return MessageFormat.format(
            "Ln{0}, Col{1}: {2}", String.valueOf(lineNum), String.valueOf(colNum), message
        );
    }
}
