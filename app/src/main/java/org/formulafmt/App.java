package org.formulafmt;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

class App {
    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    static final String USAGE = """
        usage: formulafmt [--indent N] [--width N] [--tokens] [--tree] [--json] [file]

        Reads a formula from file, or from standard input without one, and
        prints it formatted. A leading "=" is optional.

          --indent N   spaces per indent level (default 2)
          --width N    maximum line width, "=" included (default 80)
          --tokens     print the token table
          --tree       print the syntax tree
          --json       print the parse result as JSON instead of formatting
        """;

    private static final Logger log = LogManager.getLogger("app");

    // ==========================================================
    // MAIN PIPELINE
    // ==========================================================

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    static int run(String[] args, InputStream in, PrintStream out, PrintStream err) {
        // 1. Arguments
        Arguments arguments;
        try {
            arguments = Arguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.print(USAGE);
            return EXIT_USAGE;
        }

        // 2. Input
        List<String> lines;
        try {
            lines = readSource(arguments.input(), in);
        } catch (IOException e) {
            err.println("Cannot read input: " + e.getMessage());
            return EXIT_ERRORS;
        }
        log.debug("read {} lines", lines.size());

        // 3. Parse
        var parseResult = Formatter.parse(lines);

        if (arguments.tokens()) {
            printTokenTable(parseResult, out);
        }
        if (arguments.tree()) {
            out.print(new PrinterST().print(parseResult));
        }
        if (arguments.json()) {
            out.println(OptionalAdapter.gson().toJson(parseResult));
            return parseResult.hasError() ? EXIT_ERRORS : EXIT_OK;
        }

        // 4. Diagnostics
        if (parseResult.hasError()) {
            err.println("Errors");
            ErrorReport.describe(parseResult).forEach(line -> err.println("  " + line));
        }

        // 5. Format
        if (!parseResult.canFormatExpression()) {
            err.println("Formula was not formatted");
            return EXIT_ERRORS;
        }
        var formatted = Formatter.format(parseResult, arguments.options());
        for (int i = 0; i < formatted.size(); i++) {
            out.println(i == 0 ? "=" + formatted.get(i) : formatted.get(i));
        }

        return parseResult.hasError() ? EXIT_ERRORS : EXIT_OK;
    }

    // ==========================================================
    // ARGUMENTS
    // ==========================================================

    record Arguments(
        Optional<Path> input,
        FormatOptions options,
        boolean tokens,
        boolean tree,
        boolean json
    ) {
        static Arguments parse(String[] args) {
            Optional<Path> input = Optional.empty();
            var options = FormatOptions.defaults();
            boolean tokens = false;
            boolean tree = false;
            boolean json = false;

            for (int i = 0; i < args.length; i++) {
                var arg = args[i];
                switch (arg) {
                    case "--indent" -> options = options.withIndentWidth(number(args, ++i, arg));
                    case "--width" -> options = options.withLineWidth(number(args, ++i, arg));
                    case "--tokens" -> tokens = true;
                    case "--tree" -> tree = true;
                    case "--json" -> json = true;
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (input.isPresent()) {
                            throw new IllegalArgumentException("Only one input file is allowed");
                        }
                        input = Optional.of(Paths.get(arg));
                    }
                }
            }

            return new Arguments(input, options, tokens, tree, json);
        }

        // FormatOptions rejects non-positive values with an IllegalArgumentException too
        private static int number(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            try {
                return Integer.parseInt(args[index]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not a number for " + option + ": " + args[index], e);
            }
        }
    }

    // ==========================================================
    // INPUT HANDLING
    // ==========================================================

    static List<String> readSource(Optional<Path> input, InputStream in) throws IOException {
        String text;
        if (input.isPresent()) {
            var path = input.get();
            if (!Files.exists(path)) {
                throw new IOException("Cannot find file: " + path);
            }
            text = Files.readString(path, StandardCharsets.UTF_8);
        } else {
            text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return sourceLines(text);
    }

    // The "=" in front of every formula isn't part of the expression
    static List<String> sourceLines(String text) {
        var lines = Positions.splitLines(text);
        // A trailing newline doesn't start another line of formula
        if (lines.size() > 1 && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        var first = lines.get(0);
        if (first.startsWith("=")) {
            lines.set(0, first.substring(1));
        }
        return lines;
    }

    // ==========================================================
    // UTILITIES (Printing)
    // ==========================================================

    static void printTokenTable(ParseResult parseResult, PrintStream out) {
        out.println("Tokens:");
        out.printf("%-7s %-20s %-18s %-14s %-22s %n",
                "n_rec", "lexeme", "token", "span", "error");
        out.println("----------------------------------------------------------------------------------");

        int nRec = 1;
        for (var token : parseResult.tokens()) {
            var span = String.format("%d,%d..%d,%d",
                token.startPosition().lineNum(), token.startPosition().colNum(),
                token.endPosition().lineNum(), token.endPosition().colNum()
            );
            var error = token.error() == null ? "" : token.error().message();
            out.printf("%-7d %-20s %-18s %-14s %-22s %n",
                    nRec, token.content(), token.type().name().toLowerCase(Locale.ROOT), span, error);
            nRec++;
        }
        out.println("----------------------------------------------------------------------------------");
    }
}
