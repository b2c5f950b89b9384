package org.formulafmt;

import java.util.*;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Splits source lines into a flat, position-tagged token list.
 *
 * Lines are scanned independently. Two modes cross character boundaries:
 * a double-quoted string ({@code ""} escapes a quote) and a single-quoted
 * sheet name ({@code ''} escapes a quote). Anything else is collected into a
 * buffer that is flushed and classified on whitespace, on an operator or
 * punctuation character, when a quoted section starts, and at line end.
 *
 * The tokenizer never fails: fragments it can't classify become ERROR tokens.
 */
public class Tokenizer {
    /*
     * Static data
     */
    static final Set<String> literals = Set.of("true", "false", "#n/a");

    static final Pattern NUMBER_RE = Pattern.compile(
        "^-?(\\d+(\\.\\d*)?|\\.\\d+)(e\\d+)?$", Pattern.CASE_INSENSITIVE
    );
    static final Pattern IDENTIFIER_RE = Pattern.compile(
        "^[a-z_][a-z0-9_]*$", Pattern.CASE_INSENSITIVE
    );

    static final String SHEET_NAME = "([a-z0-9_]+|'.+')!";
    static final String CELL_COL = "\\$?[a-z]+";
    static final String CELL_ROW = "\\$?0*[1-9]\\d*";
    static final String CELL_REF = CELL_COL + CELL_ROW;
    static final String OPEN_COL = CELL_COL + "(" + CELL_ROW + ")?";
    static final String OPEN_ROW = "(" + CELL_COL + ")?" + CELL_ROW;

    static final Pattern RANGE_REF_RE = Pattern.compile(
        "^(" + SHEET_NAME + ")?"
            + "(" + String.join("|",
                // single cell
                CELL_REF,
                OPEN_COL + ":" + OPEN_COL,
                OPEN_ROW + ":" + OPEN_ROW
            ) + ")$",
        Pattern.CASE_INSENSITIVE
    );
    static final Pattern NAMED_RANGE_RE = Pattern.compile(
        "^" + SHEET_NAME + "([a-z_][a-z0-9_]{0,249})$", Pattern.CASE_INSENSITIVE
    );

    /*
     * Globals
     */
    private static final Logger log = LogManager.getLogger("tokenizer");

    /*
     * Tokenizer state, reset at the start of every line
     */
    final StringBuilder buffer = new StringBuilder();
    boolean inString = false;
    boolean inQuotes = false;

    /*
     * Output
     */
    final List<Token> tokens = new ArrayList<>();

    /*
     * Tokenizer data
     */
    final List<String> _lines;

    public Tokenizer(List<String> lines) {
        this._lines = List.copyOf(lines);
    }

    public static List<Token> tokenize(List<String> lines) {
        return new Tokenizer(lines).run();
    }

    // Does the thing
    //
    // Safe to call more than once, every call starts over.
    public List<Token> run() {
        tokens.clear();
        for (int lineNum = 0; lineNum < _lines.size(); lineNum++) {
            scanLine(lineNum, _lines.get(lineNum));
        }

        // Every branch above appends in order, keep it that way regardless
        tokens.sort(Comparator.comparing(Token::startPosition));
        log.debug("{} tokens", tokens.size());
        return new ArrayList<>(tokens);
    }

    void scanLine(int lineNum, String line) {
        buffer.setLength(0);
        inString = false;
        inQuotes = false;

        int len = line.length();
        for (int colNum = 0; colNum < len; colNum++) {
            char c = line.charAt(colNum);

            if (inString) {
                if (c == '"') {
                    if (colNum < len - 1 && line.charAt(colNum + 1) == '"') {
                        // "" is an escaped quote
                        buffer.append("\"\"");
                        colNum++;
                        continue;
                    }
                    inString = false;
                    buffer.append(c);
                    tokens.add(Token.ending(TokenType.STRING, buffer.toString(), lineNum, colNum));
                    buffer.setLength(0);
                    continue;
                }
                buffer.append(c);
                continue;
            }

            if (inQuotes) {
                if (c == '\'') {
                    if (colNum < len - 1 && line.charAt(colNum + 1) == '\'') {
                        buffer.append("''");
                        colNum++;
                        continue;
                    }
                    // Closing quote keeps the buffer, 'Sheet 1'!A1 is one token
                    inQuotes = false;
                }
                buffer.append(c);
                continue;
            }

            if (c == ' ' || c == '\t') {
                pushBuffer(lineNum, colNum);
                continue;
            }

            // Check length 2 operators before length 1 operators
            if (colNum < len - 1) {
                var op = line.substring(colNum, colNum + 2);
                var doubleType = TokenType.DOUBLE_CHAR.get(op);
                if (doubleType != null) {
                    pushBuffer(lineNum, colNum);
                    tokens.add(Token.ending(doubleType, op, lineNum, colNum + 1));
                    colNum++;
                    continue;
                }
            }

            var singleType = TokenType.SINGLE_CHAR.get(String.valueOf(c));
            if (singleType != null) {
                pushBuffer(lineNum, colNum);
                tokens.add(Token.ending(singleType, String.valueOf(c), lineNum, colNum));
                continue;
            }

            if (c == '"') {
                pushBuffer(lineNum, colNum);
                inString = true;
            } else if (c == '\'') {
                pushBuffer(lineNum, colNum);
                inQuotes = true;
            }
            buffer.append(c);
        }

        if (inString || inQuotes) {
            var error = inString ? TokenError.UNCLOSED_STRING : TokenError.UNCLOSED_QUOTES;
            log.debug("line {}: {}", lineNum, error.message());
            tokens.add(
                Token.ending(TokenType.ERROR, buffer.toString(), lineNum, len - 1)
                    .withError(error)
            );
            buffer.setLength(0);
            return;
        }
        pushBuffer(lineNum, len);
    }

    // Flush whatever was collected right before colNum
    void pushBuffer(int lineNum, int colNum) {
        var content = buffer.toString();
        buffer.setLength(0);
        if (content.isEmpty()) {
            return;
        }

        var type = classify(content);
        log.debug("buffer \"{}\" -> {}", content, type);

        if (type == null) {
            tokens.add(
                Token.ending(TokenType.ERROR, content, lineNum, colNum - 1)
                    .withError(TokenError.UNKNOWN_TOKEN)
            );
            return;
        }

        var token = Token.ending(type, content, lineNum, colNum - 1);
        if (!coalesceNotAvailable(token)) {
            tokens.add(token);
        }
    }

    static TokenType classify(String content) {
        if (literals.contains(content.toLowerCase(Locale.ROOT))) {
            return TokenType.LITERAL;
        }
        if (NUMBER_RE.matcher(content).matches()) {
            return TokenType.NUMBER;
        }
        if (isRangeReference(content)) {
            return TokenType.RANGE;
        }
        // Must be checked last so that literals and ranges are matched first
        if (IDENTIFIER_RE.matcher(content).matches()) {
            return TokenType.IDENTIFIER;
        }
        return null;
    }

    static boolean isRangeReference(String content) {
        if (RANGE_REF_RE.matcher(content).matches()) {
            return true;
        }
        var named = NAMED_RANGE_RE.matcher(content);
        if (named.matches()) {
            // Named ranges can't be called true or false
            var name = named.group(2).toLowerCase(Locale.ROOT);
            return !name.equals("true") && !name.equals("false");
        }
        return false;
    }

    // "/" always splits a buffer, so #N/A arrives as ERROR "#N", "/" and "A".
    // Glue them back together into one literal.
    //
    // Returns true if the token was merged.
    boolean coalesceNotAvailable(Token token) {
        int size = tokens.size();
        if (size < 2 || !token.content().equalsIgnoreCase("a")) {
            return false;
        }

        var hash = tokens.get(size - 2);
        var slash = tokens.get(size - 1);
        if (!hash.isType(TokenType.ERROR) || !hash.content().equalsIgnoreCase("#n")) {
            return false;
        }
        if (!slash.isType(TokenType.DIVIDE)) {
            return false;
        }
        if (!adjacent(hash, slash) || !adjacent(slash, token)) {
            return false;
        }

        tokens.remove(size - 1);
        tokens.remove(size - 2);
        var content = hash.content() + slash.content() + token.content();
        tokens.add(new Token(TokenType.LITERAL, content, hash.startPosition(), token.endPosition()));
        log.debug("coalesced {}", content);
        return true;
    }

    static boolean adjacent(Token left, Token right) {
        return left.endPosition().lineNum() == right.startPosition().lineNum()
            && left.endPosition().colNum() + 1 == right.startPosition().colNum();
    }
}
