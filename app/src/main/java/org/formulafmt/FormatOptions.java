package org.formulafmt;

/**
 * How the formatter lays formulas out.
 *
 * @param indentWidth spaces per indent level
 * @param lineWidth   column the output tries to stay within, counting the
 *                    leading "="
 */
public record FormatOptions(int indentWidth, int lineWidth) {
    public static final int DEFAULT_INDENT_WIDTH = 2;
    public static final int DEFAULT_LINE_WIDTH = 80;

    public FormatOptions {
        if (indentWidth <= 0) {
            throw new IllegalArgumentException("indentWidth must be positive, got " + indentWidth);
        }
        if (lineWidth <= 0) {
            throw new IllegalArgumentException("lineWidth must be positive, got " + lineWidth);
        }
    }

    public static FormatOptions defaults() {
        return new FormatOptions(DEFAULT_INDENT_WIDTH, DEFAULT_LINE_WIDTH);
    }

    public FormatOptions withIndentWidth(int newIndentWidth) {
        return new FormatOptions(newIndentWidth, lineWidth);
    }

    public FormatOptions withLineWidth(int newLineWidth) {
        return new FormatOptions(indentWidth, newLineWidth);
    }
}
