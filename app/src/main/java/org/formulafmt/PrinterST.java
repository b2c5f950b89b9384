package org.formulafmt;

import java.util.*;

/**
 * Pretty-prints the *structure* of a syntax tree, one node per line, with the
 * span of every token it shows.
 */
class PrinterST {

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;
    private static final String INDENT_CHAR = "  "; // 2 spaces per indent level

    public String print(ParseResult parseResult) {
        sb.setLength(0);
        indentLevel = 0;

        printNode("Formula");
        increaseIndent();
        parseResult.expression().ifPresentOrElse(
            this::print,
            () -> printNode("Empty")
        );
        if (!parseResult.trailingTokens().isEmpty()) {
            printNode("Trailing");
            increaseIndent();
            parseResult.trailingTokens().forEach(this::printToken);
            decreaseIndent();
        }
        decreaseIndent();
        return sb.toString();
    }

    // --- Indentation & Node Helpers ---

    private void increaseIndent() { indentLevel++; }
    private void decreaseIndent() { indentLevel--; }

    private void printLine(String line) {
        sb.append(INDENT_CHAR.repeat(indentLevel)).append(line).append("\n");
    }

    private void printNode(String nodeName, String... fields) {
        StringBuilder fieldsStr = new StringBuilder();
        if (fields.length > 0) {
            fieldsStr.append(" (");
            fieldsStr.append(String.join(", ", fields));
            fieldsStr.append(")");
        }
        printLine(nodeName + fieldsStr);
    }

    private void printToken(Token token) {
        printLine(token.toString());
    }

    private void printMissing(String what) {
        printNode("Missing", what);
    }

    // --- Dispatcher ---

    private void print(ST.Term term) {
        if (term instanceof ST.Literal t) {
            print(t);
        } else if (term instanceof ST.UnaryOp t) {
            print(t);
        } else if (term instanceof ST.ArrayLiteral t) {
            print(t);
        } else if (term instanceof ST.Call t) {
            print(t);
        } else if (term instanceof ST.Parenthesized t) {
            print(t);
        }
    }

    // --- Node Printers ---

    private void print(ST.Expression expr) {
        if (expr.terms().size() == 1) {
            // a chain of one is just its term
            print(expr.terms().get(0));
            return;
        }

        printNode("Expression", "terms=" + expr.terms().size());
        increaseIndent();
        print(expr.terms().get(0));
        for (int i = 0; i < expr.operatorTokens().size(); i++) {
            printToken(expr.operatorTokens().get(i));
            print(expr.terms().get(i + 1));
        }
        decreaseIndent();
    }

    private void print(ST.ExpressionList list) {
        printNode("ExpressionList", "size=" + list.expressions().size());
        increaseIndent();
        for (var expr : list.expressions()) {
            if (expr == null) {
                printNode("Elided");
            } else {
                print(expr);
            }
        }
        decreaseIndent();
    }

    private void print(ST.Literal literal) {
        printNode("Literal");
        increaseIndent();
        printToken(literal.token());
        decreaseIndent();
    }

    private void print(ST.UnaryOp unary) {
        printNode("UnaryOp", "op=" + unary.operatorToken().content());
        increaseIndent();
        print(unary.operand());
        decreaseIndent();
    }

    private void print(ST.ArrayLiteral array) {
        printNode("ArrayLiteral", "rows=" + array.rows().size());
        increaseIndent();
        printToken(array.leftBracketToken());
        for (var row : array.rows()) {
            print(row);
        }
        array.rightBracketToken().ifPresentOrElse(this::printToken, () -> printMissing("}"));
        decreaseIndent();
    }

    private void print(ST.Call call) {
        printNode("Call", "function=" + call.functionToken().content());
        increaseIndent();
        printToken(call.leftParenToken());
        print(call.args());
        call.rightParenToken().ifPresentOrElse(this::printToken, () -> printMissing(")"));
        decreaseIndent();
    }

    private void print(ST.Parenthesized parenthesized) {
        printNode("Parenthesized");
        increaseIndent();
        printToken(parenthesized.leftParenToken());
        print(parenthesized.expression());
        parenthesized.rightParenToken().ifPresentOrElse(this::printToken, () -> printMissing(")"));
        decreaseIndent();
    }
}
