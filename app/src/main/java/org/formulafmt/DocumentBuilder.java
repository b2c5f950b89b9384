package org.formulafmt;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// Turns a syntax tree into a FormatNode document.
//
// Delimited constructs (calls, arrays, parentheses) all get the same shape:
//
//     Group[ open, Line, Indent[ content ], Line, close ]
//
// Flat, the lines vanish and the delimiters hug the content. Broken, the
// content moves to its own indented lines and the closing delimiter returns
// to the opening indent.
public class DocumentBuilder {
    private static final Logger log = LogManager.getLogger("formatter");

    public static FormatNode buildDocument(ParseResult parseResult) {
        var nodes = new ArrayList<FormatNode>();
        parseResult.expression()
            .map(DocumentBuilder::buildExpression)
            .ifPresent(nodes::add);

        // Whatever the parser couldn't place is carried along as is
        var trailing = parseResult.trailingTokens();
        if (!trailing.isEmpty()) {
            log.debug("{} trailing tokens", trailing.size());
        }
        for (var token : trailing) {
            if (!nodes.isEmpty()) {
                nodes.add(FormatNode.text(" "));
            }
            nodes.add(FormatNode.text(token));
        }

        if (nodes.isEmpty()) {
            return FormatNode.text("");
        }
        return FormatNode.nodes(nodes);
    }

    // Group[ term { " " op SpaceOrLine term } ]
    static FormatNode buildExpression(ST.Expression expression) {
        var terms = expression.terms();
        var operators = expression.operatorTokens();

        var nodes = new ArrayList<FormatNode>();
        nodes.add(buildTerm(terms.get(0)));
        for (int i = 0; i < operators.size(); i++) {
            nodes.add(FormatNode.text(" "));
            nodes.add(FormatNode.text(operators.get(i)));
            nodes.add(FormatNode.spaceOrLine());
            nodes.add(buildTerm(terms.get(i + 1)));
        }
        return FormatNode.group(nodes);
    }

    // Group[ [expr] { "," [SpaceOrLine expr] } ]
    static FormatNode buildExpressionList(ST.ExpressionList list) {
        var expressions = list.expressions();
        var commas = list.commaTokens();

        var nodes = new ArrayList<FormatNode>();
        if (expressions.get(0) != null) {
            nodes.add(buildExpression(expressions.get(0)));
        }
        for (int i = 0; i < commas.size(); i++) {
            nodes.add(FormatNode.text(commas.get(i)));
            var expression = expressions.get(i + 1);
            if (expression != null) {
                nodes.add(FormatNode.spaceOrLine());
                nodes.add(buildExpression(expression));
            }
        }
        return FormatNode.group(nodes);
    }

    static FormatNode buildTerm(ST.Term term) {
        if (term instanceof ST.Literal literal) {
            return FormatNode.text(literal.token());
        }
        if (term instanceof ST.UnaryOp unary) {
            return FormatNode.nodes(List.of(
                FormatNode.text(unary.operatorToken()),
                buildTerm(unary.operand())
            ));
        }
        if (term instanceof ST.ArrayLiteral array) {
            return buildArrayLiteral(array);
        }
        if (term instanceof ST.Call call) {
            var content = call.args().hasContent()
                ? Optional.of(buildExpressionList(call.args()))
                : Optional.<FormatNode>empty();
            return delimited(
                List.of(FormatNode.text(call.functionToken()), FormatNode.text(call.leftParenToken())),
                content,
                call.rightParenToken()
            );
        }
        if (term instanceof ST.Parenthesized parenthesized) {
            return delimited(
                List.of(FormatNode.text(parenthesized.leftParenToken())),
                Optional.of(buildExpression(parenthesized.expression())),
                parenthesized.rightParenToken()
            );
        }
        throw new IllegalStateException("unknown term: " + term);
    }

    static FormatNode buildArrayLiteral(ST.ArrayLiteral array) {
        Optional<FormatNode> content = Optional.empty();
        if (array.hasContent()) {
            var rows = array.rows();
            var semicolons = array.semicolonTokens();

            var nodes = new ArrayList<FormatNode>();
            if (rows.get(0).hasContent()) {
                nodes.add(buildExpressionList(rows.get(0)));
            }
            for (int i = 0; i < semicolons.size(); i++) {
                nodes.add(FormatNode.text(semicolons.get(i)));
                var row = rows.get(i + 1);
                if (row.hasContent()) {
                    nodes.add(FormatNode.spaceOrLine());
                    nodes.add(buildExpressionList(row));
                }
            }
            content = Optional.of(FormatNode.nodes(nodes));
        }

        return delimited(
            List.of(FormatNode.text(array.leftBracketToken())),
            content,
            array.rightBracketToken()
        );
    }

    // A missing closing delimiter is simply left out
    static FormatNode delimited(
        List<FormatNode> open,
        Optional<FormatNode> content,
        Optional<Token> close
    ) {
        var nodes = new ArrayList<FormatNode>(open);
        content.ifPresent(inner -> {
            nodes.add(FormatNode.line());
            nodes.add(FormatNode.indent(List.of(inner)));
            nodes.add(FormatNode.line());
        });
        close.ifPresent(token -> nodes.add(FormatNode.text(token)));
        return FormatNode.group(nodes);
    }
}
