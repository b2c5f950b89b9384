package org.formulafmt;

import java.util.*;

// Formula = [ Expression ]
//
// ST short for Syntax Tree
//
// It's lossless: every token the parser consumed, punctuation included, is
// kept in the tree, so the formatter never needs the source text.
public final class ST {
    private ST() {}

    // Expression = Term { Operator Term }
    //
    // No precedence levels, the chain is kept flat and read left to right.
    public record Expression(List<Term> terms, List<Token> operatorTokens) {
        public Expression {
            terms = List.copyOf(terms);
            operatorTokens = List.copyOf(operatorTokens);
            if (terms.isEmpty()) {
                throw new IllegalArgumentException("expression without terms");
            }
            if (operatorTokens.size() != terms.size() - 1) {
                throw new IllegalArgumentException(
                    "expected " + (terms.size() - 1) + " operators, got " + operatorTokens.size()
                );
            }
        }
    }

    // ExpressionList = [ Expression ] { ',' [ Expression ] }
    //
    // A null entry is an elided argument, as in f(,1).
    public record ExpressionList(List<Expression> expressions, List<Token> commaTokens) {
        public ExpressionList {
            // List.copyOf rejects nulls, and nulls are meaningful here
            expressions = Collections.unmodifiableList(new ArrayList<>(expressions));
            commaTokens = List.copyOf(commaTokens);
            if (commaTokens.size() != Math.max(expressions.size() - 1, 0)) {
                throw new IllegalArgumentException(
                    "expected " + Math.max(expressions.size() - 1, 0) + " commas, got " + commaTokens.size()
                );
            }
        }

        // Anything besides a single elided expression
        public boolean hasContent() {
            return !commaTokens.isEmpty()
                || expressions.stream().anyMatch(Objects::nonNull);
        }
    }

    // Term = ArrayLiteral | Call | Parenthesized | UnaryOp | Literal
    public sealed interface Term
            permits Literal, UnaryOp, ArrayLiteral, Call, Parenthesized {}

    // Literal = IDENTIFIER | NUMBER | STRING | RANGE | LITERAL | ERROR
    public record Literal(Token token) implements Term {}

    // UnaryOp = ( '+' | '-' ) Term
    //
    // The operand is a non-string literal, a call, or a parenthesized
    // expression.
    public record UnaryOp(Token operatorToken, Term operand) implements Term {}

    // ArrayLiteral = '{' ExpressionList { ';' ExpressionList } '}'
    public record ArrayLiteral(
        Token leftBracketToken,
        List<ExpressionList> rows,
        List<Token> semicolonTokens,
        Optional<Token> rightBracketToken
    ) implements Term {
        public ArrayLiteral {
            rows = List.copyOf(rows);
            semicolonTokens = List.copyOf(semicolonTokens);
            if (semicolonTokens.size() != rows.size() - 1) {
                throw new IllegalArgumentException(
                    "expected " + (rows.size() - 1) + " semicolons, got " + semicolonTokens.size()
                );
            }
        }

        public boolean hasContent() {
            return rows.size() > 1 || rows.get(0).hasContent();
        }
    }

    // Call = IDENTIFIER '(' ExpressionList ')'
    public record Call(
        Token functionToken,
        Token leftParenToken,
        ExpressionList args,
        Optional<Token> rightParenToken
    ) implements Term {}

    // Parenthesized = '(' Expression ')'
    public record Parenthesized(
        Token leftParenToken,
        Expression expression,
        Optional<Token> rightParenToken
    ) implements Term {}
}
