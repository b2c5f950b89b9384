package org.formulafmt;

import java.util.*;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

// Recursive descent over a token array.
//
// Every production takes the index it starts at and returns the index right
// after what it consumed together with the node, or empty if nothing matches
// there. Nothing is thrown, so trying another alternative is just calling
// another method with the same index.
//
// Errors never stop the parse. They are attached to the token that caused
// them, first error wins.
public class Parser {
    /*
     * Production result
     */
    record Step<T>(int next, T node) {}

    /*
     * Parser data
     */
    final List<Token> _tokens;
    final int tokenCount;

    /*
     * Output: token index -> first structural error
     */
    final Map<Integer, TokenError> annotations = new TreeMap<>();

    /*
     * Logger
     */
    private static final Logger log = LogManager.getLogger("parser");

    public Parser(List<Token> tokens) {
        this._tokens = List.copyOf(tokens);
        this.tokenCount = this._tokens.size();
    }

    public static ParseResult parseLines(List<String> lines) {
        return parseTokens(Tokenizer.tokenize(lines));
    }

    public static ParseResult parseTokens(List<Token> tokens) {
        var firstPass = new Parser(tokens);
        firstPass.parseFormula();
        var annotated = firstPass.annotatedTokens();

        // Parse decisions only look at token types, so running again over the
        // annotated tokens gives the same tree, now holding the same tokens as
        // the result's token list.
        var secondPass = new Parser(annotated);
        var formula = secondPass.parseFormula();
        assert secondPass.annotations.isEmpty() : "second pass found new errors";

        var expression = formula.map(Step::node);
        int consumed = formula.map(Step::next).orElse(0);
        return ParseResult.of(annotated, expression, consumed);
    }

    // Formula = [ Expression ]
    Optional<Step<ST.Expression>> parseFormula() {
        log.debug("parse formula");

        var result = this.parseExpression(0);
        int endIndex = result.map(Step::next).orElse(0);
        if (endIndex < tokenCount) {
            log.debug("unexpected token at [{}]", endIndex);
            this.annotate(endIndex, TokenError.UNEXPECTED_TOKEN);
        }
        return result;
    }

    // Expression = Term { Operator Term }
    Optional<Step<ST.Expression>> parseExpression(int index) {
        log.debug("parse expr at [{}]", index);

        var first = this.parseTerm(index);
        if (first.isEmpty()) {
            return Optional.empty();
        }

        var terms = new ArrayList<ST.Term>();
        var operators = new ArrayList<Token>();
        terms.add(first.get().node());
        int endIndex = first.get().next();

        // Take as many operations as possible
        while (endIndex < tokenCount) {
            var operator = _tokens.get(endIndex);
            if (!operator.type().isBinaryOperator()) {
                break;
            }

            var next = this.parseTerm(endIndex + 1);
            if (next.isEmpty()) {
                // Leave the operator for the caller
                break;
            }

            operators.add(operator);
            terms.add(next.get().node());
            endIndex = next.get().next();
        }

        return Optional.of(new Step<ST.Expression>(endIndex, new ST.Expression(terms, operators)));
    }

    // Never fails, the node is null when there's no expression at index
    Step<ST.Expression> parseExpressionOrEmpty(int index) {
        return this.parseExpression(index).orElse(new Step<>(index, null));
    }

    // ExpressionList = [ Expression ] { ',' [ Expression ] }
    Step<ST.ExpressionList> parseExpressionList(int index) {
        log.debug("parse expr list at [{}]", index);

        var first = this.parseExpressionOrEmpty(index);
        var expressions = new ArrayList<ST.Expression>();
        var commas = new ArrayList<Token>();
        expressions.add(first.node());
        int endIndex = first.next();

        while (endIndex < tokenCount && _tokens.get(endIndex).isType(TokenType.COMMA)) {
            commas.add(_tokens.get(endIndex));
            var next = this.parseExpressionOrEmpty(endIndex + 1);
            expressions.add(next.node());
            endIndex = next.next();
        }

        return new Step<>(endIndex, new ST.ExpressionList(expressions, commas));
    }

    // Term = ArrayLiteral | Call | '(' Expression ')' | UnaryOp | Literal
    Optional<Step<ST.Term>> parseTerm(int start) {
        if (start >= tokenCount) {
            return Optional.empty();
        }
        log.debug("parse term at [{}] {}", start, _tokens.get(start));

        var startToken = _tokens.get(start);

        if (startToken.isType(TokenType.L_BRACKET)) {
            return Optional.of(this.parseArrayLiteral(start));
        }

        if (startToken.isType(TokenType.IDENTIFIER)
            && start + 1 < tokenCount
            && _tokens.get(start + 1).isType(TokenType.L_PAREN)) {
            return Optional.of(this.parseCall(start));
        }

        if (startToken.isType(TokenType.L_PAREN)) {
            var parenthesized = this.parseParenthesized(start);
            if (parenthesized.isPresent()) {
                return parenthesized;
            }
        }

        if (startToken.type().isUnaryOperator()) {
            var unary = this.parseUnaryOp(start);
            if (unary.isPresent()) {
                return unary;
            }
        }

        // ERROR tokens count too, an unknown name or an unclosed string
        // still sits where a term would
        if (TokenType.LITERALS.contains(startToken.type())) {
            return Optional.of(new Step<ST.Term>(start + 1, new ST.Literal(startToken)));
        }

        return Optional.empty();
    }

    // ArrayLiteral = '{' ExpressionList { ';' ExpressionList } '}'
    Step<ST.Term> parseArrayLiteral(int start) {
        log.debug("parse array literal");

        var leftBracket = _tokens.get(start);
        var rows = new ArrayList<ST.ExpressionList>();
        var semicolons = new ArrayList<Token>();
        Optional<Token> rightBracket = Optional.empty();

        var first = this.parseExpressionList(start + 1);
        rows.add(first.node());
        int endIndex = first.next();

        while (endIndex < tokenCount) {
            var token = _tokens.get(endIndex);
            if (token.isType(TokenType.R_BRACKET)) {
                rightBracket = Optional.of(token);
                endIndex++;
                break;
            }
            if (!token.isType(TokenType.SEMICOLON)) {
                break;
            }

            semicolons.add(token);
            var row = this.parseExpressionList(endIndex + 1);
            rows.add(row.node());
            endIndex = row.next();
        }

        if (rightBracket.isEmpty()) {
            this.annotate(start, TokenError.UNCLOSED_ARRAY_LITERAL);
        }

        return new Step<>(endIndex, new ST.ArrayLiteral(leftBracket, rows, semicolons, rightBracket));
    }

    // Call = IDENTIFIER '(' ExpressionList ')'
    Step<ST.Term> parseCall(int start) {
        log.debug("parse call {}", _tokens.get(start).content());

        var args = this.parseExpressionList(start + 2);
        int endIndex = args.next();
        Optional<Token> rightParen = Optional.empty();

        if (endIndex < tokenCount && _tokens.get(endIndex).isType(TokenType.R_PAREN)) {
            rightParen = Optional.of(_tokens.get(endIndex));
            endIndex++;
        } else {
            this.annotate(start + 1, TokenError.UNCLOSED_FUNCTION_CALL);
        }

        var call = new ST.Call(_tokens.get(start), _tokens.get(start + 1), args.node(), rightParen);
        return new Step<>(endIndex, call);
    }

    // Parenthesized = '(' Expression ')'
    //
    // Empty parentheses aren't a term.
    Optional<Step<ST.Term>> parseParenthesized(int start) {
        log.debug("parse parenthesized");

        var inner = this.parseExpression(start + 1);
        if (inner.isEmpty()) {
            return Optional.empty();
        }

        int endIndex = inner.get().next();
        Optional<Token> rightParen = Optional.empty();
        if (endIndex < tokenCount && _tokens.get(endIndex).isType(TokenType.R_PAREN)) {
            rightParen = Optional.of(_tokens.get(endIndex));
            endIndex++;
        } else {
            this.annotate(start, TokenError.UNCLOSED_PARENTHESES);
        }

        var term = new ST.Parenthesized(_tokens.get(start), inner.get().node(), rightParen);
        return Optional.of(new Step<ST.Term>(endIndex, term));
    }

    // UnaryOp = ( '+' | '-' ) Term
    Optional<Step<ST.Term>> parseUnaryOp(int start) {
        log.debug("parse unary op");

        var operand = this.parseTerm(start + 1);
        if (operand.isEmpty()) {
            return Optional.empty();
        }

        var node = operand.get().node();
        if (!isUnaryOperand(node)) {
            this.annotate(start, TokenError.INVALID_UNARY_OPERAND);
            return Optional.empty();
        }

        var unary = new ST.UnaryOp(_tokens.get(start), node);
        return Optional.of(new Step<ST.Term>(operand.get().next(), unary));
    }

    static boolean isUnaryOperand(ST.Term term) {
        if (term instanceof ST.Literal literal) {
            return TokenType.UNARY_OPERANDS.contains(literal.token().type());
        }
        return term instanceof ST.Call || term instanceof ST.Parenthesized;
    }

    void annotate(int index, TokenError error) {
        if (_tokens.get(index).error() != null) {
            return;
        }
        if (annotations.putIfAbsent(index, error) == null) {
            log.debug("[{}] {}", index, error.message());
        }
    }

    List<Token> annotatedTokens() {
        var result = new ArrayList<>(_tokens);
        annotations.forEach((index, error) -> result.set(index, result.get(index).withError(error)));
        return result;
    }
}
