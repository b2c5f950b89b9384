package org.formulafmt;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;
import java.util.stream.Collectors;

class ParserTest {
    private static ParseResult parse(String... lines) {
        return Parser.parseLines(List.of(lines));
    }

    private static ST.Term onlyTerm(ParseResult result) {
        var expression = result.expression().orElseThrow();
        assertEquals(1, expression.terms().size());
        return expression.terms().get(0);
    }

    private static List<TokenError> errors(ParseResult result) {
        return result.errors().stream()
            .map(Token::error)
            .collect(Collectors.toList());
    }

    @Test
    void binaryChain() {
        var result = parse("A1+B2");

        assertFalse(result.hasError());
        assertTrue(result.canFormatExpression());
        var expression = result.expression().orElseThrow();
        assertEquals(2, expression.terms().size());
        assertEquals(1, expression.operatorTokens().size());
        assertEquals(TokenType.PLUS, expression.operatorTokens().get(0).type());
        assertEquals(3, result.consumedTokens());
    }

    @Test
    void chainIsFlatWithoutPrecedence() {
        var expression = parse("1+2*3-4").expression().orElseThrow();

        assertEquals(4, expression.terms().size());
        assertEquals(
            List.of(TokenType.PLUS, TokenType.MULTIPLY, TokenType.MINUS),
            expression.operatorTokens().stream().map(Token::type).collect(Collectors.toList())
        );
        assertTrue(expression.terms().stream().allMatch(term -> term instanceof ST.Literal));
    }

    @Test
    void arrayLiteral() {
        var result = parse("{1,2;3,4}");

        assertFalse(result.hasError());
        var array = (ST.ArrayLiteral) onlyTerm(result);
        assertEquals(2, array.rows().size());
        assertEquals(1, array.semicolonTokens().size());
        assertEquals(2, array.rows().get(0).expressions().size());
        assertEquals(2, array.rows().get(1).expressions().size());
        assertTrue(array.rightBracketToken().isPresent());
    }

    @Test
    void emptyArrayLiteral() {
        var array = (ST.ArrayLiteral) onlyTerm(parse("{}"));

        assertFalse(array.hasContent());
        assertEquals(1, array.rows().size());
        assertEquals(Collections.singletonList(null), array.rows().get(0).expressions());
    }

    @Test
    void unclosedArrayLiteral() {
        var result = parse("{1,2");

        var array = (ST.ArrayLiteral) onlyTerm(result);
        assertTrue(array.rightBracketToken().isEmpty());
        assertEquals(List.of(TokenError.UNCLOSED_ARRAY_LITERAL), errors(result));
        assertEquals("{", result.errors().get(0).content());
    }

    @Test
    void call() {
        var result = parse("SUM(1,2,3)");

        assertFalse(result.hasError());
        var call = (ST.Call) onlyTerm(result);
        assertEquals("SUM", call.functionToken().content());
        assertEquals(3, call.args().expressions().size());
        assertEquals(2, call.args().commaTokens().size());
        assertTrue(call.rightParenToken().isPresent());
    }

    @Test
    void callWithoutArguments() {
        var call = (ST.Call) onlyTerm(parse("NOW()"));

        assertFalse(call.args().hasContent());
        assertTrue(call.rightParenToken().isPresent());
    }

    @Test
    void unclosedCall() {
        var result = parse("foo(");

        assertTrue(result.hasError());
        assertTrue(result.canFormatExpression());

        var call = (ST.Call) onlyTerm(result);
        assertEquals(Collections.singletonList(null), call.args().expressions());
        assertTrue(call.rightParenToken().isEmpty());

        assertEquals(TokenError.UNCLOSED_FUNCTION_CALL, result.tokens().get(1).error());
        // the tree holds the annotated token too
        assertEquals(TokenError.UNCLOSED_FUNCTION_CALL, call.leftParenToken().error());
    }

    @Test
    void elidedArguments() {
        var call = (ST.Call) onlyTerm(parse("f(,1,)"));

        var args = call.args().expressions();
        assertEquals(3, args.size());
        assertNull(args.get(0));
        assertNotNull(args.get(1));
        assertNull(args.get(2));
        assertEquals(2, call.args().commaTokens().size());
    }

    @Test
    void cellReferenceDoesNotStartACall() {
        for (var source : List.of("A1(1)", "LOG10(100)")) {
            var result = parse(source);

            var literal = assertInstanceOf(ST.Literal.class, onlyTerm(result), source);
            assertEquals(TokenType.RANGE, literal.token().type(), source);
            assertEquals(1, result.consumedTokens(), source);
            assertTrue(result.hasError(), source);
            assertEquals(List.of(TokenError.UNEXPECTED_TOKEN), errors(result), source);
            assertEquals(TokenType.L_PAREN, result.errors().get(0).type(), source);
        }
    }

    @Test
    void parenthesized() {
        var result = parse("(1+2)*3");

        assertFalse(result.hasError());
        var expression = result.expression().orElseThrow();
        assertEquals(2, expression.terms().size());
        var parenthesized = (ST.Parenthesized) expression.terms().get(0);
        assertEquals(2, parenthesized.expression().terms().size());
    }

    @Test
    void unclosedParentheses() {
        var result = parse("(1");

        var parenthesized = (ST.Parenthesized) onlyTerm(result);
        assertTrue(parenthesized.rightParenToken().isEmpty());
        assertEquals(List.of(TokenError.UNCLOSED_PARENTHESES), errors(result));
    }

    @Test
    void emptyParenthesesAreUnexpected() {
        var result = parse("()");

        assertTrue(result.expression().isEmpty());
        assertEquals(0, result.consumedTokens());
        assertEquals(TokenError.UNEXPECTED_TOKEN, result.tokens().get(0).error());
    }

    @Test
    void unaryOperators() {
        var result = parse("-A1 + +SUM(1)");

        assertFalse(result.hasError());
        var expression = result.expression().orElseThrow();
        var first = (ST.UnaryOp) expression.terms().get(0);
        assertEquals(TokenType.MINUS, first.operatorToken().type());
        assertInstanceOf(ST.Literal.class, first.operand());
        var second = (ST.UnaryOp) expression.terms().get(1);
        assertInstanceOf(ST.Call.class, second.operand());
    }

    @Test
    void unaryOperandMustBeSimple() {
        for (var source : List.of("-\"a\"", "--1", "-{1}")) {
            var result = parse(source);

            assertTrue(result.expression().isEmpty(), source);
            assertEquals(TokenError.INVALID_UNARY_OPERAND, result.tokens().get(0).error(), source);
            // the operator keeps its first error
            assertEquals(List.of(TokenError.INVALID_UNARY_OPERAND), errors(result), source);
        }
    }

    @Test
    void unexpectedToken() {
        var result = parse("1 2 3");

        assertEquals(1, result.consumedTokens());
        assertEquals(List.of(TokenError.UNEXPECTED_TOKEN), errors(result));
        assertEquals("2", result.errors().get(0).content());
        assertEquals(2, result.trailingTokens().size());
    }

    @Test
    void danglingOperatorIsUnexpected() {
        var result = parse("1 +");

        assertEquals(1, result.expression().orElseThrow().terms().size());
        assertEquals(TokenType.PLUS, result.errors().get(0).type());
        assertEquals(TokenError.UNEXPECTED_TOKEN, result.errors().get(0).error());
    }

    @Test
    void unclosedStringBlocksFormatting() {
        var result = parse("\"abc");

        assertEquals(1, result.tokens().size());
        assertEquals(TokenType.ERROR, result.tokens().get(0).type());
        assertTrue(result.hasError());
        assertFalse(result.canFormatExpression());
    }

    @Test
    void unknownTokenStillParses() {
        var result = parse("1+@");

        assertTrue(result.hasError());
        assertTrue(result.canFormatExpression());
        assertEquals(2, result.expression().orElseThrow().terms().size());
        assertEquals(List.of(TokenError.UNKNOWN_TOKEN), errors(result));
    }

    @Test
    void whitespaceOnly() {
        var result = parse("   ", "\t");

        assertTrue(result.tokens().isEmpty());
        assertTrue(result.expression().isEmpty());
        assertFalse(result.hasError());
        assertTrue(result.canFormatExpression());
    }

    @Test
    void errorsFollowSourceOrder() {
        var result = parse("SUM(1 @", "{2");

        var positions = result.errors().stream()
            .map(Token::startPosition)
            .collect(Collectors.toList());
        var sorted = new ArrayList<>(positions);
        Collections.sort(sorted);
        assertEquals(sorted, positions);
        assertTrue(result.errors().size() >= 2);
    }

    @Test
    void parsingIsDeterministic() {
        var lines = List.of("IF(A1>0,", "  {1;2},", "  -B2)");

        assertEquals(Parser.parseLines(lines), Parser.parseLines(lines));
    }
}
