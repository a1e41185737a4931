package org.pragmatica.rollkit.parser;

import org.pragmatica.rollkit.error.ParseError;
import org.pragmatica.rollkit.error.ParseException;
import org.pragmatica.rollkit.tree.BinaryOperator;
import org.pragmatica.rollkit.tree.Expr;
import org.pragmatica.rollkit.tree.SourceSpan;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Precedence-climbing recursive descent parser for dice expressions.
 *
 * <p>Atoms: integer literals, {@code {e1, e2, ...}} list literals, {@code {expr}} strong wraps,
 * {@code [start, end, step?]} ranges, {@code name(args...)} calls and parenthesised expressions.
 * A {@code -} written directly in front of digits where an atom is expected is the sign of a negative literal;
 * everywhere else it is subtraction.
 *
 * <p>Trees deeper than {@value #MAX_DEPTH} levels are rejected, so that walking the result cannot exhaust the stack.
 */
public final class ExpressionParser {
    public static final int MAX_DEPTH = 256;

    private final List<Token> tokens;
    // height of every composite node built so far, leaves count as 1
    private final Map<Expr, Integer> heights = new IdentityHashMap<>();
    private int pos;
    private int depth;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse expression text into a tree.
     *
     * @throws ParseException when the text is not a single well-formed expression
     */
    public static Expr parse(String text) {
        var tokens = Lexer.tokenize(text);

        for (var token : tokens) {
            if (token instanceof Token.Invalid invalid) {
                throw new ParseException(new ParseError.LexError(invalid.span(), invalid.character()));
            }
        }

        return new ExpressionParser(tokens).parseInput();
    }

    private Expr parseInput() {
        var expr = parseExpression(0);
        if (!isAtEnd()) {
            throw unexpected("operator or end of input");
        }
        return expr;
    }

    private Expr parseExpression(int minPrecedence) {
        if (++depth > MAX_DEPTH) {
            throw tooDeep(peek().span());
        }
        var left = parseAtom();

        while (peek() instanceof Token.Operator token && token.operator().precedence() >= minPrecedence) {
            var operator = token.operator();
            advance();
            var nextMin = operator.associativity() == BinaryOperator.Associativity.LEFT
                          ? operator.precedence() + 1
                          : operator.precedence();
            var right = parseExpression(nextMin);
            var binary = new Expr.BinaryOp(left.span().to(right.span()), operator, left, right);
            left = node(binary, List.of(left, right));
        }

        depth--;
        return left;
    }

    private Expr parseAtom() {
        var token = peek();

        if (token instanceof Token.IntegerLiteral literal) {
            advance();
            return integer(literal.span(), "", literal.digits());
        }

        if (isNegativeLiteral()) {
            advance();
            var literal = (Token.IntegerLiteral) peek();
            advance();
            return integer(token.span().to(literal.span()), "-", literal.digits());
        }

        if (token instanceof Token.Identifier identifier) {
            return parseCall(identifier);
        }

        if (token instanceof Token.LParen) {
            advance();
            var inner = parseExpression(0);
            expect(Token.RParen.class, "')'");
            return inner;
        }

        if (token instanceof Token.LBrace) {
            return parseBraces();
        }

        if (token instanceof Token.LBracket) {
            return parseRange();
        }

        throw unexpected("expression");
    }

    private boolean isNegativeLiteral() {
        return peek() instanceof Token.Operator minus
               && minus.operator() == BinaryOperator.SUBTRACTION
               && peekNext() instanceof Token.IntegerLiteral literal
               && minus.span().touches(literal.span());
    }

    private Expr integer(SourceSpan span, String sign, String digits) {
        var text = sign + digits;
        try {
            return new Expr.IntegerLiteral(span, Long.parseLong(text));
        } catch (NumberFormatException e) {
            throw new ParseException(new ParseError.IntegerOverflow(span, text));
        }
    }

    private Expr parseCall(Token.Identifier identifier) {
        advance();
        if (!(peek() instanceof Token.LParen)) {
            throw unexpected("'(' after function name '" + identifier.name() + "'");
        }
        advance();

        var args = parseElements(Token.RParen.class, "',' or ')'");
        var close = expect(Token.RParen.class, "')'");
        return node(new Expr.Call(identifier.span().to(close.span()), identifier.name(), args), args);
    }

    /**
     * {@code {}} and {@code {a, b, ...}} are list literals, {@code {a}} without a comma is a strong wrap.
     */
    private Expr parseBraces() {
        var open = peek();
        advance();

        if (peek() instanceof Token.RBrace close) {
            advance();
            return new Expr.ExplicitListLiteral(open.span().to(close.span()), List.of());
        }

        var first = parseExpression(0);

        if (peek() instanceof Token.RBrace close) {
            advance();
            return node(new Expr.StrongWrap(open.span().to(close.span()), first), List.of(first));
        }

        if (!(peek() instanceof Token.Comma)) {
            throw unexpected("',' or '}'");
        }
        advance();

        var elements = new ArrayList<Expr>();
        elements.add(first);
        elements.addAll(parseElements(Token.RBrace.class, "',' or '}'"));
        var close = expect(Token.RBrace.class, "'}'");
        return node(new Expr.ExplicitListLiteral(open.span().to(close.span()), elements), elements);
    }

    /**
     * Comma separated expressions up to (not including) the closing token. A trailing comma is allowed.
     */
    private List<Expr> parseElements(Class<? extends Token> closing, String expected) {
        var elements = new ArrayList<Expr>();

        while (!closing.isInstance(peek())) {
            elements.add(parseExpression(0));

            if (peek() instanceof Token.Comma) {
                advance();
            } else if (!closing.isInstance(peek())) {
                throw unexpected(expected);
            }
        }

        return elements;
    }

    private Expr parseRange() {
        var open = peek();
        advance();

        var start = parseExpression(0);
        expect(Token.Comma.class, "','");
        var end = parseExpression(0);

        Optional<Expr> step = Optional.empty();
        if (peek() instanceof Token.Comma) {
            advance();
            var stepExpr = parseExpression(0);
            if (stepExpr instanceof Expr.IntegerLiteral literal && literal.value() == 0) {
                throw new ParseException(new ParseError.InvalidStep(literal.span()));
            }
            step = Optional.of(stepExpr);
        }

        var close = expect(Token.RBracket.class, "',' or ']'");
        var parts = new ArrayList<>(List.of(start, end));
        step.ifPresent(parts::add);
        return node(new Expr.RangeListLiteral(open.span().to(close.span()), start, end, step), parts);
    }

    private Expr node(Expr expr, List<Expr> children) {
        var height = 1;
        for (var child : children) {
            height = Math.max(height, heights.getOrDefault(child, 1) + 1);
        }
        if (height > MAX_DEPTH) {
            throw tooDeep(expr.span());
        }
        heights.put(expr, height);
        return expr;
    }

    private ParseException tooDeep(SourceSpan span) {
        return new ParseException(new ParseError.NestingTooDeep(span, MAX_DEPTH));
    }

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekNext() {
        return tokens.get(Math.min(pos + 1, tokens.size() - 1));
    }

    private void advance() {
        if (!isAtEnd()) {
            pos++;
        }
    }

    private Token expect(Class<? extends Token> tokenClass, String expected) {
        var token = peek();
        if (!tokenClass.isInstance(token)) {
            throw unexpected(expected);
        }
        advance();
        return token;
    }

    private ParseException unexpected(String expected) {
        var token = peek();
        if (token instanceof Token.Eof) {
            return new ParseException(new ParseError.UnexpectedEof(token.span(), expected));
        }
        return new ParseException(new ParseError.UnexpectedToken(token.span(), token.describe(), expected));
    }
}
