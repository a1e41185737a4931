package org.pragmatica.rollkit.parser;

import org.pragmatica.rollkit.error.ParseError;
import org.pragmatica.rollkit.error.ParseException;
import org.pragmatica.rollkit.tree.BinaryOperator;
import org.pragmatica.rollkit.tree.SourceLocation;
import org.pragmatica.rollkit.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for dice expressions.
 */
public final class Lexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;
    private static final int DEFAULT_TOKEN_CAPACITY = 16;

    // Longest first, so that "dh" is not read as "d" followed by "h"
    private static final List<BinaryOperator> KEYWORD_OPERATORS = List.of(
        BinaryOperator.KEEP_HIGHEST,
        BinaryOperator.KEEP_LOWEST,
        BinaryOperator.DROP_HIGHEST,
        BinaryOperator.DROP_LOWEST,
        BinaryOperator.DICE_ROLL
    );

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private SourceLocation location = SourceLocation.START;

    private Lexer(String input) {
        this.input = input;
    }

    /**
     * Split input into tokens. The list always ends with {@link Token.Eof}; an unknown character produces a
     * {@link Token.Invalid} token and ends the scan.
     *
     * @throws ParseException when the input is longer than 1,000,000 characters
     */
    public static List<Token> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            throw new ParseException(new ParseError.InputTooLong(SourceSpan.at(SourceLocation.START),
                                                                 input.length(),
                                                                 MAX_INPUT_SIZE));
        }
        return new Lexer(input).tokenizeAll();
    }

    private List<Token> tokenizeAll() {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) {
                break;
            }
            var token = nextToken();
            tokens.add(token);
            if (token instanceof Token.Invalid) {
                break;
            }
        }
        tokens.add(new Token.Eof(currentSpan()));
        return List.copyOf(tokens);
    }

    private Token nextToken() {
        var start = location;
        char c = peek();
        if (isDigit(c)) {
            return scanInteger(start);
        }
        if (isIdentifierStart(c)) {
            return inOperatorPosition()
                   ? scanKeywordOrIdentifier(start)
                   : scanIdentifier(start);
        }
        return scanSymbol(start);
    }

    private boolean inOperatorPosition() {
        return !tokens.isEmpty() && tokens.get(tokens.size() - 1).endsOperand();
    }

    private Token scanInteger(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isDigit(peek())) {
            sb.append(advance());
        }
        return new Token.IntegerLiteral(span(start), sb.toString());
    }

    private Token scanKeywordOrIdentifier(SourceLocation start) {
        for (var operator : KEYWORD_OPERATORS) {
            if (keywordAt(operator.symbol())) {
                for (int i = 0; i < operator.symbol().length(); i++) {
                    advance();
                }
                return new Token.Operator(span(start), operator);
            }
        }
        return scanIdentifier(start);
    }

    /**
     * Two-letter keywords must not run into a following name, so "1dhex()" is "1 d hex()". A lone "d" may.
     */
    private boolean keywordAt(String symbol) {
        if (!input.startsWith(symbol, location.offset())) {
            return false;
        }
        var after = location.offset() + symbol.length();
        return symbol.length() == 1 || after >= input.length() || !isIdentifierStart(input.charAt(after));
    }

    private Token scanIdentifier(SourceLocation start) {
        var sb = new StringBuilder(DEFAULT_TOKEN_CAPACITY);
        while (!isAtEnd() && isIdentifierPart(peek())) {
            sb.append(advance());
        }
        return new Token.Identifier(span(start), sb.toString());
    }

    private Token scanSymbol(SourceLocation start) {
        char c = advance();
        return switch (c) {
            case '+' -> operator(start, BinaryOperator.ADDITION);
            case '-' -> operator(start, BinaryOperator.SUBTRACTION);
            case '*' -> operator(start, BinaryOperator.MULTIPLICATION);
            case '<' -> match('=')
                        ? operator(start, BinaryOperator.LESS_EQUAL)
                        : operator(start, BinaryOperator.LESS_THAN);
            case '>' -> match('=')
                        ? operator(start, BinaryOperator.GREATER_EQUAL)
                        : operator(start, BinaryOperator.GREATER_THAN);
            case '=' -> match('=')
                        ? operator(start, BinaryOperator.EQUAL)
                        : invalid(start, c);
            case '!' -> match('=')
                        ? operator(start, BinaryOperator.NOT_EQUAL)
                        : invalid(start, c);
            case '(' -> new Token.LParen(span(start));
            case ')' -> new Token.RParen(span(start));
            case '{' -> new Token.LBrace(span(start));
            case '}' -> new Token.RBrace(span(start));
            case '[' -> new Token.LBracket(span(start));
            case ']' -> new Token.RBracket(span(start));
            case ',' -> new Token.Comma(span(start));
            default -> invalid(start, c);
        };
    }

    private Token operator(SourceLocation start, BinaryOperator operator) {
        return new Token.Operator(span(start), operator);
    }

    private Token invalid(SourceLocation start, char c) {
        // keep surrogate pairs together in the report
        if (Character.isHighSurrogate(c) && !isAtEnd() && Character.isLowSurrogate(peek())) {
            return new Token.Invalid(span(start), new String(new char[]{c, advance()}));
        }
        return new Token.Invalid(span(start), String.valueOf(c));
    }

    private boolean match(char expected) {
        if (!isAtEnd() && peek() == expected) {
            advance();
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private boolean isAtEnd() {
        return location.offset() >= input.length();
    }

    private char peek() {
        return input.charAt(location.offset());
    }

    private char advance() {
        char c = peek();
        location = location.advance(c);
        return c;
    }

    private SourceSpan currentSpan() {
        return SourceSpan.at(location);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location);
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
