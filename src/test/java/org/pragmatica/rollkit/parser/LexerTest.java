package org.pragmatica.rollkit.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.rollkit.error.ParseError;
import org.pragmatica.rollkit.error.ParseException;
import org.pragmatica.rollkit.tree.BinaryOperator;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    @Test
    void tokenize_diceNotation_splitsLettersIntoOperators() {
        var tokens = Lexer.tokenize("4d6kh3");

        assertEquals(6, tokens.size());
        assertEquals("4", ((Token.IntegerLiteral) tokens.get(0)).digits());
        assertEquals(BinaryOperator.DICE_ROLL, ((Token.Operator) tokens.get(1)).operator());
        assertEquals("6", ((Token.IntegerLiteral) tokens.get(2)).digits());
        assertEquals(BinaryOperator.KEEP_HIGHEST, ((Token.Operator) tokens.get(3)).operator());
        assertEquals("3", ((Token.IntegerLiteral) tokens.get(4)).digits());
        assertInstanceOf(Token.Eof.class, tokens.get(5));
    }

    @Test
    void tokenize_allKeywordOperators_matchLongestFirst() {
        assertEquals(List.of(BinaryOperator.KEEP_LOWEST, BinaryOperator.DROP_HIGHEST, BinaryOperator.DROP_LOWEST),
                     operators("{1}kl 1 dh 1 dl 1"));
    }

    @Test
    void tokenize_identifierInAtomPosition_isIdentifier() {
        var tokens = Lexer.tokenize("max(3d6)");

        var name = assertInstanceOf(Token.Identifier.class, tokens.get(0));
        assertEquals("max", name.name());
        assertInstanceOf(Token.LParen.class, tokens.get(1));
        assertInstanceOf(Token.Operator.class, tokens.get(3));
    }

    @Test
    void tokenize_lettersAfterOperandWithoutKeyword_isIdentifier() {
        var tokens = Lexer.tokenize("3 max");

        assertInstanceOf(Token.Identifier.class, tokens.get(1));
    }

    @Test
    void tokenize_lettersAfterClosingDelimiters_areOperators() {
        assertEquals(List.of(BinaryOperator.DICE_ROLL, BinaryOperator.DICE_ROLL, BinaryOperator.KEEP_HIGHEST),
                     operators("(2)d[1, 3]d{6}kh1"));
    }

    @Test
    void tokenize_comparisonOperators_recognizesTwoCharacterForms() {
        assertEquals(List.of(BinaryOperator.EQUAL,
                             BinaryOperator.NOT_EQUAL,
                             BinaryOperator.LESS_EQUAL,
                             BinaryOperator.LESS_THAN,
                             BinaryOperator.GREATER_EQUAL,
                             BinaryOperator.GREATER_THAN),
                     operators("1 == 2 != 3 <= 4 < 5 >= 6 > 7"));
    }

    @Test
    void tokenize_minus_isAlwaysSubtractionToken() {
        var tokens = Lexer.tokenize("-7");

        var minus = assertInstanceOf(Token.Operator.class, tokens.get(0));
        assertEquals(BinaryOperator.SUBTRACTION, minus.operator());
        assertInstanceOf(Token.IntegerLiteral.class, tokens.get(1));
    }

    @Test
    void tokenize_whitespace_producesNoTokens() {
        var tokens = Lexer.tokenize(" \t1 \r\n+\n 2 ");

        assertEquals(4, tokens.size());
        var two = tokens.get(2);
        assertEquals(3, two.span().start().line());
        assertEquals(2, two.span().start().column());
    }

    @Test
    void tokenize_unknownCharacter_stopsWithInvalidToken() {
        var tokens = Lexer.tokenize("1 + $ 2");

        assertEquals(4, tokens.size());
        var invalid = assertInstanceOf(Token.Invalid.class, tokens.get(2));
        assertEquals("$", invalid.character());
        assertEquals(5, invalid.span().start().column());
        assertInstanceOf(Token.Eof.class, tokens.get(3));
    }

    @Test
    void tokenize_loneEquals_isInvalid() {
        var tokens = Lexer.tokenize("1 = 2");

        var invalid = assertInstanceOf(Token.Invalid.class, tokens.get(1));
        assertEquals("=", invalid.character());
    }

    @Test
    void tokenize_emptyInput_onlyEof() {
        var tokens = Lexer.tokenize("   ");

        assertEquals(1, tokens.size());
        assertInstanceOf(Token.Eof.class, tokens.get(0));
    }

    @Test
    void tokenize_oversizedInput_failsWithInputTooLong() {
        var input = "1".repeat(1_000_001);

        var error = assertThrows(ParseException.class, () -> Lexer.tokenize(input)).error();

        assertEquals(new ParseError.InputTooLong(error.span(), 1_000_001, 1_000_000), error);
    }

    @Test
    void tokenize_diceFollowedByName_splitsAfterD() {
        var tokens = Lexer.tokenize("1dlen(2)");

        assertEquals(BinaryOperator.DICE_ROLL, ((Token.Operator) tokens.get(1)).operator());
        assertEquals("len", assertInstanceOf(Token.Identifier.class, tokens.get(2)).name());
    }

    @Test
    void tokenize_twoLetterKeywordBeforeDigitOrSpace_staysKeyword() {
        assertEquals(List.of(BinaryOperator.DICE_ROLL, BinaryOperator.DROP_HIGHEST, BinaryOperator.KEEP_LOWEST),
                     operators("4d6dh1 kl(1)"));
    }

    @Test
    void tokenize_tracksLinesInSpans() {
        var tokens = Lexer.tokenize("1 +\n  22");

        var literal = (Token.IntegerLiteral) tokens.get(2);
        assertEquals(2, literal.span().start().line());
        assertEquals(3, literal.span().start().column());
        assertEquals(6, literal.span().start().offset());
        assertEquals(5, literal.span().end().column());
    }

    private static List<BinaryOperator> operators(String input) {
        return Lexer.tokenize(input)
                    .stream()
                    .filter(Token.Operator.class::isInstance)
                    .map(token -> ((Token.Operator) token).operator())
                    .toList();
    }
}
