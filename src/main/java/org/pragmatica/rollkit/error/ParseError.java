package org.pragmatica.rollkit.error;

import org.pragmatica.rollkit.tree.SourceLocation;
import org.pragmatica.rollkit.tree.SourceSpan;

/**
 * Parse error with location and context information.
 */
public sealed interface ParseError {
    SourceSpan span();

    String message();

    default SourceLocation location() {
        return span().start();
    }

    /**
     * Character that cannot start any token.
     */
    record LexError(
    SourceSpan span,
    String character) implements ParseError {
        @Override
        public String message() {
            return "Unexpected character '" + character + "' at " + location();
        }
    }

    /**
     * Unexpected token error.
     */
    record UnexpectedToken(
    SourceSpan span,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location() + ", expected " + expected;
        }
    }

    /**
     * Unexpected end of input.
     */
    record UnexpectedEof(
    SourceSpan span,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at " + location() + ", expected " + expected;
        }
    }

    /**
     * Integer literal outside the signed 64-bit range.
     */
    record IntegerOverflow(
    SourceSpan span,
    String literal) implements ParseError {
        @Override
        public String message() {
            return "Integer literal " + literal + " at " + location() + " does not fit in 64 bits";
        }
    }

    /**
     * Expression text longer than the lexer accepts.
     */
    record InputTooLong(
    SourceSpan span,
    int length,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Expression of " + length + " characters exceeds the maximum of " + limit;
        }
    }

    /**
     * Expression nested deeper than the parser accepts.
     */
    record NestingTooDeep(
    SourceSpan span,
    int limit) implements ParseError {
        @Override
        public String message() {
            return "Expression at " + location() + " is nested deeper than " + limit + " levels";
        }
    }

    /**
     * Range literal with a literal zero step.
     */
    record InvalidStep(SourceSpan span) implements ParseError {
        @Override
        public String message() {
            return "Range step at " + location() + " must not be zero";
        }
    }
}
