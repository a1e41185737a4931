package org.pragmatica.rollkit.parser;

import org.pragmatica.rollkit.tree.BinaryOperator;
import org.pragmatica.rollkit.tree.SourceSpan;

/**
 * Token types for the expression lexer.
 */
public sealed interface Token {
    SourceSpan span();

    /**
     * Human-readable description used in error messages.
     */
    String describe();

    /**
     * True when the token can be the last token of an operand, so that letters following it are read as operators.
     */
    default boolean endsOperand() {
        return false;
    }

    // Literals and names
    record IntegerLiteral(SourceSpan span, String digits) implements Token {
        @Override
        public String describe() {
            return "integer " + digits;
        }

        @Override
        public boolean endsOperand() {
            return true;
        }
    }

    record Identifier(SourceSpan span, String name) implements Token {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    // d kh kl dh dl * + - == != < <= > >=
    record Operator(SourceSpan span, BinaryOperator operator) implements Token {
        @Override
        public String describe() {
            return "'" + operator.symbol() + "'";
        }
    }

    // Delimiters
    record LParen(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'('";
        }
    }

    record RParen(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "')'";
        }

        @Override
        public boolean endsOperand() {
            return true;
        }
    }

    record LBrace(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'{'";
        }
    }

    record RBrace(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'}'";
        }

        @Override
        public boolean endsOperand() {
            return true;
        }
    }

    record LBracket(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "'['";
        }
    }

    record RBracket(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "']'";
        }

        @Override
        public boolean endsOperand() {
            return true;
        }
    }

    record Comma(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "','";
        }
    }

    // Special
    record Eof(SourceSpan span) implements Token {
        @Override
        public String describe() {
            return "end of input";
        }
    }

    /**
     * Character that starts no token. Lexing stops right after it.
     */
    record Invalid(SourceSpan span, String character) implements Token {
        @Override
        public String describe() {
            return "character '" + character + "'";
        }
    }
}
