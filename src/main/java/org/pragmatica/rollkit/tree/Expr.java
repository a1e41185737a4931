package org.pragmatica.rollkit.tree;

import java.util.List;
import java.util.Optional;

/**
 * Expression tree produced by the parser. Nodes are immutable and own their children.
 */
public sealed interface Expr {

    /**
     * Source location of this expression.
     */
    SourceSpan span();

    <R> R accept(ExprVisitor<R> visitor);

    /**
     * Render this expression on a single, fully parenthesised line.
     */
    default String formatInline() {
        return accept(new InlineFormatter());
    }

    // === Literals ===

    /**
     * Integer literal: 42, -7
     */
    record IntegerLiteral(SourceSpan span, long value) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIntegerLiteral(this);
        }
    }

    /**
     * Explicit list literal: {1, 2, 3}, {}, {5,}
     */
    record ExplicitListLiteral(SourceSpan span, List<Expr> elements) implements Expr {
        public ExplicitListLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitExplicitList(this);
        }
    }

    /**
     * Range list literal: [start, end] or [start, end, step]
     */
    record RangeListLiteral(SourceSpan span, Expr start, Expr end, Optional<Expr> step) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitRangeList(this);
        }
    }

    // === Composites ===

    /**
     * Strong wrap of a single list expression: {3d6}, {{1, 2}}
     */
    record StrongWrap(SourceSpan span, Expr inner) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitStrongWrap(this);
        }
    }

    record BinaryOp(SourceSpan span, BinaryOperator operator, Expr left, Expr right) implements Expr {
        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryOp(this);
        }
    }

    /**
     * Function call: name(arg1, arg2, ...)
     */
    record Call(SourceSpan span, String name, List<Expr> args) implements Expr {
        public Call {
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }
}
