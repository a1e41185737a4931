package org.pragmatica.rollkit.tree;

/**
 * Visitor over {@link Expr} nodes.
 */
public interface ExprVisitor<R> {
    R visitIntegerLiteral(Expr.IntegerLiteral literal);

    R visitExplicitList(Expr.ExplicitListLiteral list);

    R visitRangeList(Expr.RangeListLiteral range);

    R visitStrongWrap(Expr.StrongWrap wrap);

    R visitBinaryOp(Expr.BinaryOp op);

    R visitCall(Expr.Call call);
}
