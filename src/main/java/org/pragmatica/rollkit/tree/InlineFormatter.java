package org.pragmatica.rollkit.tree;

import java.util.stream.Collectors;

/**
 * Formats an expression on one line with every binary operation parenthesised.
 */
public final class InlineFormatter implements ExprVisitor<String> {

    @Override
    public String visitIntegerLiteral(Expr.IntegerLiteral literal) {
        return Long.toString(literal.value());
    }

    @Override
    public String visitExplicitList(Expr.ExplicitListLiteral list) {
        var body = list.elements()
                       .stream()
                       .map(element -> element.accept(this))
                       .collect(Collectors.joining(", "));
        // {x} would read back as a strong wrap
        var trailing = list.elements().size() == 1 ? "," : "";
        return "{" + body + trailing + "}";
    }

    @Override
    public String visitRangeList(Expr.RangeListLiteral range) {
        var sb = new StringBuilder("[");
        sb.append(range.start().accept(this))
          .append(", ")
          .append(range.end().accept(this));
        range.step().ifPresent(step -> sb.append(", ").append(step.accept(this)));
        return sb.append("]").toString();
    }

    @Override
    public String visitStrongWrap(Expr.StrongWrap wrap) {
        return "{" + wrap.inner().accept(this) + "}";
    }

    @Override
    public String visitBinaryOp(Expr.BinaryOp op) {
        return "(" + op.left().accept(this) + " " + op.operator().symbol() + " " + op.right().accept(this) + ")";
    }

    @Override
    public String visitCall(Expr.Call call) {
        return call.name() + call.args()
                                 .stream()
                                 .map(arg -> arg.accept(this))
                                 .collect(Collectors.joining(", ", "(", ")"));
    }
}
