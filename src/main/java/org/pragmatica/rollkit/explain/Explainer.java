package org.pragmatica.rollkit.explain;

import org.pragmatica.rollkit.eval.Ranges;
import org.pragmatica.rollkit.tree.Expr;
import org.pragmatica.rollkit.tree.ExprVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural dump of an expression tree, one line per node, indented two spaces per level.
 *
 * <p>Example for {@code 4d6kh3 + 2}:
 * <pre>
 * Binary Operation: + (Addition)
 *   Binary Operation: kh (Keep Highest)
 *     Binary Operation: d (Dice Roll)
 *       Literal: 4 (Integer)
 *       Literal: 6 (Integer)
 *     Literal: 3 (Integer)
 *   Literal: 2 (Integer)
 * </pre>
 * Nothing is evaluated.
 */
public final class Explainer implements ExprVisitor<Void> {
    private static final String INDENT = "  ";

    private final List<String> lines = new ArrayList<>();
    private int depth;

    private Explainer() {}

    public static String explain(Expr expr) {
        var explainer = new Explainer();
        expr.accept(explainer);
        return String.join("\n", explainer.lines);
    }

    @Override
    public Void visitIntegerLiteral(Expr.IntegerLiteral literal) {
        line("Literal: " + literal.value() + " (Integer)");
        return null;
    }

    @Override
    public Void visitExplicitList(Expr.ExplicitListLiteral list) {
        var size = list.elements().size();
        line("List Literal: " + list.formatInline() + " (List with " + size + " elements)");
        if (!list.elements().stream().allMatch(Expr.IntegerLiteral.class::isInstance)) {
            nested(() -> list.elements().forEach(element -> element.accept(this)));
        }
        return null;
    }

    @Override
    public Void visitRangeList(Expr.RangeListLiteral range) {
        var step = range.step().map(s -> isLiteral(s) ? value(s) : 0L).orElse(1L);
        if (isLiteral(range.start()) && isLiteral(range.end()) && step != 0) {
            var count = Ranges.describeCount(value(range.start()), value(range.end()), step);
            line("Range Literal: " + range.formatInline() + " (Range with " + count + " elements)");
            return null;
        }
        line("Range Literal:");
        nested(() -> {
            labelled("start:", range.start());
            labelled("end:", range.end());
            range.step().ifPresent(s -> labelled("step:", s));
        });
        return null;
    }

    @Override
    public Void visitStrongWrap(Expr.StrongWrap wrap) {
        line("Strong List:");
        nested(() -> wrap.inner().accept(this));
        return null;
    }

    @Override
    public Void visitBinaryOp(Expr.BinaryOp op) {
        line("Binary Operation: " + op.operator().symbol() + " (" + op.operator().description() + ")");
        nested(() -> {
            op.left().accept(this);
            op.right().accept(this);
        });
        return null;
    }

    @Override
    public Void visitCall(Expr.Call call) {
        var count = call.args().size();
        line("Function Call: " + call.name() + " (" + count + (count == 1 ? " arg)" : " args)"));
        nested(() -> call.args().forEach(arg -> arg.accept(this)));
        return null;
    }

    private void labelled(String label, Expr expr) {
        line(label);
        nested(() -> expr.accept(this));
    }

    private void nested(Runnable body) {
        depth++;
        body.run();
        depth--;
    }

    private void line(String text) {
        lines.add(INDENT.repeat(depth) + text);
    }

    private static boolean isLiteral(Expr expr) {
        return expr instanceof Expr.IntegerLiteral;
    }

    private static long value(Expr expr) {
        return ((Expr.IntegerLiteral) expr).value();
    }
}
