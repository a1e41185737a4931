package org.pragmatica.rollkit.eval;

import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;
import org.pragmatica.rollkit.function.FunctionRegistry;
import org.pragmatica.rollkit.tree.BinaryOperator;
import org.pragmatica.rollkit.tree.Expr;
import org.pragmatica.rollkit.tree.ExprVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree-walking evaluator. Operands are evaluated left before right and dice are drawn one at a time in order,
 * so a seeded {@link RandomSource} always yields the same result for the same expression.
 */
public final class Evaluator {
    private static final Logger logger = LoggerFactory.getLogger(Evaluator.class);

    private final FunctionRegistry functions;
    private final EvalConfig config;

    private Evaluator(FunctionRegistry functions, EvalConfig config) {
        this.functions = functions;
        this.config = config;
    }

    public static Evaluator create(FunctionRegistry functions, EvalConfig config) {
        logger.debug("Creating evaluator with {} function(s), max list length {}",
                     functions.names().size(), config.maxListLength());
        return new Evaluator(functions, config);
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public EvalConfig config() {
        return config;
    }

    /**
     * Evaluate with a fresh, unseeded random source.
     */
    public Value eval(Expr expr) {
        return evalWith(expr, RandomSource.system());
    }

    /**
     * Evaluate with a caller-owned random source.
     *
     * @throws EvalException when any step of the evaluation fails
     */
    public Value evalWith(Expr expr, RandomSource random) {
        return expr.accept(new Walker(random));
    }

    private final class Walker implements ExprVisitor<Value> {
        private final RandomSource random;

        private Walker(RandomSource random) {
            this.random = random;
        }

        @Override
        public Value visitIntegerLiteral(Expr.IntegerLiteral literal) {
            return Value.integer(literal.value());
        }

        @Override
        public Value visitExplicitList(Expr.ExplicitListLiteral list) {
            var elements = new ArrayList<Long>(list.elements().size());
            for (int i = 0; i < list.elements().size(); i++) {
                var value = list.elements().get(i).accept(this);
                if (value instanceof Value.ListValue nested && nested.isStrong()) {
                    throw new EvalException(new EvalError.NonScalarListElement(i));
                }
                elements.add(Coercion.requireInteger(value));
            }
            return Value.normal(elements);
        }

        @Override
        public Value visitRangeList(Expr.RangeListLiteral range) {
            var start = Coercion.requireInteger(range.start().accept(this));
            var end = Coercion.requireInteger(range.end().accept(this));
            long step = 1;
            if (range.step().isPresent()) {
                step = Coercion.requireInteger(range.step().get().accept(this));
            }
            return Value.normal(Ranges.elements(start, end, step, config.maxListLength()));
        }

        @Override
        public Value visitStrongWrap(Expr.StrongWrap wrap) {
            var inner = wrap.inner().accept(this);
            if (inner instanceof Value.IntegerValue integer) {
                throw new EvalException(new EvalError.StrongWrapOfScalar(integer.value()));
            }
            return ((Value.ListValue) inner).withKind(ListKind.STRONG);
        }

        @Override
        public Value visitBinaryOp(Expr.BinaryOp op) {
            var left = op.left().accept(this);
            var right = op.right().accept(this);
            var operator = op.operator();

            if (operator == BinaryOperator.DICE_ROLL) {
                return roll(left, right);
            }
            if (operator.isKeepDrop()) {
                if (!(left instanceof Value.ListValue list)) {
                    throw new EvalException(new EvalError.ExpectedList(left.typeName()));
                }
                return KeepDrop.apply(operator, list, Coercion.requireInteger(right));
            }
            return Coercion.combine(operator, left, right);
        }

        @Override
        public Value visitCall(Expr.Call call) {
            var args = new ArrayList<Value>(call.args().size());
            for (var arg : call.args()) {
                args.add(arg.accept(this));
            }
            return functions.invoke(call.name(), args);
        }

        private Value roll(Value left, Value right) {
            var count = Coercion.requireInteger(left);
            if (count < 0) {
                throw new EvalException(new EvalError.NegativeDiceCount(count));
            }
            if (count > config.maxListLength()) {
                throw new EvalException(new EvalError.ListTooLong(count, config.maxListLength()));
            }

            if (right instanceof Value.IntegerValue sides) {
                if (sides.value() < 1) {
                    throw new EvalException(new EvalError.InvalidSides(sides.value()));
                }
                return draw((int) count, () -> random.nextLong(1, sides.value()));
            }

            List<Long> faces = ((Value.ListValue) right).elements();
            if (faces.isEmpty()) {
                throw new EvalException(new EvalError.EmptyFaceList());
            }
            return draw((int) count, () -> faces.get((int) random.nextLong(0, faces.size() - 1)));
        }

        private Value draw(int count, Die die) {
            var rolls = new ArrayList<Long>(count);
            for (int i = 0; i < count; i++) {
                rolls.add(die.roll());
            }
            logger.trace("Rolled {}", rolls);
            return Value.normal(rolls);
        }
    }

    @FunctionalInterface
    private interface Die {
        long roll();
    }
}
