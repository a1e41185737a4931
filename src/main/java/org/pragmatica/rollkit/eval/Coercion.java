package org.pragmatica.rollkit.eval;

import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;
import org.pragmatica.rollkit.tree.BinaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Combination rules for arithmetic and comparison operators.
 *
 * <p>Normal lists are reduced to their sum first. Two scalars give a scalar; a strong list and a scalar give a
 * strong list with the operator applied to every element; two strong lists are combined index by index and must
 * have the same length. Comparisons produce 1 for true and 0 for false.
 */
public final class Coercion {
    private Coercion() {}

    public static Value combine(BinaryOperator operator, Value left, Value right) {
        var l = reduceNormal(left);
        var r = reduceNormal(right);

        if (l instanceof Value.IntegerValue li && r instanceof Value.IntegerValue ri) {
            return Value.integer(apply(operator, li.value(), ri.value()));
        }
        if (l instanceof Value.ListValue list && r instanceof Value.IntegerValue scalar) {
            return broadcast(list, element -> apply(operator, element, scalar.value()));
        }
        if (l instanceof Value.IntegerValue scalar && r instanceof Value.ListValue list) {
            return broadcast(list, element -> apply(operator, scalar.value(), element));
        }
        return pairwise(operator, (Value.ListValue) l, (Value.ListValue) r);
    }

    /**
     * Integer view of a value for places that need a scalar: normal lists are summed, strong lists are rejected.
     */
    public static long requireInteger(Value value) {
        if (value instanceof Value.IntegerValue integer) {
            return integer.value();
        }
        var list = (Value.ListValue) value;
        if (list.isStrong()) {
            throw new EvalException(new EvalError.ExpectedInteger(list.typeName()));
        }
        return list.sum();
    }

    public static long apply(BinaryOperator operator, long l, long r) {
        return switch (operator) {
            case MULTIPLICATION -> l * r;
            case ADDITION -> l + r;
            case SUBTRACTION -> l - r;
            case EQUAL -> flag(l == r);
            case NOT_EQUAL -> flag(l != r);
            case LESS_THAN -> flag(l < r);
            case LESS_EQUAL -> flag(l <= r);
            case GREATER_THAN -> flag(l > r);
            case GREATER_EQUAL -> flag(l >= r);
            default -> throw new IllegalArgumentException("Operator " + operator + " does not combine values");
        };
    }

    private static Value reduceNormal(Value value) {
        if (value instanceof Value.ListValue list && !list.isStrong()) {
            return Value.integer(list.sum());
        }
        return value;
    }

    private static Value broadcast(Value.ListValue list, LongOperator operator) {
        var result = new ArrayList<Long>(list.size());
        for (long element : list.elements()) {
            result.add(operator.apply(element));
        }
        return Value.strong(result);
    }

    private static Value pairwise(BinaryOperator operator, Value.ListValue left, Value.ListValue right) {
        if (left.size() != right.size()) {
            throw new EvalException(new EvalError.LengthMismatch(left.size(), right.size()));
        }
        List<Long> leftElements = left.elements();
        List<Long> rightElements = right.elements();
        var result = new ArrayList<Long>(left.size());
        for (int i = 0; i < leftElements.size(); i++) {
            result.add(apply(operator, leftElements.get(i), rightElements.get(i)));
        }
        return Value.strong(result);
    }

    private static long flag(boolean condition) {
        return condition ? 1 : 0;
    }

    @FunctionalInterface
    private interface LongOperator {
        long apply(long element);
    }
}
