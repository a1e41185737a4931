package org.pragmatica.rollkit.function;

import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;
import org.pragmatica.rollkit.eval.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Functions registered by {@link FunctionRegistry#withBuiltins()}.
 *
 * <p>Aggregates ({@code sum}, {@code min}, {@code max}, {@code len}) look at every element of every argument,
 * an integer argument counting as a single element.
 */
final class BuiltinFunctions {
    private BuiltinFunctions() {}

    static void registerAll(FunctionRegistry registry) {
        registry.register("sum", Arity.atLeast(0), BuiltinFunctions::sum)
                .register("min", Arity.atLeast(1), args -> extreme("min", args, false))
                .register("max", Arity.atLeast(1), args -> extreme("max", args, true))
                .register("len", Arity.atLeast(0), args -> Value.integer(elements(args).size()))
                .register("abs", Arity.exactly(1), BuiltinFunctions::abs)
                .register("sort", Arity.exactly(1), BuiltinFunctions::sort);
    }

    private static Value sum(List<Value> args) {
        long total = 0;
        for (long element : elements(args)) {
            total += element;
        }
        return Value.integer(total);
    }

    private static Value extreme(String name, List<Value> args, boolean largest) {
        var elements = elements(args);
        if (elements.isEmpty()) {
            throw new EvalException(new EvalError.FunctionFailure(name, "no elements to choose from"));
        }
        long result = elements.get(0);
        for (long element : elements) {
            result = largest ? Math.max(result, element) : Math.min(result, element);
        }
        return Value.integer(result);
    }

    private static Value abs(List<Value> args) {
        var arg = args.get(0);
        if (arg instanceof Value.IntegerValue integer) {
            return Value.integer(absolute(integer.value()));
        }
        var list = (Value.ListValue) arg;
        var result = new ArrayList<Long>(list.size());
        for (long element : list.elements()) {
            result.add(absolute(element));
        }
        return new Value.ListValue(list.kind(), result);
    }

    private static long absolute(long value) {
        try {
            return Math.absExact(value);
        } catch (ArithmeticException e) {
            throw new EvalException(new EvalError.FunctionFailure("abs", "absolute value of " + value
                                                                         + " does not fit in 64 bits"));
        }
    }

    private static Value sort(List<Value> args) {
        if (!(args.get(0) instanceof Value.ListValue list)) {
            throw new EvalException(new EvalError.ExpectedList(args.get(0).typeName()));
        }
        var sorted = new ArrayList<>(list.elements());
        sorted.sort(null);
        return new Value.ListValue(list.kind(), sorted);
    }

    private static List<Long> elements(List<Value> args) {
        var result = new ArrayList<Long>();
        for (var arg : args) {
            if (arg instanceof Value.IntegerValue integer) {
                result.add(integer.value());
            } else {
                result.addAll(((Value.ListValue) arg).elements());
            }
        }
        return result;
    }
}
