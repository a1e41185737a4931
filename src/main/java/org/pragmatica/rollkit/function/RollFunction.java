package org.pragmatica.rollkit.function;

import org.pragmatica.rollkit.eval.Value;

import java.util.List;

/**
 * Functional interface for functions callable from expressions.
 */
@FunctionalInterface
public interface RollFunction {
    /**
     * Execute the function with already evaluated arguments.
     *
     * @param args argument values, in call order; the count has been checked against the registered arity
     * @return the computed value
     * @throws org.pragmatica.rollkit.error.EvalException to fail the evaluation
     */
    Value apply(List<Value> args);
}
