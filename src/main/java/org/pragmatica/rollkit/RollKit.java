package org.pragmatica.rollkit;

import org.pragmatica.rollkit.eval.EvalConfig;
import org.pragmatica.rollkit.eval.Evaluator;
import org.pragmatica.rollkit.eval.RandomSource;
import org.pragmatica.rollkit.eval.Value;
import org.pragmatica.rollkit.explain.Explainer;
import org.pragmatica.rollkit.explain.ValueReport;
import org.pragmatica.rollkit.function.FunctionRegistry;
import org.pragmatica.rollkit.parser.ExpressionParser;
import org.pragmatica.rollkit.tree.Expr;

/**
 * Entry point for parsing and rolling dice expressions.
 *
 * <p>Example usage:
 * <pre>{@code
 * var expr = RollKit.parse("4d6kh3 + 2");
 * var value = RollKit.evalWith(expr, RandomSource.seeded(42));
 *
 * System.out.println(RollKit.report(value));
 * System.out.println(RollKit.explain(expr));
 * }</pre>
 */
public final class RollKit {
    private RollKit() {}

    /**
     * Parse expression text.
     *
     * @throws org.pragmatica.rollkit.error.ParseException if the text is not a well-formed expression
     */
    public static Expr parse(String text) {
        return ExpressionParser.parse(text);
    }

    /**
     * Evaluate with the built-in functions and a fresh, unseeded random source.
     *
     * @throws org.pragmatica.rollkit.error.EvalException if evaluation fails
     */
    public static Value eval(Expr expr) {
        return DefaultEvaluator.INSTANCE.eval(expr);
    }

    /**
     * Evaluate with the built-in functions and the given random source.
     *
     * @throws org.pragmatica.rollkit.error.EvalException if evaluation fails
     */
    public static Value evalWith(Expr expr, RandomSource random) {
        return DefaultEvaluator.INSTANCE.evalWith(expr, random);
    }

    /**
     * Describe the structure of a parsed expression without evaluating it.
     */
    public static String explain(Expr expr) {
        return Explainer.explain(expr);
    }

    /**
     * Render an evaluation result for display.
     */
    public static String report(Value value) {
        return ValueReport.render(value);
    }

    /**
     * Functions used by {@link #eval(Expr)} and {@link #evalWith(Expr, RandomSource)}. Extra functions registered
     * here become callable from expressions; register them before evaluating anything.
     */
    public static FunctionRegistry functions() {
        return DefaultEvaluator.INSTANCE.functions();
    }

    /**
     * Create a builder for an evaluator with custom functions or limits.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FunctionRegistry functions;
        private EvalConfig config = EvalConfig.DEFAULT;

        private Builder() {}

        public Builder functions(FunctionRegistry functions) {
            this.functions = functions;
            return this;
        }

        public Builder config(EvalConfig config) {
            this.config = config;
            return this;
        }

        public Builder maxListLength(int maxListLength) {
            this.config = config.withMaxListLength(maxListLength);
            return this;
        }

        public Evaluator build() {
            var registry = functions != null ? functions : FunctionRegistry.withBuiltins();
            return Evaluator.create(registry, config);
        }
    }

    // built on first use
    private static final class DefaultEvaluator {
        private static final Evaluator INSTANCE = Evaluator.create(FunctionRegistry.withBuiltins(), EvalConfig.DEFAULT);
    }
}
