package org.pragmatica.rollkit.function;

import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;
import org.pragmatica.rollkit.eval.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Functions callable from expressions, looked up by exact, case-sensitive name.
 *
 * <p>Populate the registry before handing it to an evaluator; it is not synchronised.
 */
public final class FunctionRegistry {
    private static final Logger logger = LoggerFactory.getLogger(FunctionRegistry.class);
    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, Registration> functions = new LinkedHashMap<>();

    public record Registration(String name, Arity arity, RollFunction function) {}

    private FunctionRegistry() {}

    public static FunctionRegistry empty() {
        return new FunctionRegistry();
    }

    /**
     * Registry pre-populated with {@code sum}, {@code min}, {@code max}, {@code len}, {@code abs} and {@code sort}.
     */
    public static FunctionRegistry withBuiltins() {
        var registry = new FunctionRegistry();
        BuiltinFunctions.registerAll(registry);
        return registry;
    }

    /**
     * Register a function, replacing any function already registered under the same name.
     */
    public FunctionRegistry register(String name, Arity arity, RollFunction function) {
        if (!NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid function name '" + name + "'");
        }
        var previous = functions.put(name, new Registration(name, arity, function));
        if (previous != null) {
            logger.debug("Replaced function '{}'", name);
        } else {
            logger.debug("Registered function '{}' taking {} argument(s)", name, arity);
        }
        return this;
    }

    public Optional<Registration> lookup(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    public Set<String> names() {
        return Set.copyOf(functions.keySet());
    }

    /**
     * Look up and call a function.
     *
     * @throws EvalException for unknown names, wrong argument counts, or failures raised by the function itself
     */
    public Value invoke(String name, List<Value> args) {
        var registration = lookup(name).orElseThrow(() -> new EvalException(new EvalError.UnknownFunction(name)));
        if (!registration.arity().accepts(args.size())) {
            throw new EvalException(new EvalError.ArityMismatch(name, registration.arity().toString(), args.size()));
        }
        return registration.function().apply(List.copyOf(args));
    }
}
