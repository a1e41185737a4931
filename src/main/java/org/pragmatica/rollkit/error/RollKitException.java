package org.pragmatica.rollkit.error;

/**
 * Base class of the failures raised while parsing or evaluating an expression.
 */
public abstract sealed class RollKitException extends RuntimeException permits ParseException, EvalException {
    protected RollKitException(String message) {
        super(message);
    }
}
