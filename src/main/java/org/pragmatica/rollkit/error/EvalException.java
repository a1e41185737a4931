package org.pragmatica.rollkit.error;

/**
 * Raised when evaluation of a parsed expression fails. No partial result is produced.
 */
public final class EvalException extends RollKitException {
    private final transient EvalError error;

    public EvalException(EvalError error) {
        super(error.message());
        this.error = error;
    }

    public EvalError error() {
        return error;
    }
}
