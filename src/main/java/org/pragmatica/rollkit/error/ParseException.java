package org.pragmatica.rollkit.error;

/**
 * Raised when expression text cannot be tokenized or parsed.
 */
public final class ParseException extends RollKitException {
    private final transient ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseError error() {
        return error;
    }

    /**
     * Diagnostic pointing at the offending part of the source.
     */
    public Diagnostic diagnostic() {
        return Diagnostic.of(error);
    }
}
