package org.pragmatica.rollkit.error;

import org.pragmatica.rollkit.tree.BinaryOperator;

/**
 * Errors that abort an evaluation.
 */
public sealed interface EvalError {
    String message();

    record LengthMismatch(int leftLength, int rightLength) implements EvalError {
        @Override
        public String message() {
            return "List length mismatch: left has " + leftLength + " elements, right has " + rightLength + " elements";
        }
    }

    /**
     * A list literal element evaluated to a strong list.
     */
    record NonScalarListElement(int index) implements EvalError {
        @Override
        public String message() {
            return "List element " + index + " is a strong list, list literals hold integers";
        }
    }

    record InvalidStep() implements EvalError {
        @Override
        public String message() {
            return "Range step must not be zero";
        }
    }

    record StrongWrapOfScalar(long value) implements EvalError {
        @Override
        public String message() {
            return "Cannot make a strong list from the integer " + value;
        }
    }

    record NegativeDiceCount(long count) implements EvalError {
        @Override
        public String message() {
            return "Cannot roll " + count + " dice (must be non-negative)";
        }
    }

    record InvalidSides(long sides) implements EvalError {
        @Override
        public String message() {
            return "Cannot roll a die with " + sides + " sides (must be at least 1)";
        }
    }

    record EmptyFaceList() implements EvalError {
        @Override
        public String message() {
            return "Cannot roll a die with no faces";
        }
    }

    record ExpectedList(String found) implements EvalError {
        @Override
        public String message() {
            return "Expected a list, but got " + found;
        }
    }

    record ExpectedInteger(String found) implements EvalError {
        @Override
        public String message() {
            return "Expected an integer, but got " + found;
        }
    }

    /**
     * Keep/drop count outside {@code 0..available}.
     */
    record CountOutOfRange(BinaryOperator operator, long requested, int available) implements EvalError {
        @Override
        public String message() {
            var verb = operator == BinaryOperator.KEEP_HIGHEST || operator == BinaryOperator.KEEP_LOWEST
                       ? "keep"
                       : "drop";
            return "Cannot " + verb + " " + requested + " elements from a list of " + available + " elements";
        }
    }

    record ListTooLong(long requested, int limit) implements EvalError {
        @Override
        public String message() {
            return "List of " + requested + " elements exceeds the limit of " + limit;
        }
    }

    record UnknownFunction(String name) implements EvalError {
        @Override
        public String message() {
            return "Unknown function '" + name + "'";
        }
    }

    record ArityMismatch(String name, String expected, int actual) implements EvalError {
        @Override
        public String message() {
            return "Function '" + name + "' takes " + expected + " arguments, got " + actual;
        }
    }

    /**
     * Failure reported by a registered function.
     */
    record FunctionFailure(String name, String reason) implements EvalError {
        @Override
        public String message() {
            return "Function '" + name + "' failed: " + reason;
        }
    }
}
