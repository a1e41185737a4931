package org.pragmatica.rollkit.eval;

import java.util.List;

/**
 * Result of evaluating an expression: an integer or a typed list of integers.
 */
public sealed interface Value {

    /**
     * Name used in error messages.
     */
    String typeName();

    static IntegerValue integer(long value) {
        return new IntegerValue(value);
    }

    static ListValue normal(List<Long> elements) {
        return new ListValue(ListKind.NORMAL, elements);
    }

    static ListValue strong(List<Long> elements) {
        return new ListValue(ListKind.STRONG, elements);
    }

    record IntegerValue(long value) implements Value {
        @Override
        public String typeName() {
            return "integer " + value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record ListValue(ListKind kind, List<Long> elements) implements Value {
        public ListValue {
            elements = List.copyOf(elements);
        }

        public int size() {
            return elements.size();
        }

        public boolean isStrong() {
            return kind == ListKind.STRONG;
        }

        /**
         * Sum of the elements, wrapping on overflow like {@code long} arithmetic. Empty lists sum to zero.
         */
        public long sum() {
            long total = 0;
            for (long element : elements) {
                total += element;
            }
            return total;
        }

        public ListValue withKind(ListKind newKind) {
            return newKind == kind ? this : new ListValue(newKind, elements);
        }

        @Override
        public String typeName() {
            return isStrong() ? "a strong list" : "a list";
        }

        @Override
        public String toString() {
            var body = elements.toString();
            var inner = "{" + body.substring(1, body.length() - 1) + "}";
            return isStrong() ? "{" + inner + "}" : inner;
        }
    }
}
