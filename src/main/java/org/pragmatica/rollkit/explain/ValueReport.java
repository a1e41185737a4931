package org.pragmatica.rollkit.explain;

import org.pragmatica.rollkit.eval.Value;

import java.util.stream.Collectors;

/**
 * Final presentation of an evaluation result: integers as themselves, lists as their sum followed by the
 * elements, e.g. {@code 11 (from list with 3 elements: {2, 4, 5})}.
 */
public final class ValueReport {
    private ValueReport() {}

    public static String render(Value value) {
        if (value instanceof Value.IntegerValue integer) {
            return Long.toString(integer.value());
        }
        var list = (Value.ListValue) value;
        var elements = list.elements()
                           .stream()
                           .map(String::valueOf)
                           .collect(Collectors.joining(", ", "{", "}"));
        return list.sum() + " (from " + (list.isStrong() ? "strong list" : "list") + " with " + list.size()
               + " elements: " + elements + ")";
    }
}
