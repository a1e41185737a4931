package org.pragmatica.rollkit.eval;

import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;
import org.pragmatica.rollkit.tree.BinaryOperator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Keep/drop highest/lowest selection. Survivors are returned in their original order and keep the list kind.
 */
public final class KeepDrop {
    private KeepDrop() {}

    public static Value.ListValue apply(BinaryOperator operator, Value.ListValue list, long count) {
        if (count < 0 || count > list.size()) {
            throw new EvalException(new EvalError.CountOutOfRange(operator, count, list.size()));
        }

        var elements = list.elements();
        var order = new ArrayList<Integer>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            order.add(i);
        }

        // List.sort is stable, so equal values stay in index order
        Comparator<Integer> byValue = Comparator.comparing(elements::get);
        order.sort(highest(operator) ? byValue.reversed() : byValue);

        var selected = new boolean[elements.size()];
        var keep = operator == BinaryOperator.KEEP_HIGHEST || operator == BinaryOperator.KEEP_LOWEST;
        for (int rank = 0; rank < order.size(); rank++) {
            selected[order.get(rank)] = keep == (rank < count);
        }

        List<Long> survivors = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            if (selected[i]) {
                survivors.add(elements.get(i));
            }
        }
        return new Value.ListValue(list.kind(), survivors);
    }

    private static boolean highest(BinaryOperator operator) {
        return switch (operator) {
            case KEEP_HIGHEST, DROP_HIGHEST -> true;
            case KEEP_LOWEST, DROP_LOWEST -> false;
            default -> throw new IllegalArgumentException("Operator " + operator + " is not a keep/drop operator");
        };
    }
}
