package org.pragmatica.rollkit.eval;

import org.junit.jupiter.api.Test;
import org.pragmatica.rollkit.error.EvalError;
import org.pragmatica.rollkit.error.EvalException;
import org.pragmatica.rollkit.tree.BinaryOperator;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeepDropTest {

    private static final Value.ListValue ROLLS = Value.normal(List.of(3L, 6L, 1L, 5L));

    @Test
    void keepHighest_keepsOriginalOrder() {
        assertThat(KeepDrop.apply(BinaryOperator.KEEP_HIGHEST, ROLLS, 3).elements()).containsExactly(3L, 6L, 5L);
    }

    @Test
    void keepLowest_keepsOriginalOrder() {
        assertThat(KeepDrop.apply(BinaryOperator.KEEP_LOWEST, ROLLS, 2).elements()).containsExactly(3L, 1L);
    }

    @Test
    void dropHighest_removesTopElements() {
        assertThat(KeepDrop.apply(BinaryOperator.DROP_HIGHEST, ROLLS, 1).elements()).containsExactly(3L, 1L, 5L);
    }

    @Test
    void dropLowest_removesBottomElements() {
        assertThat(KeepDrop.apply(BinaryOperator.DROP_LOWEST, ROLLS, 1).elements()).containsExactly(3L, 6L, 5L);
    }

    @Test
    void ties_areBrokenByIndex() {
        var tied = Value.normal(List.of(4L, 2L, 4L, 4L));

        assertThat(KeepDrop.apply(BinaryOperator.KEEP_HIGHEST, tied, 2).elements()).containsExactly(4L, 4L);
        assertThat(KeepDrop.apply(BinaryOperator.DROP_HIGHEST, tied, 2).elements()).containsExactly(2L, 4L);
    }

    @Test
    void boundaryCounts_areAllowed() {
        assertThat(KeepDrop.apply(BinaryOperator.KEEP_HIGHEST, ROLLS, 0).elements()).isEmpty();
        assertThat(KeepDrop.apply(BinaryOperator.DROP_LOWEST, ROLLS, 4).elements()).isEmpty();
        assertThat(KeepDrop.apply(BinaryOperator.KEEP_LOWEST, ROLLS, 4).elements()).containsExactly(3L, 6L, 1L, 5L);
    }

    @Test
    void strongList_staysStrong() {
        var strong = ROLLS.withKind(ListKind.STRONG);

        assertThat(KeepDrop.apply(BinaryOperator.KEEP_HIGHEST, strong, 2).kind()).isEqualTo(ListKind.STRONG);
        assertThat(KeepDrop.apply(BinaryOperator.KEEP_HIGHEST, ROLLS, 2).kind()).isEqualTo(ListKind.NORMAL);
    }

    @Test
    void countOutsideList_fails() {
        assertThatThrownBy(() -> KeepDrop.apply(BinaryOperator.KEEP_HIGHEST, ROLLS, 5))
            .isInstanceOf(EvalException.class)
            .extracting(e -> ((EvalException) e).error())
            .isEqualTo(new EvalError.CountOutOfRange(BinaryOperator.KEEP_HIGHEST, 5, 4));

        assertThatThrownBy(() -> KeepDrop.apply(BinaryOperator.DROP_LOWEST, ROLLS, -1))
            .isInstanceOf(EvalException.class)
            .hasMessage("Cannot drop -1 elements from a list of 4 elements");
    }
}
