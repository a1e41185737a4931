package org.pragmatica.rollkit.explain;

import org.junit.jupiter.api.Test;
import org.pragmatica.rollkit.parser.ExpressionParser;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExplainerTest {

    @Test
    void explain_diceWithKeepAndModifier() {
        var expected = String.join("\n",
                                   "Binary Operation: + (Addition)",
                                   "  Binary Operation: kh (Keep Highest)",
                                   "    Binary Operation: d (Dice Roll)",
                                   "      Literal: 4 (Integer)",
                                   "      Literal: 6 (Integer)",
                                   "    Literal: 3 (Integer)",
                                   "  Literal: 2 (Integer)");

        assertEquals(expected, explain("4d6kh3 + 2"));
    }

    @Test
    void explain_literalList_isOneLine() {
        assertEquals("List Literal: {1, 2, 3} (List with 3 elements)", explain("{1, 2, 3}"));
    }

    @Test
    void explain_listWithComputedElements_listsChildren() {
        var expected = String.join("\n",
                                   "List Literal: {1, (2 + 3)} (List with 2 elements)",
                                   "  Literal: 1 (Integer)",
                                   "  Binary Operation: + (Addition)",
                                   "    Literal: 2 (Integer)",
                                   "    Literal: 3 (Integer)");

        assertEquals(expected, explain("{1, 2 + 3}"));
    }

    @Test
    void explain_literalRange_showsElementCount() {
        assertEquals("Range Literal: [1, 10, 2] (Range with 5 elements)", explain("[1, 10, 2]"));
        assertEquals("Range Literal: [10, 5] (Range with 6 elements)", explain("[10, 5]"));
    }

    @Test
    void explain_computedRange_labelsParts() {
        var expected = String.join("\n",
                                   "Range Literal:",
                                   "  start:",
                                   "    Literal: 1 (Integer)",
                                   "  end:",
                                   "    Binary Operation: d (Dice Roll)",
                                   "      Literal: 1 (Integer)",
                                   "      Literal: 20 (Integer)");

        assertEquals(expected, explain("[1, 1d20]"));
    }

    @Test
    void explain_computedStep_labelsStep() {
        var expected = String.join("\n",
                                   "Range Literal:",
                                   "  start:",
                                   "    Literal: 1 (Integer)",
                                   "  end:",
                                   "    Literal: 10 (Integer)",
                                   "  step:",
                                   "    Binary Operation: d (Dice Roll)",
                                   "      Literal: 1 (Integer)",
                                   "      Literal: 4 (Integer)");

        assertEquals(expected, explain("[1, 10, 1d4]"));
    }

    @Test
    void explain_strongWrapAndCall() {
        var expected = String.join("\n",
                                   "Function Call: max (1 arg)",
                                   "  Strong List:",
                                   "    Binary Operation: d (Dice Roll)",
                                   "      Literal: 3 (Integer)",
                                   "      Literal: 6 (Integer)");

        assertEquals(expected, explain("max({3d6})"));
        assertEquals("Function Call: sum (0 args)", explain("sum()"));
    }

    @Test
    void explain_isDeterministic() {
        var expr = ExpressionParser.parse("10d20dl2 + {[1, 2d4]}");

        assertEquals(Explainer.explain(expr), Explainer.explain(expr));
    }

    private static String explain(String text) {
        return Explainer.explain(ExpressionParser.parse(text));
    }
}
