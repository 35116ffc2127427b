package org.edgecon.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class FormulaContextTest {

    @Test
    void declaringTheSameNameTwiceReturnsTheSameNode() {
        FormulaContext context = new FormulaContext();
        Formula first = context.declareBoolVariable("p_[1,0]");
        Formula second = context.declareBoolVariable("p_[1,0]");

        assertSame(first, second);
        assertEquals(1, context.getVariableCount());
        assertTrue(context.isDeclared("p_[1,0]"));
        assertFalse(context.isDeclared("p_[0,1]"));
    }

    @Test
    void emptyConnectivesAreRejected() {
        FormulaContext context = new FormulaContext();

        assertThrows(IllegalArgumentException.class, () -> context.and(List.of()));
        assertThrows(IllegalArgumentException.class, () -> context.or(List.of()));
        assertThrows(IllegalArgumentException.class, () -> context.declareBoolVariable(" "));
    }

    @Test
    void singleOperandIsReturnedUnwrapped() {
        FormulaContext context = new FormulaContext();
        Formula a = context.declareBoolVariable("a");

        assertSame(a, context.and(a));
        assertSame(a, context.or(List.of(a)));
    }

    @Test
    void evaluationFollowsTheConnectives() {
        FormulaContext context = new FormulaContext();
        Formula a = context.declareBoolVariable("a");
        Formula b = context.declareBoolVariable("b");
        Formula formula = context.and(context.or(a, context.not(b)), context.mkTrue());

        Map<String, Boolean> values = Map.of("a", false, "b", true);
        Model model = name -> values.getOrDefault(name, false);

        assertFalse(formula.evaluate(model));
        assertTrue(formula.evaluate(name -> name.equals("a")));
        assertFalse(context.mkFalse().evaluate(name -> true));
        assertEquals("((a | !b) & TRUE)", formula.toString());
    }

    @Test
    void modelRejectsNonVariableFormulas() {
        FormulaContext context = new FormulaContext();
        Formula negated = context.not(context.declareBoolVariable("a"));
        Model model = name -> true;

        assertThrows(IllegalArgumentException.class, () -> model.valueOf(negated));
        assertTrue(model.valueOf(context.declareBoolVariable("a")));
    }
}
