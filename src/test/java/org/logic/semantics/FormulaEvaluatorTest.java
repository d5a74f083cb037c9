package org.logic.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.logic.syntax.Formula;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test per {@link FormulaEvaluator}.
 */
@DisplayName("FormulaEvaluator")
class FormulaEvaluatorTest {

    @Test
    @DisplayName("~(p&q76) nei due modelli di esempio")
    void testNegatedConjunction() {
        Formula formula = Formula.parse("~(p&q76)");

        assertTrue(FormulaEvaluator.evaluate(formula, new Model(Map.of("p", true, "q76", false))));
        assertFalse(FormulaEvaluator.evaluate(formula, new Model(Map.of("p", true, "q76", true))));
    }

    @ParameterizedTest(name = "{0} con p={1}, q={2} -> {3}")
    @CsvSource({
            "(p&q), false, false, false",
            "(p&q), true, false, false",
            "(p&q), true, true, true",
            "(p|q), false, false, false",
            "(p|q), false, true, true",
            "(p->q), false, false, true",
            "(p->q), false, true, true",
            "(p->q), true, false, false",
            "(p->q), true, true, true",
            "~p, true, false, false",
            "~~p, true, false, true",
            "(T&p), true, false, true",
            "(F|q), true, false, false"
    })
    @DisplayName("Tabelle di verità dei connettivi")
    void testConnectives(String input, boolean p, boolean q, boolean expected) {
        Model model = new Model(Map.of("p", p, "q", q));

        assertEquals(expected, FormulaEvaluator.evaluate(Formula.parse(input), model));
    }

    @Test
    @DisplayName("Costanti valutate nel modello vuoto")
    void testConstants() {
        assertTrue(FormulaEvaluator.evaluate(Formula.parse("T"), Model.EMPTY));
        assertFalse(FormulaEvaluator.evaluate(Formula.parse("F"), Model.EMPTY));
        assertTrue(FormulaEvaluator.evaluate(Formula.parse("(F->F)"), Model.EMPTY));
    }

    @Test
    @DisplayName("Variabili in eccesso nel modello ignorate")
    void testSupersetModel() {
        Model model = new Model(Map.of("p", true, "q", false, "r", true));

        assertTrue(FormulaEvaluator.evaluate(Formula.parse("(p->r)"), model));
    }

    @Test
    @DisplayName("Modello insufficiente rifiutato")
    void testInsufficientModel() {
        Model model = new Model(Map.of("p", true));

        assertThrows(IllegalArgumentException.class,
                () -> FormulaEvaluator.evaluate(Formula.parse("(p&q)"), model));
    }

    @Test
    @DisplayName("Valori di verità nell'ordine dei modelli")
    void testTruthValues() {
        List<Boolean> values = FormulaEvaluator.truthValues(Formula.parse("~(p&q76)"),
                ModelEnumerator.allModels(List.of("p", "q76")));

        assertEquals(List.of(true, true, true, false), values);
    }
}
