package org.logic.synthesis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.logic.semantics.FormulaClassifier;
import org.logic.semantics.FormulaEvaluator;
import org.logic.semantics.Model;
import org.logic.semantics.ModelEnumerator;
import org.logic.syntax.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test per {@link NormalFormSynthesizer}: ogni formula sintetizzata deve riprodurre
 * la tabella di verità di partenza.
 */
@DisplayName("NormalFormSynthesizer")
class NormalFormSynthesizerTest {

    private static final List<String> PQ = List.of("p", "q");

    @Nested
    @DisplayName("Forma normale disgiuntiva")
    class Dnf {

        @Test
        @DisplayName("[T, T, T, F] su [p, q]")
        void testExample() {
            List<Boolean> values = List.of(true, true, true, false);

            Formula formula = NormalFormSynthesizer.synthesize(PQ, values);

            assertEquals(values, FormulaEvaluator.truthValues(formula, ModelEnumerator.allModels(PQ)));
            assertEquals("(((~p&~q)|(~p&q))|(p&~q))", formula.toString());
        }

        @Test
        @DisplayName("Tabella tutta falsa: contraddizione su tutte le variabili")
        void testAllFalse() {
            Formula formula = NormalFormSynthesizer.synthesize(PQ, List.of(false, false, false, false));

            assertEquals("((p&~p)&(q&~q))", formula.toString());
            assertEquals(Set.of("p", "q"), formula.variables());
            assertTrue(FormulaClassifier.isContradiction(formula));
        }

        @Test
        @DisplayName("Clausola vera nel solo modello dato")
        void testClauseForModel() {
            Formula clause = NormalFormSynthesizer.synthesizeForModel(ModelEnumerator.allModels(List.of("q", "p")).get(1));

            assertEquals("(~q&p)", clause.toString());
            assertThrows(IllegalArgumentException.class, () -> NormalFormSynthesizer.synthesizeForModel(Model.EMPTY));
        }
    }

    @Nested
    @DisplayName("Forma normale congiuntiva")
    class Cnf {

        @Test
        @DisplayName("[T, T, T, F] su [p, q]")
        void testExample() {
            List<Boolean> values = List.of(true, true, true, false);

            Formula formula = NormalFormSynthesizer.synthesizeCnf(PQ, values);

            assertEquals(values, FormulaEvaluator.truthValues(formula, ModelEnumerator.allModels(PQ)));
            assertEquals("(~p|~q)", formula.toString());
        }

        @Test
        @DisplayName("Tabella tutta vera: tautologia su tutte le variabili")
        void testAllTrue() {
            Formula formula = NormalFormSynthesizer.synthesizeCnf(PQ, List.of(true, true, true, true));

            assertEquals("((p|~p)&(q|~q))", formula.toString());
            assertTrue(FormulaClassifier.isTautology(formula));
        }

        @Test
        @DisplayName("Clausole congiunte in ordine di indice")
        void testClauseOrder() {
            Formula formula = NormalFormSynthesizer.synthesizeCnf(PQ, List.of(false, true, true, false));

            assertEquals("((p|q)&(~p|~q))", formula.toString());
        }

        @Test
        @DisplayName("Clausola falsa nel solo modello dato")
        void testClauseForAllExceptModel() {
            Model model = new Model(Map.of("x1", true));

            assertEquals("~x1", NormalFormSynthesizer.synthesizeForAllExceptModel(model).toString());
        }
    }

    @ParameterizedTest(name = "{0} variabili")
    @ValueSource(ints = {1, 2, 3})
    @DisplayName("Entrambe le forme riproducono ogni tabella di verità")
    void testEveryTruthTable(int variableCount) {
        List<String> variables = List.of("p", "q", "r").subList(0, variableCount);
        List<Model> models = ModelEnumerator.allModels(variables);
        int rows = models.size();

        for (int table = 0; table < (1 << rows); table++) {
            List<Boolean> values = new ArrayList<>();
            for (int row = 0; row < rows; row++) {
                values.add(((table >> row) & 1) == 1);
            }

            assertEquals(values, FormulaEvaluator.truthValues(
                    NormalFormSynthesizer.synthesize(variables, values), models));
            assertEquals(values, FormulaEvaluator.truthValues(
                    NormalFormSynthesizer.synthesizeCnf(variables, values), models));
        }
    }

    @Test
    @DisplayName("Precondizioni violate rifiutate")
    void testInvalidTables() {
        assertThrows(IllegalArgumentException.class,
                () -> NormalFormSynthesizer.synthesize(List.of(), List.of(true)));
        assertThrows(IllegalArgumentException.class,
                () -> NormalFormSynthesizer.synthesize(PQ, List.of(true, false)));
        assertThrows(IllegalArgumentException.class,
                () -> NormalFormSynthesizer.synthesizeCnf(PQ, List.of(true, false, true)));

        List<Boolean> withNull = new ArrayList<>(List.of(true, true, true));
        withNull.add(null);
        assertThrows(IllegalArgumentException.class, () -> NormalFormSynthesizer.synthesizeCnf(PQ, withNull));
    }
}
