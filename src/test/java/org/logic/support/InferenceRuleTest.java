package org.logic.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.logic.syntax.Formula;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InferenceRule")
class InferenceRuleTest {

    @Test
    @DisplayName("Premesse ordinate, conclusione e variabili")
    void testStructure() {
        InferenceRule modusPonens = new InferenceRule(
                List.of(Formula.parse("p"), Formula.parse("(p->q)")), Formula.parse("q"));

        assertEquals(List.of(Formula.parse("p"), Formula.parse("(p->q)")), modusPonens.getAssumptions());
        assertEquals(Formula.parse("q"), modusPonens.getConclusion());
        assertEquals(Set.of("p", "q"), modusPonens.variables());
        assertEquals("[p, (p->q)] ==> q", modusPonens.toString());
    }

    @Test
    @DisplayName("Copia difensiva e uguaglianza sul contenuto")
    void testImmutabilityAndEquality() {
        List<Formula> assumptions = new ArrayList<>(List.of(Formula.parse("~r")));
        InferenceRule rule = new InferenceRule(assumptions, Formula.parse("(r->s)"));
        assumptions.add(Formula.parse("s"));

        assertEquals(1, rule.getAssumptions().size());
        assertThrows(UnsupportedOperationException.class, () -> rule.getAssumptions().add(Formula.parse("p")));
        assertEquals(new InferenceRule(List.of(Formula.parse("~r")), Formula.parse("(r->s)")), rule);
        assertEquals("[] ==> T", new InferenceRule(List.of(), Formula.parse("T")).toString());
    }

    @Test
    @DisplayName("Premesse o conclusione mancanti rifiutate")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new InferenceRule(null, Formula.parse("p")));
        assertThrows(IllegalArgumentException.class, () -> new InferenceRule(List.of(), null));

        List<Formula> withNull = new ArrayList<>();
        withNull.add(null);
        assertThrows(IllegalArgumentException.class, () -> new InferenceRule(withNull, Formula.parse("p")));
    }
}
