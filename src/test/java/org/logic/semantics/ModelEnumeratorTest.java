package org.logic.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ModelEnumerator")
class ModelEnumeratorTest {

    @Test
    @DisplayName("Ordine lessicografico su [p, q]")
    void testOrderPQ() {
        List<Model> models = ModelEnumerator.allModels(List.of("p", "q"));

        assertEquals(List.of(
                new Model(Map.of("p", false, "q", false)),
                new Model(Map.of("p", false, "q", true)),
                new Model(Map.of("p", true, "q", false)),
                new Model(Map.of("p", true, "q", true))), models);
    }

    @Test
    @DisplayName("La prima variabile è la più significativa anche per [q, p]")
    void testOrderQP() {
        List<Model> models = ModelEnumerator.allModels(List.of("q", "p"));

        assertEquals(4, models.size());
        assertEquals(List.of("q", "p"), new ArrayList<>(models.get(0).variables()));
        assertFalse(models.get(1).valueOf("q"));
        assertTrue(models.get(1).valueOf("p"));
        assertTrue(models.get(2).valueOf("q"));
        assertFalse(models.get(2).valueOf("p"));
    }

    @Test
    @DisplayName("2^n modelli distinti")
    void testCountAndDistinctness() {
        List<Model> models = ModelEnumerator.allModels(List.of("p", "q", "r", "s1"));

        assertEquals(16, models.size());
        assertEquals(16, new HashSet<>(models).size());
        assertTrue(models.get(0).asMap().values().stream().noneMatch(Boolean::booleanValue));
        assertTrue(models.get(15).asMap().values().stream().allMatch(Boolean::booleanValue));
    }

    @Test
    @DisplayName("Nessuna variabile: enumerazione vuota")
    void testEmpty() {
        assertTrue(ModelEnumerator.allModels(List.of()).isEmpty());
    }

    @Test
    @DisplayName("Enumerazione ripercorribile e non modificabile")
    void testRestartable() {
        List<Model> models = ModelEnumerator.allModels(List.of("p"));

        assertEquals(models, new ArrayList<>(models));
        assertThrows(UnsupportedOperationException.class, () -> models.add(Model.EMPTY));
    }

    @Test
    @DisplayName("Nomi non validi, duplicati e liste troppo lunghe rifiutati")
    void testInvalidVariables() {
        assertThrows(IllegalArgumentException.class, () -> ModelEnumerator.allModels(List.of("p", "a")));
        assertThrows(IllegalArgumentException.class, () -> ModelEnumerator.allModels(List.of("p", "p")));
        assertThrows(IllegalArgumentException.class, () -> ModelEnumerator.allModels(null));

        List<String> tooMany = new ArrayList<>();
        for (int i = 0; i <= ModelEnumerator.MAX_VARIABLES; i++) {
            tooMany.add("x" + i);
        }
        assertThrows(IllegalArgumentException.class, () -> ModelEnumerator.allModels(tooMany));
    }
}
