package org.logic.semantics;

import org.logic.syntax.FormulaSymbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * ENUMERATORE DI MODELLI - Tutti gli assegnamenti totali su una lista di variabili
 *
 * ORDINE DI ENUMERAZIONE:
 * • Contatore binario crescente, falso &lt; vero
 * • La prima variabile della lista è il bit più significativo
 * • Per [p, q]: {p=F,q=F}, {p=F,q=T}, {p=T,q=F}, {p=T,q=T}
 *
 * L'enumerazione è calcolata per intero e restituita come lista non modificabile,
 * quindi può essere percorsa più volte.
 */
public final class ModelEnumerator {

    private static final Logger LOGGER = Logger.getLogger(ModelEnumerator.class.getName());

    //region CONFIGURAZIONE

    /**
     * Numero massimo di variabili enumerabili: 2^30 modelli è il limite
     * rappresentabile come dimensione di una lista.
     */
    public static final int MAX_VARIABLES = 30;

    /**
     * Previene istanziazione - classe utility
     * */
    private ModelEnumerator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region ENUMERAZIONE

    /**
     * Calcola tutti i modelli sulle variabili date, in ordine lessicografico.
     *
     * @param variables nomi di variabile distinti, nell'ordine di significatività
     * @return lista non modificabile di 2^n modelli (vuota se non ci sono variabili)
     * @throws IllegalArgumentException se la lista è null, contiene nomi non validi o
     *         duplicati, o supera {@link #MAX_VARIABLES}
     */
    public static List<Model> allModels(List<String> variables) {
        validateVariables(variables);

        if (variables.isEmpty()) {
            return Collections.emptyList();
        }

        int variableCount = variables.size();
        int modelCount = 1 << variableCount;
        List<Model> models = new ArrayList<>(modelCount);

        for (int index = 0; index < modelCount; index++) {
            Map<String, Boolean> assignment = new LinkedHashMap<>();
            for (int position = 0; position < variableCount; position++) {
                int bit = variableCount - 1 - position;
                assignment.put(variables.get(position), ((index >> bit) & 1) == 1);
            }
            models.add(new Model(assignment));
        }

        LOGGER.fine(() -> "Enumerati " + modelCount + " modelli su " + variables);
        return Collections.unmodifiableList(models);
    }

    private static void validateVariables(List<String> variables) {
        if (variables == null) {
            throw new IllegalArgumentException("Lista di variabili non può essere null");
        }
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException("Troppe variabili da enumerare: " + variables.size()
                    + " (massimo " + MAX_VARIABLES + ")");
        }

        Set<String> seen = new HashSet<>();
        for (String variable : variables) {
            if (!FormulaSymbols.isVariable(variable)) {
                throw new IllegalArgumentException("Nome di variabile non valido: " + variable);
            }
            if (!seen.add(variable)) {
                throw new IllegalArgumentException("Variabile duplicata: " + variable);
            }
        }
    }

    //endregion
}
