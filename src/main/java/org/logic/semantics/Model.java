package org.logic.semantics;

import org.logic.syntax.Formula;
import org.logic.syntax.FormulaSymbols;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * MODELLO - Assegnamento immutabile di valori di verità a nomi di variabile
 *
 * Associa a un insieme finito di variabili un valore booleano ciascuna, preservando
 * l'ordine di inserimento (che per i modelli enumerati coincide con l'ordine delle
 * variabili richiesto).
 *
 * INVARIANTI:
 * • Ogni chiave è un nome di variabile valido (p, q76, ...)
 * • Nessun valore null: l'assegnamento è totale sulle proprie variabili
 * • Contenuto immutabile dopo la costruzione
 *
 * Un modello è sufficiente per una formula se ne contiene tutte le variabili.
 */
public final class Model {

    /** Modello senza variabili, sufficiente per le sole formule prive di variabili */
    public static final Model EMPTY = new Model(Collections.emptyMap());

    private final Map<String, Boolean> assignment;

    //region COSTRUZIONE E VALIDAZIONE

    /**
     * Costruisce un modello validando chiavi e valori.
     *
     * @param assignment mappa variabile → valore (copiata, ordine preservato)
     * @throws IllegalArgumentException se la mappa è null, contiene chiavi che non sono
     *         variabili o valori null
     */
    public Model(Map<String, Boolean> assignment) {
        if (assignment == null) {
            throw new IllegalArgumentException("Assegnamento non può essere null");
        }
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            if (!FormulaSymbols.isVariable(entry.getKey())) {
                throw new IllegalArgumentException("Chiave del modello non è una variabile: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Valore null per la variabile " + entry.getKey());
            }
        }

        this.assignment = Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
    }

    /**
     * Verifica se una mappa arbitraria è un modello valido.
     *
     * @return true se ogni chiave è un nome di variabile e nessun valore è null
     */
    public static boolean isModel(Map<String, Boolean> assignment) {
        if (assignment == null) {
            return false;
        }
        for (Map.Entry<String, Boolean> entry : assignment.entrySet()) {
            if (!FormulaSymbols.isVariable(entry.getKey()) || entry.getValue() == null) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return variabili su cui è definito il modello, nell'ordine di inserimento
     */
    public Set<String> variables() {
        return assignment.keySet();
    }

    /**
     * @param variable nome di variabile definita nel modello
     * @return valore assegnato
     * @throws IllegalArgumentException se la variabile non è definita nel modello
     */
    public boolean valueOf(String variable) {
        Boolean value = assignment.get(variable);
        if (value == null) {
            throw new IllegalArgumentException("Variabile non definita nel modello: " + variable);
        }
        return value;
    }

    /**
     * @return true se il modello assegna un valore a ogni variabile della formula
     */
    public boolean isSufficientFor(Formula formula) {
        return assignment.keySet().containsAll(formula.variables());
    }

    /**
     * @return vista non modificabile dell'assegnamento
     */
    public Map<String, Boolean> asMap() {
        return assignment;
    }

    //endregion

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return assignment.equals(((Model) obj).assignment);
    }

    @Override
    public int hashCode() {
        return assignment.hashCode();
    }

    @Override
    public String toString() {
        return assignment.toString();
    }
}
