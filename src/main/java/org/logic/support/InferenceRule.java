package org.logic.support;

import org.logic.syntax.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REGOLA DI INFERENZA - Premesse ordinate e una conclusione
 *
 * Contenitore immutabile scambiato con i componenti di verifica delle dimostrazioni;
 * qui non viene interpretato (nessuna verifica di correttezza).
 *
 * Rappresentazione testuale: [p, (p-&gt;q)] ==&gt; q
 */
public final class InferenceRule {

    private final List<Formula> assumptions;
    private final Formula conclusion;

    /**
     * @param assumptions premesse in ordine (non null, eventualmente vuote, senza elementi null)
     * @param conclusion conclusione (non null)
     * @throws IllegalArgumentException se i parametri non sono validi
     */
    public InferenceRule(List<Formula> assumptions, Formula conclusion) {
        if (assumptions == null) {
            throw new IllegalArgumentException("Lista premesse non può essere null");
        }
        for (Formula assumption : assumptions) {
            if (assumption == null) {
                throw new IllegalArgumentException("Lista premesse non può contenere elementi null");
            }
        }
        if (conclusion == null) {
            throw new IllegalArgumentException("Conclusione non può essere null");
        }

        this.assumptions = Collections.unmodifiableList(new ArrayList<>(assumptions));
        this.conclusion = conclusion;
    }

    public List<Formula> getAssumptions() {
        return assumptions;
    }

    public Formula getConclusion() {
        return conclusion;
    }

    /**
     * @return unione delle variabili di premesse e conclusione
     */
    public Set<String> variables() {
        Set<String> variables = new HashSet<>(conclusion.variables());
        for (Formula assumption : assumptions) {
            variables.addAll(assumption.variables());
        }
        return Collections.unmodifiableSet(variables);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        InferenceRule other = (InferenceRule) obj;
        return assumptions.equals(other.assumptions) && conclusion.equals(other.conclusion);
    }

    @Override
    public int hashCode() {
        return 31 * assumptions.hashCode() + conclusion.hashCode();
    }

    @Override
    public String toString() {
        return assumptions.stream()
                .map(Formula::toString)
                .collect(Collectors.joining(", ", "[", "]")) + " ==> " + conclusion;
    }
}
