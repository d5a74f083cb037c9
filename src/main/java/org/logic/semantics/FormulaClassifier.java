package org.logic.semantics;

import org.logic.syntax.Formula;
import org.logic.syntax.FormulaSymbols;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * CLASSIFICATORE - Tautologie, contraddizioni e formule soddisfacibili
 *
 * Le verifiche enumerano tutti i modelli sulle variabili della formula stessa.
 * Una formula senza variabili viene valutata una sola volta nel modello vuoto,
 * dato che il suo valore non dipende da alcun assegnamento.
 *
 * RELAZIONI:
 * • contraddizione(A) ⇔ tautologia(~A)
 * • soddisfacibile(A) ⇔ non contraddizione(A)
 */
public final class FormulaClassifier {

    private static final Logger LOGGER = Logger.getLogger(FormulaClassifier.class.getName());

    /**
     * Previene istanziazione - classe utility
     * */
    private FormulaClassifier() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region CLASSIFICAZIONE

    /**
     * @return true se la formula è vera in ogni modello sulle sue variabili
     */
    public static boolean isTautology(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        if (formula.variables().isEmpty()) {
            return FormulaEvaluator.evaluate(formula, Model.EMPTY);
        }

        // Ordinamento per un'enumerazione deterministica
        List<String> variables = new ArrayList<>(formula.variables());
        Collections.sort(variables);

        for (Model model : ModelEnumerator.allModels(variables)) {
            if (!FormulaEvaluator.evaluate(formula, model)) {
                LOGGER.fine(() -> formula + " non è una tautologia, falsa in " + model);
                return false;
            }
        }
        return true;
    }

    /**
     * @return true se la formula è falsa in ogni modello sulle sue variabili
     */
    public static boolean isContradiction(Formula formula) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        return isTautology(new Formula(FormulaSymbols.NOT, formula));
    }

    /**
     * @return true se esiste almeno un modello in cui la formula è vera
     */
    public static boolean isSatisfiable(Formula formula) {
        return !isContradiction(formula);
    }

    //endregion
}
