package org.logic.semantics;

import org.logic.syntax.Formula;
import org.logic.syntax.FormulaSymbols;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * VALUTATORE SEMANTICO - Calcolo del valore di verità di una formula in un modello
 *
 * SEMANTICA PER VARIANTE:
 * • Variabile: valore assegnato dal modello
 * • T / F: vero / falso
 * • ~A: negazione di A
 * • (A&amp;B): vero se entrambi veri
 * • (A|B): vero se almeno uno vero
 * • (A-&gt;B): falso solo se A vero e B falso
 */
public final class FormulaEvaluator {

    private static final Logger LOGGER = Logger.getLogger(FormulaEvaluator.class.getName());

    /**
     * Previene istanziazione - classe utility
     * */
    private FormulaEvaluator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VALUTAZIONE

    /**
     * Calcola il valore di verità della formula nel modello.
     *
     * @param formula formula da valutare (non null)
     * @param model modello definito su (un sovrainsieme di) le variabili della formula
     * @return valore di verità della formula
     * @throws IllegalArgumentException se il modello non è sufficiente per la formula
     */
    public static boolean evaluate(Formula formula, Model model) {
        if (formula == null || model == null) {
            throw new IllegalArgumentException("Formula e modello non possono essere null");
        }
        if (!model.isSufficientFor(formula)) {
            throw new IllegalArgumentException("Il modello " + model.variables()
                    + " non copre le variabili " + formula.variables() + " di " + formula);
        }
        return evaluateNode(formula, model);
    }

    private static boolean evaluateNode(Formula formula, Model model) {
        String root = formula.getRoot();

        if (formula.isVariable()) {
            return model.valueOf(root);
        }
        if (formula.isConstant()) {
            return FormulaSymbols.TRUE.equals(root);
        }
        if (formula.isUnary()) {
            return !evaluateNode(formula.getFirst(), model);
        }

        boolean left = evaluateNode(formula.getFirst(), model);
        boolean right = evaluateNode(formula.getSecond(), model);

        return switch (root) {
            case FormulaSymbols.AND -> left && right;
            case FormulaSymbols.OR -> left || right;
            case FormulaSymbols.IMPLIES -> !left || right;
            default -> throw new IllegalStateException("Operatore binario non gestito: " + root);
        };
    }

    /**
     * Valuta la formula in ciascun modello, nell'ordine dato.
     *
     * @param formula formula da valutare
     * @param models modelli, ciascuno sufficiente per la formula
     * @return valori di verità nello stesso ordine dei modelli
     */
    public static List<Boolean> truthValues(Formula formula, Iterable<Model> models) {
        if (models == null) {
            throw new IllegalArgumentException("Sequenza di modelli non può essere null");
        }

        List<Boolean> values = new ArrayList<>();
        for (Model model : models) {
            values.add(evaluate(formula, model));
        }

        LOGGER.finest(() -> "Valori di verità di " + formula + ": " + values);
        return values;
    }

    //endregion
}
