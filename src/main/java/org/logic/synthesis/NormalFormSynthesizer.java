package org.logic.synthesis;

import org.logic.semantics.Model;
import org.logic.semantics.ModelEnumerator;
import org.logic.syntax.Formula;
import org.logic.syntax.FormulaSymbols;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * SINTETIZZATORE DI FORME NORMALI - Da tabella di verità a formula DNF o CNF
 *
 * Data una lista di variabili e la colonna dei valori di verità, indicizzata nello
 * stesso ordine di {@link ModelEnumerator#allModels(List)}, costruisce una formula
 * che riproduce esattamente la tabella.
 *
 * COSTRUZIONI DUALI:
 * • DNF: una clausola congiuntiva per ogni riga vera, clausole disgiunte tra loro
 * • CNF: una clausola disgiuntiva per ogni riga falsa, clausole congiunte tra loro
 *
 * CASI DEGENERI:
 * • DNF di una tabella tutta falsa: congiunzione di (v&amp;~v) per ogni variabile
 * • CNF di una tabella tutta vera: congiunzione di (v|~v) per ogni variabile
 *
 * Letterali e clausole vengono combinati da sinistra a destra:
 * [a, b, c] con &amp; diventa ((a&amp;b)&amp;c).
 */
public final class NormalFormSynthesizer {

    private static final Logger LOGGER = Logger.getLogger(NormalFormSynthesizer.class.getName());

    /**
     * Previene istanziazione - classe utility
     * */
    private NormalFormSynthesizer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region SINTESI DNF

    /**
     * Sintetizza una formula in forma normale disgiuntiva con la tabella di verità data.
     *
     * @param variables variabili della formula (non vuota)
     * @param values valori di verità, uno per modello, nell'ordine di enumerazione
     * @return formula DNF sulle variabili date
     * @throws IllegalArgumentException se variabili vuote o numero di valori errato
     */
    public static Formula synthesize(List<String> variables, List<Boolean> values) {
        List<Model> models = validateTable(variables, values);

        List<Formula> clauses = new ArrayList<>();
        for (int i = 0; i < models.size(); i++) {
            if (values.get(i)) {
                clauses.add(synthesizeForModel(models.get(i)));
            }
        }

        if (clauses.isEmpty()) {
            // Tabella tutta falsa: (v&~v) per ogni variabile
            for (String variable : variables) {
                Formula literal = new Formula(variable);
                clauses.add(new Formula(FormulaSymbols.AND, literal, negate(literal)));
            }
            Formula contradiction = joinLeftToRight(FormulaSymbols.AND, clauses);
            LOGGER.fine(() -> "Sintesi DNF di tabella tutta falsa: " + contradiction);
            return contradiction;
        }

        Formula dnf = joinLeftToRight(FormulaSymbols.OR, clauses);
        LOGGER.fine(() -> "Sintesi DNF con " + clauses.size() + " clausole: " + dnf);
        return dnf;
    }

    /**
     * Clausola congiuntiva vera nel solo modello dato tra quelli sulle stesse variabili.
     *
     * @param model modello su un insieme non vuoto di variabili
     * @return congiunzione di letterali: v se il modello assegna vero, ~v altrimenti
     */
    public static Formula synthesizeForModel(Model model) {
        List<Formula> literals = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : nonEmpty(model).asMap().entrySet()) {
            Formula variable = new Formula(entry.getKey());
            literals.add(entry.getValue() ? variable : negate(variable));
        }
        return joinLeftToRight(FormulaSymbols.AND, literals);
    }

    //endregion

    //region SINTESI CNF

    /**
     * Sintetizza una formula in forma normale congiuntiva con la tabella di verità data.
     *
     * @param variables variabili della formula (non vuota)
     * @param values valori di verità, uno per modello, nell'ordine di enumerazione
     * @return formula CNF sulle variabili date
     * @throws IllegalArgumentException se variabili vuote o numero di valori errato
     */
    public static Formula synthesizeCnf(List<String> variables, List<Boolean> values) {
        List<Model> models = validateTable(variables, values);

        List<Formula> clauses = new ArrayList<>();
        for (int i = 0; i < models.size(); i++) {
            if (!values.get(i)) {
                clauses.add(synthesizeForAllExceptModel(models.get(i)));
            }
        }

        if (clauses.isEmpty()) {
            // Tabella tutta vera: (v|~v) per ogni variabile
            for (String variable : variables) {
                Formula literal = new Formula(variable);
                clauses.add(new Formula(FormulaSymbols.OR, literal, negate(literal)));
            }
            Formula tautology = joinLeftToRight(FormulaSymbols.AND, clauses);
            LOGGER.fine(() -> "Sintesi CNF di tabella tutta vera: " + tautology);
            return tautology;
        }

        Formula cnf = joinLeftToRight(FormulaSymbols.AND, clauses);
        LOGGER.fine(() -> "Sintesi CNF con " + clauses.size() + " clausole: " + cnf);
        return cnf;
    }

    /**
     * Clausola disgiuntiva falsa nel solo modello dato tra quelli sulle stesse variabili.
     *
     * @param model modello su un insieme non vuoto di variabili
     * @return disgiunzione di letterali: ~v se il modello assegna vero, v altrimenti
     */
    public static Formula synthesizeForAllExceptModel(Model model) {
        List<Formula> literals = new ArrayList<>();
        for (Map.Entry<String, Boolean> entry : nonEmpty(model).asMap().entrySet()) {
            Formula variable = new Formula(entry.getKey());
            literals.add(entry.getValue() ? negate(variable) : variable);
        }
        return joinLeftToRight(FormulaSymbols.OR, literals);
    }

    //endregion

    //region UTILITY

    /**
     * Verifica la tabella e restituisce i modelli corrispondenti alle righe.
     */
    private static List<Model> validateTable(List<String> variables, List<Boolean> values) {
        if (variables == null || variables.isEmpty()) {
            throw new IllegalArgumentException("La sintesi richiede almeno una variabile");
        }
        if (values == null) {
            throw new IllegalArgumentException("Valori di verità non possono essere null");
        }

        List<Model> models = ModelEnumerator.allModels(variables);
        if (values.size() != models.size()) {
            throw new IllegalArgumentException("Attesi " + models.size() + " valori di verità per "
                    + variables + ", ricevuti " + values.size());
        }
        // List.of rifiuta contains(null), quindi si scorre la tabella
        for (Boolean value : values) {
            if (value == null) {
                throw new IllegalArgumentException("La tabella di verità contiene valori null");
            }
        }
        return models;
    }

    private static Model nonEmpty(Model model) {
        if (model == null || model.variables().isEmpty()) {
            throw new IllegalArgumentException("La clausola richiede un modello su almeno una variabile");
        }
        return model;
    }

    private static Formula negate(Formula formula) {
        return new Formula(FormulaSymbols.NOT, formula);
    }

    /**
     * Combina le formule con l'operatore binario, associando a sinistra.
     */
    private static Formula joinLeftToRight(String operator, List<Formula> operands) {
        Formula result = operands.get(0);
        for (int i = 1; i < operands.size(); i++) {
            result = new Formula(operator, result, operands.get(i));
        }
        return result;
    }

    //endregion
}
