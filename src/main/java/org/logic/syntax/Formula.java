package org.logic.syntax;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * FORMULA PROPOSIZIONALE - Albero sintattico immutabile
 *
 * Rappresenta una formula della logica proposizionale come albero, in cui ogni nodo
 * è esattamente una delle quattro varianti:
 * • Variabile: nome del tipo p, q76, z1 (nessun operando)
 * • Costante: T oppure F (nessun operando)
 * • Unaria: ~ applicata a un operando
 * • Binaria: &amp;, | oppure -&gt; applicata a due operandi ordinati
 *
 * RAPPRESENTAZIONE CANONICA:
 * • Variabili e costanti: il simbolo stesso
 * • Unaria: operatore seguito dall'operando (~p, ~~(p&amp;q))
 * • Binaria: sempre tra parentesi, senza spazi ((p&amp;q), ((p-&gt;q)|r))
 *
 * La rappresentazione canonica è l'unica forma accettata dal parser e definisce
 * uguaglianza e hash. Stringa canonica, insieme delle variabili e insieme degli
 * operatori vengono calcolati una sola volta per istanza, dato che l'albero non
 * cambia mai dopo la costruzione.
 */
public final class Formula {

    /** Segnaposto per il primo operando nei modelli di sostituzione degli operatori */
    public static final String FIRST_PLACEHOLDER = "p";

    /** Segnaposto per il secondo operando nei modelli di sostituzione degli operatori */
    public static final String SECOND_PLACEHOLDER = "q";

    //region STRUTTURA DATI

    /** Variabile, costante o operatore alla radice dell'albero */
    private final String root;

    /** Primo operando (solo per nodi unari e binari) */
    private final Formula first;

    /** Secondo operando (solo per nodi binari) */
    private final Formula second;

    /** Rappresentazione canonica memorizzata */
    private String canonicalForm;

    /** Variabili memorizzate */
    private Set<String> variables;

    /** Operatori e costanti memorizzati */
    private Set<String> operators;

    //endregion

    //region COSTRUTTORI E VALIDAZIONE

    /**
     * Costruisce una foglia: variabile o costante.
     *
     * @param root nome di variabile oppure T/F
     * @throws IllegalArgumentException se root non è una variabile né una costante
     */
    public Formula(String root) {
        this(root, null, null);
    }

    /**
     * Costruisce un nodo unario.
     *
     * @param root operatore unario (~)
     * @param first operando (non null)
     * @throws IllegalArgumentException se root non è unario o l'operando manca
     */
    public Formula(String root, Formula first) {
        this(root, first, null);
    }

    /**
     * Costruisce un nodo della variante indicata dalla radice, verificando
     * che il numero di operandi corrisponda esattamente all'arietà.
     *
     * @param root variabile, costante o operatore
     * @param first primo operando (null per le foglie)
     * @param second secondo operando (solo per operatori binari)
     * @throws IllegalArgumentException se radice e operandi non sono coerenti
     */
    public Formula(String root, Formula first, Formula second) {
        validateStructure(root, first, second);

        this.root = root;
        this.first = first;
        this.second = second;
    }

    private static void validateStructure(String root, Formula first, Formula second) {
        if (FormulaSymbols.isVariable(root) || FormulaSymbols.isConstant(root)) {
            if (first != null || second != null) {
                throw new IllegalArgumentException("La foglia '" + root + "' non può avere operandi");
            }
        } else if (FormulaSymbols.isUnary(root)) {
            if (first == null || second != null) {
                throw new IllegalArgumentException("L'operatore unario '" + root + "' richiede esattamente un operando");
            }
        } else if (FormulaSymbols.isBinary(root)) {
            if (first == null || second == null) {
                throw new IllegalArgumentException("L'operatore binario '" + root + "' richiede esattamente due operandi");
            }
        } else {
            throw new IllegalArgumentException("Radice non valida per una formula: '" + root + "'");
        }
    }

    //endregion

    //region PARSING

    /**
     * Verifica se la stringa è la rappresentazione canonica di una formula.
     *
     * @see FormulaParser#isFormula(String)
     */
    public static boolean isFormula(String input) {
        return FormulaParser.isFormula(input);
    }

    /**
     * Converte una rappresentazione canonica valida in formula.
     *
     * @see FormulaParser#parse(String)
     */
    public static Formula parse(String input) {
        return FormulaParser.parse(input);
    }

    //endregion

    //region ACCESSORS

    public String getRoot() {
        return root;
    }

    /**
     * @return primo operando, null per variabili e costanti
     */
    public Formula getFirst() {
        return first;
    }

    /**
     * @return secondo operando, null se la radice non è binaria
     */
    public Formula getSecond() {
        return second;
    }

    public boolean isVariable() {
        return FormulaSymbols.isVariable(root);
    }

    public boolean isConstant() {
        return FormulaSymbols.isConstant(root);
    }

    public boolean isUnary() {
        return FormulaSymbols.isUnary(root);
    }

    public boolean isBinary() {
        return FormulaSymbols.isBinary(root);
    }

    //endregion

    //region ANALISI STRUTTURALE

    /**
     * Insieme dei nomi di variabile presenti nella formula.
     *
     * @return insieme non modificabile (vuoto se la formula non ha variabili)
     */
    public Set<String> variables() {
        if (variables == null) {
            Set<String> collected = new HashSet<>();
            collectVariables(collected);
            variables = Collections.unmodifiableSet(collected);
        }
        return variables;
    }

    private void collectVariables(Set<String> collected) {
        if (isVariable()) {
            collected.add(root);
        }
        if (first != null) {
            first.collectVariables(collected);
        }
        if (second != null) {
            second.collectVariables(collected);
        }
    }

    /**
     * Insieme degli operatori presenti nella formula, costanti T e F incluse.
     *
     * @return insieme non modificabile
     */
    public Set<String> operators() {
        if (operators == null) {
            Set<String> collected = new HashSet<>();
            collectOperators(collected);
            operators = Collections.unmodifiableSet(collected);
        }
        return operators;
    }

    private void collectOperators(Set<String> collected) {
        if (!isVariable()) {
            collected.add(root);
        }
        if (first != null) {
            first.collectOperators(collected);
        }
        if (second != null) {
            second.collectOperators(collected);
        }
    }

    //endregion

    //region SOSTITUZIONI

    /**
     * Sostituisce ogni occorrenza di variabile presente come chiave nella mappa
     * con la formula associata.
     *
     * Le variabili introdotte dalle formule sostitutive non vengono sostituite
     * a loro volta (un solo passaggio):
     * ((p-&gt;p)|r) con {p: (q&amp;r), r: p} diventa (((q&amp;r)-&gt;(q&amp;r))|p)
     *
     * @param substitutionMap mappa nome variabile → formula sostitutiva
     * @return formula risultante
     * @throws IllegalArgumentException se una chiave non è un nome di variabile o un valore è null
     */
    public Formula substituteVariables(Map<String, Formula> substitutionMap) {
        if (substitutionMap == null) {
            throw new IllegalArgumentException("Mappa di sostituzione non può essere null");
        }
        for (Map.Entry<String, Formula> entry : substitutionMap.entrySet()) {
            if (!FormulaSymbols.isVariable(entry.getKey())) {
                throw new IllegalArgumentException("Chiave di sostituzione non è una variabile: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("Formula sostitutiva null per la variabile " + entry.getKey());
            }
        }
        return replaceVariables(substitutionMap);
    }

    private Formula replaceVariables(Map<String, Formula> substitutionMap) {
        if (isVariable()) {
            Formula replacement = substitutionMap.get(root);
            return replacement != null ? replacement : this;
        }
        if (isConstant()) {
            return this;
        }
        if (isUnary()) {
            return new Formula(root, first.replaceVariables(substitutionMap));
        }
        return new Formula(root,
                first.replaceVariables(substitutionMap),
                second.replaceVariables(substitutionMap));
    }

    /**
     * Sostituisce ogni costante od operatore presente come chiave nella mappa con
     * il modello associato, in cui la variabile "p" indica il primo operando del
     * nodo e "q" il secondo.
     *
     * Gli operatori introdotti dai modelli non vengono sostituiti a loro volta:
     * ((x&amp;y)&amp;~z) con {&amp;: ~(~p|~q)} diventa ~(~~(~x|~y)|~~z)
     *
     * @param substitutionMap mappa operatore → modello su {p, q}
     * @return formula risultante
     * @throws IllegalArgumentException se una chiave non è un operatore o una costante,
     *         o se un modello usa variabili diverse da p e q
     */
    public Formula substituteOperators(Map<String, Formula> substitutionMap) {
        if (substitutionMap == null) {
            throw new IllegalArgumentException("Mappa di sostituzione non può essere null");
        }
        for (Map.Entry<String, Formula> entry : substitutionMap.entrySet()) {
            String operator = entry.getKey();
            if (!FormulaSymbols.isConstant(operator) && !FormulaSymbols.isUnary(operator)
                    && !FormulaSymbols.isBinary(operator)) {
                throw new IllegalArgumentException("Chiave di sostituzione non è un operatore: " + operator);
            }
            Formula template = entry.getValue();
            if (template == null) {
                throw new IllegalArgumentException("Modello null per l'operatore " + operator);
            }
            for (String variable : template.variables()) {
                if (!FIRST_PLACEHOLDER.equals(variable) && !SECOND_PLACEHOLDER.equals(variable)) {
                    throw new IllegalArgumentException("Il modello per '" + operator
                            + "' usa la variabile " + variable + " al di fuori di {p, q}");
                }
            }
        }
        return replaceOperators(substitutionMap);
    }

    private Formula replaceOperators(Map<String, Formula> substitutionMap) {
        if (isVariable()) {
            return this;
        }

        Formula template = substitutionMap.get(root);

        if (isConstant()) {
            return template != null ? template : this;
        }

        // Gli operandi sono sostituiti prima di essere inseriti nel modello
        Map<String, Formula> bindings = new HashMap<>();
        Formula newFirst = first.replaceOperators(substitutionMap);
        bindings.put(FIRST_PLACEHOLDER, newFirst);

        if (isUnary()) {
            return template != null
                    ? template.replaceVariables(bindings)
                    : new Formula(root, newFirst);
        }

        Formula newSecond = second.replaceOperators(substitutionMap);
        bindings.put(SECOND_PLACEHOLDER, newSecond);

        return template != null
                ? template.replaceVariables(bindings)
                : new Formula(root, newFirst, newSecond);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Rappresentazione canonica, completamente parentesizzata.
     */
    @Override
    public String toString() {
        if (canonicalForm == null) {
            StringBuilder builder = new StringBuilder();
            appendCanonical(builder);
            canonicalForm = builder.toString();
        }
        return canonicalForm;
    }

    private void appendCanonical(StringBuilder builder) {
        if (first == null) {
            builder.append(root);
        } else if (second == null) {
            builder.append(root);
            first.appendCanonical(builder);
        } else {
            builder.append('(');
            first.appendCanonical(builder);
            builder.append(root);
            second.appendCanonical(builder);
            builder.append(')');
        }
    }

    /**
     * Rappresentazione in notazione polacca (prefissa), senza parentesi:
     * ((p&amp;q)-&gt;~r) diventa -&gt;&amp;pq~r
     */
    public String toPolish() {
        StringBuilder builder = new StringBuilder();
        appendPolish(builder);
        return builder.toString();
    }

    private void appendPolish(StringBuilder builder) {
        builder.append(root);
        if (first != null) {
            first.appendPolish(builder);
        }
        if (second != null) {
            second.appendPolish(builder);
        }
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Due formule sono uguali se hanno la stessa rappresentazione canonica.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        return toString().equals(obj.toString());
    }

    @Override
    public int hashCode() {
        return toString().hashCode();
    }

    //endregion
}
