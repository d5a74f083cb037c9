package org.logic.syntax;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER FORMULE LOGICHE - Discesa ricorsiva sulla rappresentazione canonica
 *
 * Costruisce un albero {@link Formula} a partire dalla sua rappresentazione canonica
 * completamente parentesizzata, usando {@link FormulaScanner} per estrarre una unità
 * lessicale alla volta. Non esistono precedenze né associatività: ogni applicazione
 * binaria deve essere racchiusa tra parentesi, quindi la grammatica è non ambigua.
 *
 * GRAMMATICA ACCETTATA:
 * • formula := variabile | costante | '~' formula | '(' formula binario formula ')'
 * • binario := '&amp;' | '|' | '-&gt;'
 *
 * GESTIONE ERRORI:
 * • {@link #parsePrefix(String)} non lancia eccezioni per input malformato: restituisce
 *   un {@link ParseResult} fallito con motivo e testo incriminato
 * • {@link #parse(String)} assume che l'input sia già stato verificato con
 *   {@link #isFormula(String)} e lancia IllegalArgumentException in caso contrario
 */
public final class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Previene istanziazione - classe utility
     * */
    private FormulaParser() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region PUNTO DI INGRESSO

    /**
     * Verifica se l'intera stringa è la rappresentazione canonica di una formula.
     *
     * @param input stringa da verificare (non null)
     * @return true se il parsing riesce senza lasciare suffisso
     */
    public static boolean isFormula(String input) {
        return parsePrefix(input).isComplete();
    }

    /**
     * Converte una rappresentazione canonica valida nella formula corrispondente.
     *
     * @param input stringa per cui {@link #isFormula(String)} vale true
     * @return formula la cui rappresentazione canonica è esattamente input
     * @throws IllegalArgumentException se input non è una formula valida
     */
    public static Formula parse(String input) {
        ParseResult result = parsePrefix(input);

        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Formula non valida '" + input + "': " + result.getErrorMessage());
        }
        if (!result.isComplete()) {
            throw new IllegalArgumentException("Formula non valida '" + input
                    + "': contenuto residuo '" + result.getRemainder() + "'");
        }

        LOGGER.fine("Formula analizzata: " + result.getFormula());
        return result.getFormula();
    }

    /**
     * METODO PRINCIPALE - Analizza il più lungo prefisso della stringa che sia una formula
     *
     * Se la stringa inizia con un nome di variabile (es. x12), il prefisso riconosciuto
     * include l'intero nome e non solo una sua parte.
     *
     * PASSI:
     * 1. Stringa vuota: fallimento
     * 2. Variabile o costante: formula completa, si restituisce il suffisso
     * 3. Operatore binario: fallimento, nessuna formula inizia con un connettivo binario
     * 4. Negazione: parsing ricorsivo dell'operando
     * 5. Gruppo parentesizzato: operando sinistro, connettivo, operando destro che deve
     *    consumare tutto il contenuto del gruppo
     * 6. Qualunque altro simbolo: fallimento
     *
     * @param input stringa da analizzare (non null)
     * @return esito con formula e suffisso non analizzato, oppure motivo del fallimento
     * @throws IllegalArgumentException se input null
     */
    public static ParseResult parsePrefix(String input) {
        if (input == null) {
            throw new IllegalArgumentException("Stringa da analizzare non può essere null");
        }

        ParseResult result = parseFormula(input);

        if (!result.isSuccess() && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(String.format("Parsing fallito per '%s': %s", input, result.getErrorMessage()));
        }
        return result;
    }

    //endregion

    //region DISCESA RICORSIVA

    private static ParseResult parseFormula(String input) {
        if (input.isEmpty()) {
            return ParseResult.failure("stringa vuota", "");
        }

        FormulaScanner.ScannedToken scanned = FormulaScanner.scan(input);
        String token = scanned.getToken();
        String rest = scanned.getRemainder();

        if (FormulaSymbols.isVariable(token) || FormulaSymbols.isConstant(token)) {
            return ParseResult.success(new Formula(token), rest);
        }

        if (FormulaSymbols.isBinary(token)) {
            return ParseResult.failure("l'operatore binario '" + token + "' non può iniziare una formula", input);
        }

        if (FormulaSymbols.isUnary(token)) {
            return parseNegation(token, rest);
        }

        if (scanned.isParenthesizedGroup()) {
            return parseBinaryGroup(token, rest);
        }

        if (token.charAt(0) == '(') {
            return ParseResult.failure("parentesi '(' non chiusa", input);
        }

        return ParseResult.failure("'" + input + "' non è una formula valida", input);
    }

    /**
     * Negazione: l'operando è il più lungo prefisso valido del resto.
     */
    private static ParseResult parseNegation(String operator, String rest) {
        if (rest.isEmpty()) {
            return ParseResult.failure("l'operatore unario '" + operator + "' non ha operando", "");
        }

        ParseResult operand = parseFormula(rest);
        if (!operand.isSuccess()) {
            return operand;
        }

        return ParseResult.success(new Formula(operator, operand.getFormula()), operand.getRemainder());
    }

    /**
     * Gruppo "(sinistro connettivo destro)": il contenuto tra le parentesi esterne
     * deve essere consumato per intero.
     */
    private static ParseResult parseBinaryGroup(String group, String rest) {
        String interior = group.substring(1, group.length() - 1);

        ParseResult left = parseFormula(interior);
        if (!left.isSuccess()) {
            return left;
        }

        String afterLeft = left.getRemainder();
        if (afterLeft.isEmpty()) {
            return ParseResult.failure("attesi due operandi ma trovato uno solo in " + group, group);
        }

        FormulaScanner.ScannedToken connective = FormulaScanner.scan(afterLeft);
        if (!FormulaSymbols.isBinary(connective.getToken())) {
            return ParseResult.failure("connettivo non valido '" + connective.getToken() + "' in " + group, afterLeft);
        }

        String rightInput = connective.getRemainder();
        ParseResult right = parseFormula(rightInput);
        if (!right.isSuccess()) {
            return ParseResult.failure("'" + rightInput + "' non è una formula valida: "
                    + right.getErrorMessage(), rightInput);
        }
        if (!right.isComplete()) {
            return ParseResult.failure("impossibile analizzare '" + right.getRemainder() + "' in " + group,
                    right.getRemainder());
        }

        Formula binary = new Formula(connective.getToken(), left.getFormula(), right.getFormula());
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Riconosciuto nodo binario: " + binary);
        }
        return ParseResult.success(binary, rest);
    }

    //endregion
}
