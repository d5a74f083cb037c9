package org.logic.syntax;

import java.util.Objects;

/**
 * SCANNER DI FORMULE - Estrazione della prima unità lessicale da una stringa
 *
 * Divide una stringa non vuota nella sua prima unità lessicale e nel suffisso
 * rimanente. L'unità estratta può essere:
 * • un nome di variabile completo (lettera seguita dalla sequenza massimale di cifre)
 * • l'operatore di implicazione "->"
 * • un gruppo parentesizzato bilanciato, parentesi esterne incluse
 * • qualunque altro singolo carattere (~, &amp;, |, T, F o simboli non riconosciuti)
 *
 * Le parentesi non bilanciate non sono un errore dello scanner: l'unità restituita
 * è la sola "(" e la diagnosi viene lasciata al parser.
 */
public final class FormulaScanner {

    private static final char OPEN_PARENTHESIS = '(';
    private static final char CLOSE_PARENTHESIS = ')';

    /**
     * Previene istanziazione - classe utility
     * */
    private FormulaScanner() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region SCANSIONE

    /**
     * Estrae la prima unità lessicale della stringa.
     *
     * @param input stringa da scansionare (non null, non vuota)
     * @return coppia (unità lessicale, suffisso non scansionato)
     * @throws IllegalArgumentException se input null o vuoto
     */
    public static ScannedToken scan(String input) {
        if (input == null || input.isEmpty()) {
            throw new IllegalArgumentException("Impossibile scansionare una stringa null o vuota");
        }

        char first = input.charAt(0);

        if (FormulaSymbols.isVariableLetter(first)) {
            return splitAt(input, variableEnd(input));
        }

        if (input.startsWith(FormulaSymbols.IMPLIES)) {
            return splitAt(input, FormulaSymbols.IMPLIES.length());
        }

        if (first == OPEN_PARENTHESIS) {
            int groupEnd = balancedGroupEnd(input);
            // Parentesi mai richiusa: si restituisce la sola "("
            return splitAt(input, groupEnd < 0 ? 1 : groupEnd);
        }

        return splitAt(input, 1);
    }

    /**
     * Indice successivo all'ultima cifra del nome di variabile iniziale.
     */
    private static int variableEnd(String input) {
        int end = 1;
        while (end < input.length() && FormulaSymbols.isDigit(input.charAt(end))) {
            end++;
        }
        return end;
    }

    /**
     * Indice successivo alla parentesi che riporta la profondità a zero,
     * oppure -1 se le parentesi non si bilanciano.
     */
    private static int balancedGroupEnd(String input) {
        int depth = 0;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c == OPEN_PARENTHESIS) {
                depth++;
            } else if (c == CLOSE_PARENTHESIS) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    private static ScannedToken splitAt(String input, int index) {
        return new ScannedToken(input.substring(0, index), input.substring(index));
    }

    //endregion

    //region RISULTATO SCANSIONE

    /**
     * Coppia immutabile (unità lessicale, suffisso rimanente).
     */
    public static final class ScannedToken {

        private final String token;
        private final String remainder;

        ScannedToken(String token, String remainder) {
            this.token = token;
            this.remainder = remainder;
        }

        /**
         * @return prima unità lessicale (mai vuota)
         */
        public String getToken() {
            return token;
        }

        /**
         * @return suffisso non scansionato (eventualmente vuoto)
         */
        public String getRemainder() {
            return remainder;
        }

        /**
         * @return true se l'unità è un gruppo parentesizzato bilanciato
         */
        public boolean isParenthesizedGroup() {
            return token.length() > 1 && token.charAt(0) == OPEN_PARENTHESIS;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (obj == null || getClass() != obj.getClass()) return false;

            ScannedToken other = (ScannedToken) obj;
            return token.equals(other.token) && remainder.equals(other.remainder);
        }

        @Override
        public int hashCode() {
            return Objects.hash(token, remainder);
        }

        @Override
        public String toString() {
            return "ScannedToken{token='" + token + "', remainder='" + remainder + "'}";
        }
    }

    //endregion
}
