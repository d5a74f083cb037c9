package org.logic.syntax;

/**
 * SIMBOLI DELLA GRAMMATICA - Classificazione dei simboli ammessi nelle formule
 *
 * Centralizza il riconoscimento di nomi di variabile, costanti e connettivi
 * della logica proposizionale, condiviso da scanner, parser e costruttori di {@link Formula}.
 *
 * SIMBOLI RICONOSCIUTI:
 * • Variabili: lettera minuscola tra 'p' e 'z' seguita da cifre decimali (p, q76, z1)
 * • Costanti: T (vero), F (falso)
 * • Operatore unario: ~ (negazione)
 * • Operatori binari: & (congiunzione), | (disgiunzione), -> (implicazione materiale)
 */
public final class FormulaSymbols {

    //region CONFIGURAZIONE SIMBOLI

    /** Costante logica vera */
    public static final String TRUE = "T";

    /** Costante logica falsa */
    public static final String FALSE = "F";

    /** Negazione */
    public static final String NOT = "~";

    /** Congiunzione */
    public static final String AND = "&";

    /** Disgiunzione */
    public static final String OR = "|";

    /** Implicazione materiale */
    public static final String IMPLIES = "->";

    /** Prima lettera ammessa per i nomi di variabile */
    private static final char FIRST_VARIABLE_LETTER = 'p';

    /** Ultima lettera ammessa per i nomi di variabile */
    private static final char LAST_VARIABLE_LETTER = 'z';

    /**
     * Previene istanziazione - classe utility
     * */
    private FormulaSymbols() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region RICONOSCIMENTO SIMBOLI

    /**
     * Verifica se la stringa è un nome di variabile valido: una lettera tra 'p' e 'z'
     * seguita, opzionalmente, da sole cifre decimali.
     *
     * @param symbol stringa da verificare (può essere null)
     * @return true se la stringa è un nome di variabile
     */
    public static boolean isVariable(String symbol) {
        if (symbol == null || symbol.isEmpty() || !isVariableLetter(symbol.charAt(0))) {
            return false;
        }
        for (int i = 1; i < symbol.length(); i++) {
            if (!isDigit(symbol.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true se la stringa è una delle costanti T o F
     */
    public static boolean isConstant(String symbol) {
        return TRUE.equals(symbol) || FALSE.equals(symbol);
    }

    /**
     * @return true se la stringa è l'operatore di negazione
     */
    public static boolean isUnary(String symbol) {
        return NOT.equals(symbol);
    }

    /**
     * @return true se la stringa è uno tra &amp;, | e -&gt;
     */
    public static boolean isBinary(String symbol) {
        return AND.equals(symbol) || OR.equals(symbol) || IMPLIES.equals(symbol);
    }

    /**
     * Lettera iniziale di un nome di variabile.
     */
    static boolean isVariableLetter(char c) {
        return c >= FIRST_VARIABLE_LETTER && c <= LAST_VARIABLE_LETTER;
    }

    /**
     * Solo cifre ASCII: {@link Character#isDigit} accetterebbe anche cifre Unicode.
     */
    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    //endregion
}
