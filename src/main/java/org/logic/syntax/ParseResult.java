package org.logic.syntax;

/**
 * RISULTATO DI PARSING - Esito immutabile dell'analisi di un prefisso di stringa
 *
 * Un parsing riuscito contiene la formula riconosciuta e il suffisso non ancora
 * analizzato; un parsing fallito contiene un messaggio leggibile e, dove
 * applicabile, la porzione di testo che ha causato il fallimento.
 *
 * Il fallimento è un valore e non un'eccezione: l'input malformato è una
 * condizione attesa per il parser.
 */
public final class ParseResult {

    private final Formula formula;
    private final String remainder;
    private final String errorMessage;

    private ParseResult(Formula formula, String remainder, String errorMessage) {
        this.formula = formula;
        this.remainder = remainder;
        this.errorMessage = errorMessage;
    }

    //region FACTORY METHODS

    /**
     * @param formula formula riconosciuta (non null)
     * @param remainder suffisso non analizzato (non null, eventualmente vuoto)
     */
    public static ParseResult success(Formula formula, String remainder) {
        if (formula == null || remainder == null) {
            throw new IllegalArgumentException("Parsing riuscito richiede formula e suffisso non null");
        }
        return new ParseResult(formula, remainder, null);
    }

    /**
     * @param errorMessage motivo del fallimento (non vuoto)
     * @param offendingText testo che ha causato il fallimento (vuoto se non applicabile)
     */
    public static ParseResult failure(String errorMessage, String offendingText) {
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("Parsing fallito richiede un messaggio di errore");
        }
        return new ParseResult(null, offendingText == null ? "" : offendingText, errorMessage);
    }

    //endregion

    //region ACCESSORS

    public boolean isSuccess() {
        return formula != null;
    }

    /**
     * @return true se il parsing è riuscito e ha consumato l'intero input
     */
    public boolean isComplete() {
        return isSuccess() && remainder.isEmpty();
    }

    /**
     * @return formula riconosciuta, null se il parsing è fallito
     */
    public Formula getFormula() {
        return formula;
    }

    /**
     * @return suffisso non analizzato in caso di successo, testo incriminato in caso di fallimento
     */
    public String getRemainder() {
        return remainder;
    }

    /**
     * @return motivo del fallimento, null se il parsing è riuscito
     */
    public String getErrorMessage() {
        return errorMessage;
    }

    //endregion

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ParseResult{formula=" + formula + ", remainder='" + remainder + "'}";
        }
        return "ParseResult{error='" + errorMessage + "', remainder='" + remainder + "'}";
    }
}
