package io.yahoohistory.financial;

/** The symbol list was rejected before any request was made. */
public class SymbolValidationException extends IllegalArgumentException {
    public SymbolValidationException(String message) {
        super(message);
    }
}
