package io.yahoohistory.financial;

/**
 * A download failed at the HTTP level: an unexpected status, a network error or an unreadable body.
 */
public class TransportException extends HistoryException {
    public static final int NO_STATUS = -1;

    private final String symbol;
    private final int statusCode;

    public TransportException(String symbol, int statusCode, String message) {
        super(message);
        this.symbol = symbol;
        this.statusCode = statusCode;
    }

    public TransportException(String symbol, String message, Throwable cause) {
        super(message, cause);
        this.symbol = symbol;
        this.statusCode = NO_STATUS;
    }

    public String symbol() { return symbol; }

    /** HTTP status, or {@link #NO_STATUS} when no response was received or the body could not be read. */
    public int statusCode() { return statusCode; }

    public boolean isUnauthorized() { return statusCode == 401; }
}
