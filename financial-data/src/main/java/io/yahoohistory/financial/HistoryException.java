package io.yahoohistory.financial;

/** Base of the failures a history fetch can end with, other than validation and cancellation. */
public class HistoryException extends RuntimeException {
    public HistoryException(String message) {
        super(message);
    }

    public HistoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
