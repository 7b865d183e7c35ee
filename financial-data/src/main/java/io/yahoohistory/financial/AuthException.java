package io.yahoohistory.financial;

/** Acquiring the session cookie or the crumb failed. */
public class AuthException extends HistoryException {
    public AuthException(String message) {
        super(message);
    }

    public AuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
