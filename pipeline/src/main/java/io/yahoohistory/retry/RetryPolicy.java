package io.yahoohistory.retry;

public interface RetryPolicy {
    /**
     * @param attempt the 1-based attempt that just failed
     * @param e the failure of that attempt, already unwrapped from any CompletionException
     */
    boolean shouldRetry(int attempt, Throwable e);

    static RetryPolicy never() {
        return (attempt, e) -> false;
    }
}
