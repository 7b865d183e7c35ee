package io.yahoohistory.retry;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Retries immediately, only for failures the predicate accepts, up to maxAttempts attempts in total.
 */
public class BoundedRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Predicate<Throwable> retryable;

    public BoundedRetryPolicy(int maxAttempts, Predicate<Throwable> retryable) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryable = Objects.requireNonNull(retryable);
    }

    @Override
    public boolean shouldRetry(int attempt, Throwable e) {
        return attempt < maxAttempts && retryable.test(e);
    }

    public int maxAttempts() { return maxAttempts; }
}
