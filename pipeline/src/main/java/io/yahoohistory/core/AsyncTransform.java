package io.yahoohistory.core;

import java.util.concurrent.CompletionStage;

/**
 * Async transform that returns its output via CompletionStage to avoid blocking worker threads.
 * The output keeps the input's seq; callers rely on it to reassemble results.
 */
public interface AsyncTransform<I, O> {
    CompletionStage<O> applyAsync(Record<I> input);
}
