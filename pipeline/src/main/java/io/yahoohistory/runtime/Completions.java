package io.yahoohistory.runtime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

public final class Completions {
    private Completions() {}

    /** Strips the CompletionException/ExecutionException layers added by future composition. */
    public static Throwable unwrap(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }

    public static <T> CompletableFuture<T> failed(Throwable t) {
        return CompletableFuture.failedFuture(unwrap(t));
    }

    /**
     * Like {@code thenApply}, but failures reach the result unwrapped and cancelling the result cancels {@code source}.
     */
    public static <A, B> CompletableFuture<B> derive(CompletableFuture<A> source, Function<? super A, ? extends B> fn) {
        CompletableFuture<B> out = new CompletableFuture<>();
        source.whenComplete((a, err) -> {
            if (err != null) {
                out.completeExceptionally(unwrap(err));
                return;
            }
            try {
                out.complete(fn.apply(a));
            } catch (RuntimeException e) {
                out.completeExceptionally(e);
            }
        });
        out.whenComplete((b, err) -> {
            if (out.isCancelled()) source.cancel(true);
        });
        return out;
    }

    /** Runs the supplier, turning a synchronous throw into a failed stage. */
    public static <T> CompletableFuture<T> guard(Supplier<? extends CompletionStage<T>> body) {
        try {
            return body.get().toCompletableFuture();
        } catch (RuntimeException e) {
            return failed(e);
        }
    }
}
