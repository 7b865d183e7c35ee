package io.yahoohistory.runtime;

import io.yahoohistory.core.AsyncTransform;
import io.yahoohistory.core.Record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Starts one async transform per input at once and joins the outputs back in input order.
 * <p>
 * The joined future settles only after every branch has settled. If any branch failed, it fails with
 * the first failure in input order. Cancelling the signal (or the returned future) fails it at once
 * with {@link CancellationException} and cancels the branches still running.
 */
public final class FanOut<I, O> {
    private final AsyncTransform<I, O> transform;

    public FanOut(AsyncTransform<I, O> transform) {
        this.transform = Objects.requireNonNull(transform);
    }

    public CompletableFuture<List<O>> run(List<I> inputs, CancellationSignal signal) {
        Objects.requireNonNull(signal);
        CompletableFuture<List<O>> joined = new CompletableFuture<>();
        int n = inputs.size();
        if (n == 0) {
            joined.complete(List.of());
            return joined;
        }

        OrderedBuffer<O> buffer = new OrderedBuffer<>(0);
        List<O> ordered = new ArrayList<>(n);
        AtomicReferenceArray<Throwable> failures = new AtomicReferenceArray<>(n);
        AtomicInteger pending = new AtomicInteger(n);
        List<CompletableFuture<O>> branches = new CopyOnWriteArrayList<>();

        Runnable unregister = signal.onCancel(() -> {
            joined.completeExceptionally(new CancellationException("cancelled"));
            branches.forEach(b -> b.cancel(true));
        });
        joined.whenComplete((v, e) -> {
            if (joined.isCancelled()) signal.cancel();
        });

        for (int i = 0; i < n; i++) {
            Record<I> in = new Record<>(i, inputs.get(i));
            CompletableFuture<O> branch = signal.isCancelled()
                    ? CompletableFuture.failedFuture(new CancellationException("cancelled"))
                    : Completions.guard(() -> transform.applyAsync(in));
            branches.add(branch);
            // the listener may have run before this branch was added
            if (signal.isCancelled()) branch.cancel(true);
            branch.whenComplete((out, err) -> {
                if (err != null) {
                    failures.set((int) in.seq(), Completions.unwrap(err));
                } else {
                    synchronized (buffer) {
                        buffer.add(in.withPayload(out));
                        for (Record<O> r : buffer.drain()) ordered.add(r.payload());
                    }
                }
                if (pending.decrementAndGet() == 0) {
                    unregister.run();
                    settle(joined, buffer, ordered, failures, signal);
                }
            });
        }
        return joined;
    }

    private void settle(CompletableFuture<List<O>> joined, OrderedBuffer<O> buffer, List<O> ordered,
                        AtomicReferenceArray<Throwable> failures, CancellationSignal signal) {
        if (signal.isCancelled()) {
            joined.completeExceptionally(new CancellationException("cancelled"));
            return;
        }
        for (int i = 0; i < failures.length(); i++) {
            Throwable t = failures.get(i);
            if (t != null) {
                joined.completeExceptionally(t);
                return;
            }
        }
        synchronized (buffer) {
            joined.complete(Collections.unmodifiableList(new ArrayList<>(ordered)));
        }
    }
}
