package io.yahoohistory.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cancellation flag shared by every branch of a run. Listeners fire exactly once,
 * either when {@link #cancel()} is called or immediately if registered after it.
 */
public final class CancellationSignal {
    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * @return true if this call flipped the signal, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) return false;
        for (Runnable r : listeners) fire(r);
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) throw new CancellationException("cancelled");
    }

    /**
     * Registers a listener and returns the handle that unregisters it. Work that finishes without being
     * cancelled must run the handle, or a long-lived signal keeps every finished listener reachable.
     */
    public Runnable onCancel(Runnable listener) {
        Runnable once = once(listener);
        listeners.add(once);
        // cancel() may have snapshotted the list before the add
        if (cancelled.get()) {
            listeners.remove(once);
            fire(once);
        }
        return () -> listeners.remove(once);
    }

    /** Listeners registered and neither fired nor unregistered yet. */
    public int registeredListeners() {
        return listeners.size();
    }

    private static Runnable once(Runnable r) {
        AtomicBoolean ran = new AtomicBoolean(false);
        return () -> {
            if (ran.compareAndSet(false, true)) r.run();
        };
    }

    private static void fire(Runnable r) {
        try {
            r.run();
        } catch (RuntimeException e) {
            log.warn("cancellation listener failed", e);
        }
    }
}
