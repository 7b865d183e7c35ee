package io.yahoohistory.runtime;

import io.yahoohistory.core.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buffers out-of-order records and emits them in increasing seq order. Not thread-safe.
 */
public class OrderedBuffer<T> {
    private long nextSeq;
    private final TreeMap<Long, Record<T>> buffer = new TreeMap<>();

    public OrderedBuffer(long startingSeq) {
        this.nextSeq = startingSeq;
    }

    public void add(Record<T> r) {
        if (r.seq() < nextSeq || buffer.containsKey(r.seq())) {
            throw new IllegalStateException("seq " + r.seq() + " already accepted");
        }
        buffer.put(r.seq(), r);
    }

    /**
     * Try to pop the next record in order, or null if not ready.
     */
    public Record<T> pollNext() {
        Map.Entry<Long, Record<T>> first = buffer.firstEntry();
        if (first == null || first.getKey() != nextSeq) return null;
        buffer.pollFirstEntry();
        nextSeq++;
        return first.getValue();
    }

    /** Pops every record that is ready, in order. */
    public List<Record<T>> drain() {
        List<Record<T>> out = new ArrayList<>();
        Record<T> r;
        while ((r = pollNext()) != null) out.add(r);
        return out;
    }

    public long nextSeq() { return nextSeq; }

    public int pending() { return buffer.size(); }
}
