package io.yahoohistory.core;

import java.util.Objects;

/**
 * A payload tagged with its position in the caller's input, so out-of-order completions can be put back in order.
 */
public final class Record<T> implements Comparable<Record<?>> {
    private final long seq; // index in the submitted input list
    private final T payload;

    public Record(long seq, T payload) {
        this.seq = seq;
        this.payload = payload;
    }

    public long seq() { return seq; }
    public T payload() { return payload; }

    public <R> Record<R> withPayload(R other) {
        return new Record<>(seq, other);
    }

    @Override
    public int compareTo(Record<?> o) {
        return Long.compare(this.seq, o.seq);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record<?> that)) return false;
        return seq == that.seq && Objects.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seq, payload);
    }

    @Override
    public String toString() {
        return "Record{" +
                "seq=" + seq +
                ", payload=" + payload +
                '}';
    }
}
