package io.yahoohistory.financial;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Single pass over a download body. Not restartable and not thread-safe. I/O errors surface as
 * {@link UncheckedIOException}; a row that breaks CSV grammar is counted as dropped and ends the pass.
 */
public final class TickReader implements Iterator<Tick>, Closeable {
    private static final Logger log = LoggerFactory.getLogger(TickReader.class);

    private final MappingIterator<String[]> rows;
    private final TickVariant variant;
    private boolean headerSkipped;
    private boolean exhausted;
    private Tick next;
    private long dropped;

    TickReader(MappingIterator<String[]> rows, TickVariant variant) {
        this.rows = rows;
        this.variant = variant;
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (exhausted) return false;
        try {
            if (!headerSkipped) {
                headerSkipped = true;
                if (rows.hasNextValue()) rows.nextValue();
            }
            while (rows.hasNextValue()) {
                Tick t = TickCsvDecoder.parseRow(rows.nextValue(), variant);
                if (t != null) {
                    next = t;
                    return true;
                }
                dropped++;
            }
        } catch (JsonProcessingException e) {
            // the parser cannot resynchronise after a grammar error; keep what was read and stop
            dropped++;
            log.debug("{} rows end at unparsable CSV: {}", variant, e.getOriginalMessage());
        } catch (IOException e) {
            throw new UncheckedIOException("failed reading " + variant + " rows", e);
        }
        exhausted = true;
        return false;
    }

    @Override
    public Tick next() {
        if (!hasNext()) throw new NoSuchElementException();
        Tick t = next;
        next = null;
        return t;
    }

    /** Rows skipped so far because they did not parse. */
    public long dropped() {
        return dropped;
    }

    public TickVariant variant() {
        return variant;
    }

    /** Lazy view of the remaining ticks; closing the stream closes the body. */
    public Stream<Tick> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .onClose(() -> {
                    try {
                        close();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                });
    }

    @Override
    public void close() throws IOException {
        exhausted = true;
        next = null;
        rows.close();
    }
}
