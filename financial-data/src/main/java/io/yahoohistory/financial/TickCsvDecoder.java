package io.yahoohistory.financial;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;

/**
 * Decodes a download body into ticks of one variant, row by row. The first row is always taken as the header.
 * <p>
 * Rows with the wrong number of fields, or whose date or numbers do not parse (including Yahoo's literal
 * {@code null} placeholders), are dropped whole; they never produce a partially filled tick or an error.
 */
public final class TickCsvDecoder {
    private static final Logger log = LoggerFactory.getLogger(TickCsvDecoder.class);
    private static final String NULL_PLACEHOLDER = "null";

    private static final ObjectReader ROWS = new CsvMapper()
            .readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .with(CsvParser.Feature.SKIP_EMPTY_LINES)
            .with(CsvParser.Feature.TRIM_SPACES);

    private TickCsvDecoder() {}

    /**
     * Starts decoding; nothing past the parser's first buffer is read until the reader is advanced.
     * The returned reader owns the stream and closes it.
     */
    public static TickReader decode(InputStream in, TickVariant variant) throws IOException {
        MappingIterator<String[]> rows = ROWS.readValues(new InputStreamReader(in, StandardCharsets.UTF_8));
        return new TickReader(rows, variant);
    }

    /** Maps one data row to a tick, or null when the row has to be dropped. */
    static Tick parseRow(String[] f, TickVariant variant) {
        if (f.length != variant.fields()) return drop(f, variant);
        LocalDate date = date(f[0]);
        if (date == null) return drop(f, variant);
        Tick t = switch (variant) {
            case HISTORY -> history(date, f);
            case DIVIDEND -> dividend(date, f);
            case SPLIT -> split(date, f);
        };
        return t != null ? t : drop(f, variant);
    }

    private static HistoryTick history(LocalDate date, String[] f) {
        BigDecimal open = num(f[1]);
        BigDecimal high = num(f[2]);
        BigDecimal low = num(f[3]);
        BigDecimal close = num(f[4]);
        BigDecimal adjClose = num(f[5]);
        BigDecimal volume = num(f[6]);
        if (open == null || high == null || low == null || close == null || adjClose == null || volume == null) {
            return null;
        }
        try {
            return new HistoryTick(date, open, high, low, close, adjClose, volume.longValueExact());
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static DividendTick dividend(LocalDate date, String[] f) {
        BigDecimal amount = num(f[1]);
        return amount == null ? null : new DividendTick(date, amount);
    }

    private static SplitTick split(LocalDate date, String[] f) {
        String[] ratio = f[1].split("/", -1);
        if (ratio.length != 2) return null;
        BigDecimal before = num(ratio[0].trim());
        BigDecimal after = num(ratio[1].trim());
        if (before == null || after == null) return null;
        return new SplitTick(date, before, after);
    }

    private static LocalDate date(String s) {
        try {
            return LocalDate.parse(s);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static BigDecimal num(String s) {
        if (s == null || s.isEmpty() || NULL_PLACEHOLDER.equals(s)) return null;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Tick drop(String[] f, TickVariant variant) {
        if (log.isDebugEnabled()) log.debug("dropping {} row {}", variant, Arrays.toString(f));
        return null;
    }
}
