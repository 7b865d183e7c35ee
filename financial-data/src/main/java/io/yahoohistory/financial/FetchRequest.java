package io.yahoohistory.financial;

import java.util.Objects;

/**
 * One symbol's download within a fetch call. Built per symbol and never shared between fetches.
 */
public record FetchRequest(String symbol, PeriodSpec period, Frequency frequency, TickVariant variant) {
    public FetchRequest {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(variant, "variant");
    }
}
