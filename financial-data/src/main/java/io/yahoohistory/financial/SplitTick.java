package io.yahoohistory.financial;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A split ratio as reported, e.g. {@code 7/1} gives beforeSplit=7, afterSplit=1.
 */
public record SplitTick(LocalDate date, BigDecimal beforeSplit, BigDecimal afterSplit) implements Tick {}
