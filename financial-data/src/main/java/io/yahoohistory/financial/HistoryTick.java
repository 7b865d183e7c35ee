package io.yahoohistory.financial;

import java.math.BigDecimal;
import java.time.LocalDate;

public record HistoryTick(LocalDate date, BigDecimal open, BigDecimal high, BigDecimal low, BigDecimal close,
                          BigDecimal adjustedClose, long volume) implements Tick {}
