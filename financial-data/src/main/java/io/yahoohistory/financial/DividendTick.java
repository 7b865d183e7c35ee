package io.yahoohistory.financial;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DividendTick(LocalDate date, BigDecimal dividend) implements Tick {}
