package io.yahoohistory.financial;

/** Sampling granularity of price bars; the code is sent as {@code interval=1<code>}. */
public enum Frequency {
    DAILY("d"),
    WEEKLY("wk"),
    MONTHLY("mo");

    private final String code;

    Frequency(String code) { this.code = code; }

    public String code() { return code; }

    public String interval() { return "1" + code; }
}
