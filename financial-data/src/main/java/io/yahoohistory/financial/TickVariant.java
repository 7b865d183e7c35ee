package io.yahoohistory.financial;

/**
 * Selects the {@code events} parameter of a download and the record shape its CSV rows decode into.
 */
public enum TickVariant {
    HISTORY("history", 7),
    DIVIDEND("div", 2),
    SPLIT("split", 2);

    private final String events;
    private final int fields;

    TickVariant(String events, int fields) {
        this.events = events;
        this.fields = fields;
    }

    public String events() { return events; }

    /** Number of CSV fields a row of this variant must carry. */
    public int fields() { return fields; }
}
