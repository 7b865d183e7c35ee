package io.yahoohistory.financial;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

final class MarketTime {
    static final LocalTime MARKET_CLOSE = LocalTime.of(16, 0);

    private MarketTime() {}

    /**
     * Epoch seconds of 16:00 local time on the given date. A close falling in a DST gap moves forward
     * by the gap length; in an overlap the earlier offset wins.
     */
    static long closeSeconds(LocalDate date, ZoneId zone) {
        return ZonedDateTime.of(date, MARKET_CLOSE, zone).toEpochSecond();
    }
}
