package io.yahoohistory.financial;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Closed interval [startSeconds, endSeconds] in UTC epoch seconds. An end of {@link Long#MAX_VALUE} is open.
 * Start may not be later than end. The factories also reject a start later than now, as read from their clock.
 */
public record PeriodSpec(long startSeconds, long endSeconds) {
    public static final long OPEN_END = Long.MAX_VALUE;

    public PeriodSpec {
        if (startSeconds > endSeconds) throw new IllegalArgumentException("start > end");
    }

    public static PeriodSpec all() {
        return new PeriodSpec(0, OPEN_END);
    }

    public static PeriodSpec of(long startSeconds) {
        return of(startSeconds, OPEN_END, Clock.systemUTC());
    }

    public static PeriodSpec of(long startSeconds, long endSeconds) {
        return of(startSeconds, endSeconds, Clock.systemUTC());
    }

    public static PeriodSpec of(long startSeconds, long endSeconds, Clock clock) {
        check(startSeconds, endSeconds, clock);
        return new PeriodSpec(startSeconds, endSeconds);
    }

    /** From now minus the duration, open-ended. Ignores calendars and time zones. */
    public static PeriodSpec last(Duration duration) {
        return last(duration, Clock.systemUTC());
    }

    public static PeriodSpec last(Duration duration, Clock clock) {
        return of(clock.instant().minus(duration).getEpochSecond(), OPEN_END, clock);
    }

    /** From the market close (16:00 local) of the start date, open-ended. */
    public static PeriodSpec ofDates(ZoneId zone, LocalDate start) {
        return ofDates(zone, start, null, Clock.systemUTC());
    }

    /** Between the market closes (16:00 local) of both dates. */
    public static PeriodSpec ofDates(ZoneId zone, LocalDate start, LocalDate end) {
        return ofDates(zone, start, end, Clock.systemUTC());
    }

    public static PeriodSpec ofDates(ZoneId zone, LocalDate start, LocalDate end, Clock clock) {
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(start, "start");
        long s = MarketTime.closeSeconds(start, zone);
        long e = end == null ? OPEN_END : MarketTime.closeSeconds(end, zone);
        return of(s, e, clock);
    }

    public boolean isOpenEnded() {
        return endSeconds == OPEN_END;
    }

    private static void check(long start, long end, Clock clock) {
        if (start > clock.instant().getEpochSecond()) throw new IllegalArgumentException("start > now");
        if (start > end) throw new IllegalArgumentException("start > end");
    }
}
