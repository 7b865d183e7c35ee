package io.yahoohistory.financial;

import java.time.LocalDate;

/** One dated row of a download. The date is in the exchange's time zone, as the service sends it. */
public interface Tick {
    LocalDate date();
}
