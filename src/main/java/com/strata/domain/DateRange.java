package com.strata.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Represents an inclusive time range for query scoping
 */
public class DateRange {
    private final Instant startDate;
    private final Instant endDate;

    public DateRange(Instant startDate, Instant endDate) {
        this.startDate = Objects.requireNonNull(startDate, "startDate");
        this.endDate = Objects.requireNonNull(endDate, "endDate");
    }

    /**
     * The trailing window ending at {@code now}.
     */
    public static DateRange lastDays(Instant now, int days) {
        return new DateRange(now.minus(Duration.ofDays(days)), now);
    }

    public Instant getStartDate() {
        return startDate;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public boolean isValid() {
        return !startDate.isAfter(endDate);
    }

    public Duration getDuration() {
        return Duration.between(startDate, endDate);
    }

    @Override
    public String toString() {
        return "[" + startDate + ", " + endDate + "]";
    }
}
