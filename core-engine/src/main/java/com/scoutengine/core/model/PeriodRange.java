package com.scoutengine.core.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Inclusive date range used to request metric history.
 *
 * @since 1.0.0
 */
public final class PeriodRange {

    private final LocalDate start;
    private final LocalDate end;

    public PeriodRange(LocalDate start, LocalDate end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
    }

    public static PeriodRange of(LocalDate start, LocalDate end) {
        return new PeriodRange(start, end);
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    /**
     * @return {@code true} if the observation's period lies entirely inside
     *         this range
     */
    public boolean contains(MetricObservation observation) {
        return !observation.getPeriodStart().isBefore(start) && !observation.getPeriodEnd().isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PeriodRange that))
            return false;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
