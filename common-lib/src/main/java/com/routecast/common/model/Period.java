package com.routecast.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Comparator;

/**
 * One weekly evaluation unit, ordered by {@code (year, week)}.
 *
 * <p>Weeks 1..53 are accepted. {@link #plusWeeks(int)} follows ISO-8601 week numbering.
 */
public record Period(
    @JsonProperty("week") int week,
    @JsonProperty("year") int year
) implements Comparable<Period> {

    static final int MAX_WEEK = 53;

    private static final Comparator<Period> ORDER =
        Comparator.comparingInt(Period::year).thenComparingInt(Period::week);

    public Period {
        if (week < 1 || week > MAX_WEEK) {
            throw new IllegalArgumentException("week must be within [1, 53], got " + week);
        }
        if (year < 1) {
            throw new IllegalArgumentException("year must be positive, got " + year);
        }
    }

    public static Period of(int week, int year) {
        return new Period(week, year);
    }

    /**
     * Advances along the ISO-8601 week calendar, so a 53-week year such as 2026 yields
     * week 53 before rolling over. Week 53 given for a 52-week year is read as that
     * year's last week.
     */
    public Period plusWeeks(int weeks) {
        if (weeks < 0) {
            throw new IllegalArgumentException("weeks must be non-negative, got " + weeks);
        }
        if (weeks == 0) {
            return this;
        }
        LocalDate monday = mondayOfWeekOne(year).plusWeeks(Math.min(week, weeksIn(year)) - 1L + weeks);
        return new Period(monday.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR), monday.get(IsoFields.WEEK_BASED_YEAR));
    }

    /** 52 or 53. */
    static int weeksIn(int year) {
        return (int) LocalDate.of(year, 6, 1).range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
    }

    private static LocalDate mondayOfWeekOne(int year) {
        return LocalDate.of(year, 1, 4).with(DayOfWeek.MONDAY);
    }

    public boolean isAfter(Period other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Period other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return year + "-W" + week;
    }
}
