package com.openstay.common.util;

import com.openstay.common.exception.ValidationException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Half-open range of stay dates {@code [start, endExclusive)}: one entry per night.
 * An empty range ({@code start == endExclusive}) is allowed and covers no nights.
 */
public record DateRange(LocalDate start, LocalDate endExclusive) {

    public DateRange {
        if (start == null || endExclusive == null) {
            throw new ValidationException("dateRange", "Date range bounds cannot be null");
        }
        if (endExclusive.isBefore(start)) {
            throw new ValidationException("dateRange",
                    String.format("Date range end %s is before start %s", endExclusive, start));
        }
    }

    public static DateRange of(LocalDate start, LocalDate endExclusive) {
        return new DateRange(start, endExclusive);
    }

    /**
     * Range for a stay: check-in must be strictly before check-out.
     */
    public static DateRange stay(LocalDate checkIn, LocalDate checkOut) {
        if (checkIn == null || checkOut == null) {
            throw new ValidationException("dates", "Check-in and check-out dates are required");
        }
        if (!checkIn.isBefore(checkOut)) {
            throw new ValidationException("checkOutDate",
                    String.format("Check-in %s must be before check-out %s", checkIn, checkOut));
        }
        return new DateRange(checkIn, checkOut);
    }

    public int nights() {
        return (int) ChronoUnit.DAYS.between(start, endExclusive);
    }

    public boolean isEmpty() {
        return nights() == 0;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && date.isBefore(endExclusive);
    }

    /**
     * Nights of this range on or after {@code from}; empty once {@code from} reaches the end.
     */
    public DateRange remainingFrom(LocalDate from) {
        if (!from.isAfter(start)) {
            return this;
        }
        if (!from.isBefore(endExclusive)) {
            return new DateRange(endExclusive, endExclusive);
        }
        return new DateRange(from, endExclusive);
    }

    public List<LocalDate> days() {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate current = start;
        while (current.isBefore(endExclusive)) {
            dates.add(current);
            current = current.plusDays(1);
        }
        return dates;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + endExclusive + ")";
    }
}
