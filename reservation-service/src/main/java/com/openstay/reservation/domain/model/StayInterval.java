package com.openstay.reservation.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * A stay covering the half-open range {@code [checkIn, checkOut)} of whole calendar days.
 * A checkout on day D and a check-in on day D do not overlap.
 */
public record StayInterval(LocalDate checkIn, LocalDate checkOut) {

    public StayInterval {
        Objects.requireNonNull(checkIn, "checkIn");
        Objects.requireNonNull(checkOut, "checkOut");
        if (!checkOut.isAfter(checkIn)) {
            throw new IllegalArgumentException(
                    "Check-out date " + checkOut + " must be after check-in date " + checkIn);
        }
    }

    public static StayInterval of(LocalDate checkIn, LocalDate checkOut) {
        return new StayInterval(checkIn, checkOut);
    }

    /**
     * Half-open overlap test: {@code aStart < bEnd && bStart < aEnd}.
     */
    public static boolean overlaps(LocalDate aStart, LocalDate aEnd, LocalDate bStart, LocalDate bEnd) {
        return aStart.isBefore(bEnd) && bStart.isBefore(aEnd);
    }

    public boolean overlaps(StayInterval other) {
        return overlaps(checkIn, checkOut, other.checkIn, other.checkOut);
    }

    public boolean overlaps(LocalDate otherCheckIn, LocalDate otherCheckOut) {
        return overlaps(checkIn, checkOut, otherCheckIn, otherCheckOut);
    }

    /** Always at least 1. */
    public long nights() {
        return ChronoUnit.DAYS.between(checkIn, checkOut);
    }

    @Override
    public String toString() {
        return checkIn + ".." + checkOut;
    }
}
