package com.openstay.reservation.domain.service;

import com.openstay.reservation.config.ReservationProperties;
import com.openstay.reservation.domain.model.ContactKeyType;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.StayInterval;
import com.openstay.reservation.exception.StayValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Turns raw request strings into validated values: ISO dates into a {@link StayInterval},
 * contact details into a normalized contact key.
 */
@Component
@RequiredArgsConstructor
public class ReservationRequestValidator {

    /** Column widths of {@code guests.full_name} and {@code guests.contact_key}. */
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_CONTACT_LENGTH = 100;

    /** Largest value of {@code bookings.total_amount NUMERIC(10, 2)}. */
    static final BigDecimal MAX_TOTAL_AMOUNT = new BigDecimal("99999999.99");

    private final ReservationProperties properties;
    private final Clock clock;

    public StayInterval parseStay(String checkIn, String checkOut) {
        LocalDate start = parseDate("check-in", checkIn);
        LocalDate end = parseDate("check-out", checkOut);
        return validateStay(start, end);
    }

    public StayInterval validateStay(LocalDate checkIn, LocalDate checkOut) {
        if (!checkOut.isAfter(checkIn)) {
            throw new StayValidationException(String.format(
                    "Check-out date %s must be at least one night after check-in date %s", checkOut, checkIn));
        }
        if (!properties.isAllowPastCheckIn() && checkIn.isBefore(LocalDate.now(clock))) {
            throw new StayValidationException(String.format("Check-in date %s is in the past", checkIn));
        }
        StayInterval stay = StayInterval.of(checkIn, checkOut);
        if (stay.nights() > properties.getMaxNights()) {
            throw new StayValidationException(String.format(
                    "Stays are limited to %d nights (requested %d)", properties.getMaxNights(), stay.nights()));
        }
        return stay;
    }

    /**
     * Total price of the stay, rejected when it exceeds what a booking can record.
     */
    public BigDecimal priceStay(RoomCategory category, StayInterval stay) {
        BigDecimal total = category.priceFor(stay);
        if (total.compareTo(MAX_TOTAL_AMOUNT) > 0) {
            throw new StayValidationException(String.format(
                    "A %d-night stay in %s exceeds the maximum booking amount", stay.nights(), category.getName()));
        }
        return total;
    }

    public String normalizeContact(String contact) {
        ContactKeyType type = properties.getGuest().getContactKey();
        if (contact == null || contact.isBlank()) {
            throw new StayValidationException("A contact " + type.name().toLowerCase(Locale.ROOT) + " is required");
        }
        String normalized = type.normalize(contact);
        if (!type.isValid(normalized)) {
            throw new StayValidationException(String.format(
                    "'%s' is not a valid %s", contact.trim(), type.name().toLowerCase(Locale.ROOT)));
        }
        if (normalized.length() > MAX_CONTACT_LENGTH) {
            throw new StayValidationException(String.format("The contact %s must be at most %d characters",
                    type.name().toLowerCase(Locale.ROOT), MAX_CONTACT_LENGTH));
        }
        return normalized;
    }

    public String requireGuestName(String guestName) {
        if (guestName == null || guestName.isBlank()) {
            throw new StayValidationException("Guest name is required");
        }
        String trimmed = guestName.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new StayValidationException("Guest name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new StayValidationException("The " + field + " date is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new StayValidationException(
                    String.format("Invalid %s date '%s', expected YYYY-MM-DD", field, value), e);
        }
    }
}
