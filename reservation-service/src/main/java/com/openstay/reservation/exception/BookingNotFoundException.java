package com.openstay.reservation.exception;

import com.openstay.common.exception.ResourceNotFoundException;

/**
 * Raised both when the booking does not exist and when it belongs to a different contact,
 * with the same message, so callers cannot probe for other guests' booking ids.
 */
public class BookingNotFoundException extends ResourceNotFoundException {

    public BookingNotFoundException(Long bookingId) {
        super(String.format("Booking #%d was not found for this contact", bookingId), "BOOKING_NOT_FOUND");
    }
}
