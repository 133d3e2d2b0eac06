package com.openstay.reservation.exception;

import com.openstay.common.exception.BusinessException;

public class BookingAlreadyCancelledException extends BusinessException {

    public BookingAlreadyCancelledException(Long bookingId) {
        super(String.format("Booking #%d is already cancelled", bookingId), "BOOKING_ALREADY_CANCELLED");
    }
}
