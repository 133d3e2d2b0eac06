package com.openstay.reservation.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Dates are ISO calendar dates (YYYY-MM-DD), parsed by the service so that a malformed date
 * gets the same error as any other invalid stay.
 */
public record CreateBookingRequest(
        @NotBlank(message = "Guest name cannot be blank")
        @Size(max = 100, message = "Guest name must be at most 100 characters")
        String guestName,

        @NotBlank(message = "Contact cannot be blank")
        @Size(max = 100, message = "Contact must be at most 100 characters")
        String contact,

        @NotBlank(message = "Category cannot be blank")
        String category,

        @NotBlank(message = "Check-in date cannot be blank")
        String checkIn,

        @NotBlank(message = "Check-out date cannot be blank")
        String checkOut
) {
}
