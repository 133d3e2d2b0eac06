package com.openstay.reservation.api.dto;

import jakarta.validation.constraints.NotBlank;

public record CancelBookingRequest(
        @NotBlank(message = "Contact cannot be blank")
        String contact
) {
}
