package com.openstay.reservation.api.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

public record QuoteResponse(
        String category,
        LocalDate checkIn,
        LocalDate checkOut,
        long nights,
        BigDecimal nightlyRate,
        BigDecimal totalPrice
) {
}
