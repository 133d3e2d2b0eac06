package com.openstay.reservation.api.dto;

import java.time.LocalDate;
import java.util.List;

public record AvailabilityResponse(
        String category,
        LocalDate checkIn,
        LocalDate checkOut,
        int availableRooms,
        List<String> roomNumbers
) {
    public boolean available() {
        return availableRooms > 0;
    }
}
