package com.openstay.reservation.domain.strategy;

import com.openstay.reservation.domain.model.Booking;
import com.openstay.reservation.domain.model.Guest;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;

/**
 * What a committed allocation produced.
 */
public record AllocationResult(
        Booking booking,
        Guest guest,
        RoomCategory category,
        RoomUnit roomUnit
) {
}
