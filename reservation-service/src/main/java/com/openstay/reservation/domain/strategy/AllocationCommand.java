package com.openstay.reservation.domain.strategy;

import com.openstay.reservation.domain.model.StayInterval;

/**
 * Validated input of one allocation attempt. {@code contactKey} is already normalized.
 */
public record AllocationCommand(
        String categoryLabel,
        StayInterval stay,
        String contactKey,
        String guestName
) {
}
