package com.openstay.reservation.exception;

import com.openstay.common.exception.BusinessException;
import com.openstay.reservation.domain.model.StayInterval;

/**
 * Expected outcome when every room of the category is taken for part of the stay.
 */
public class NoAvailabilityException extends BusinessException {

    public NoAvailabilityException(String categoryName, StayInterval stay) {
        super(String.format("Sorry, %s is sold out from %s to %s",
                categoryName, stay.checkIn(), stay.checkOut()), "NO_AVAILABILITY");
    }
}
