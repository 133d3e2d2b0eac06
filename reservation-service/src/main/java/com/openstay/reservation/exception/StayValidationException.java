package com.openstay.reservation.exception;

import com.openstay.common.exception.BusinessException;
import com.openstay.common.util.Constants;

/**
 * Malformed or out-of-policy request input: unparseable dates, check-out not after check-in,
 * past check-in, blank category or contact. Surfaced immediately, never retried.
 */
public class StayValidationException extends BusinessException {

    public StayValidationException(String message) {
        super(message, Constants.VALIDATION_ERROR);
    }

    public StayValidationException(String message, Throwable cause) {
        super(message, cause, Constants.VALIDATION_ERROR);
    }
}
