package com.openstay.reservation.exception;

import com.openstay.common.exception.BusinessException;

/**
 * Another transaction competed for the same inventory (lock timeout, deadlock, serialization
 * failure, duplicate guest insert). The whole allocation may be re-run.
 */
public class ConcurrentConflictException extends BusinessException {

    public ConcurrentConflictException(String message) {
        super(message, "CONCURRENT_CONFLICT");
    }

    public ConcurrentConflictException(String message, Throwable cause) {
        super(message, cause, "CONCURRENT_CONFLICT");
    }
}
