package com.openstay.reservation.exception;

import com.openstay.common.exception.ServiceUnavailableException;

/**
 * Infrastructure failure while talking to the database. Fatal to the request, not retried.
 */
public class StorageFailureException extends ServiceUnavailableException {

    public static final String MESSAGE = "Reservation storage is temporarily unavailable. Please try again later.";

    public StorageFailureException(Throwable cause) {
        super(MESSAGE, cause);
    }
}
