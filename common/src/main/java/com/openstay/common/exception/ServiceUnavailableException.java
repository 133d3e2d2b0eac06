package com.openstay.common.exception;

/**
 * Thrown when a required dependency (database, lock service) failed for reasons that are not
 * the caller's fault. Mapped to HTTP 503 with an opaque message.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
