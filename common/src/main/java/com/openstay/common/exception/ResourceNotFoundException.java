package com.openstay.common.exception;

/**
 * Exception thrown when a requested resource is not found (or must look that way to the caller).
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, "RESOURCE_NOT_FOUND");
    }

    public ResourceNotFoundException(String message, String errorCode) {
        super(message, errorCode);
    }
}
