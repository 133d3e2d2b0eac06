package com.openstay.common.util;

/**
 * Constants shared by the reservation modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    /** Redis lock key prefix, suffixed with the room category id. */
    public static final String CATEGORY_LOCK_PREFIX = "lock:category:";

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String STORAGE_FAILURE = "STORAGE_FAILURE";
}
