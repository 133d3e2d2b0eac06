package com.openstay.reservation.config;

import com.openstay.reservation.domain.model.ContactKeyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine configuration, bound once at startup from the {@code reservation.*} keys.
 */
@Data
@ConfigurationProperties(prefix = "reservation")
public class ReservationProperties {

    /** Accept stays whose check-in date is before today. */
    private boolean allowPastCheckIn = false;

    /** Longest stay, in nights, accepted for availability, quotes and bookings. */
    private int maxNights = 365;

    private Guest guest = new Guest();

    private Allocation allocation = new Allocation();

    private Redis redis = new Redis();

    @Data
    public static class Guest {
        /** Which guest attribute is the unique contact key. */
        private ContactKeyType contactKey = ContactKeyType.EMAIL;
    }

    @Data
    public static class Allocation {
        /** Bean name of the allocation strategy: pessimistic | serializable | distributed. */
        private String strategy = "pessimistic";

        /** Total attempts for one booking, including the first, when a concurrent conflict occurs. */
        private int maxAttempts = 3;

        private long initialBackoffMs = 50;

        private long maxBackoffMs = 500;

        /** How long an allocation waits for the category lock (row locks or the Redis lock). */
        private long lockWaitMs = 3000;

        /** Safety lease on the distributed lock in case the holder dies. */
        private long lockLeaseMs = 30000;
    }

    @Data
    public static class Redis {
        private String address = "redis://localhost:6379";
    }
}
