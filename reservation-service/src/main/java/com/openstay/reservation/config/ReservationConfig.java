package com.openstay.reservation.config;

import com.openstay.reservation.exception.ConcurrentConflictException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

import java.time.Clock;

@Configuration
public class ReservationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Re-runs a whole allocation transaction after a {@link ConcurrentConflictException}.
     * Nothing else is retried.
     */
    @Bean
    public RetryTemplate allocationRetryTemplate(ReservationProperties properties) {
        ReservationProperties.Allocation allocation = properties.getAllocation();
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, allocation.getMaxAttempts()))
                .exponentialBackoff(allocation.getInitialBackoffMs(), 2.0, allocation.getMaxBackoffMs())
                .retryOn(ConcurrentConflictException.class)
                .build();
    }
}
