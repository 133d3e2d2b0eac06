package com.openstay.reservation.integration;

import com.openstay.reservation.exception.ConcurrentConflictException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * A booking that cannot get the category's row locks within {@code lock-wait-ms} gives up
 * with a retryable conflict instead of waiting indefinitely.
 */
@SpringBootTest(properties = {
        "reservation.allocation.lock-wait-ms=200",
        "reservation.allocation.max-attempts=2"
})
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class LockTimeoutIntegrationTest extends ReservationIntegrationSupport {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("reservations")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    @DisplayName("rooms locked by another transaction: the booking times out as a concurrent conflict")
    void lockedRooms_timeOutAsConcurrentConflict() throws Exception {
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        TransactionTemplate holder = new TransactionTemplate(transactionManager);
        Future<?> lockHolder = executor.submit(() -> holder.executeWithoutResult(status -> {
            jdbcTemplate.queryForList("SELECT id FROM room_units WHERE category_id = ? FOR UPDATE", deluxe.getId());
            locked.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }));

        try {
            assertThat(locked.await(10, TimeUnit.SECONDS)).isTrue();
            long started = System.nanoTime();

            assertThatThrownBy(() -> book("Guest A", "a@example.com", "2027-06-01", "2027-06-03"))
                    .isInstanceOf(ConcurrentConflictException.class)
                    .extracting("errorCode")
                    .isEqualTo("CONCURRENT_CONFLICT");
            assertThat(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - started)).isLessThan(10);
        } finally {
            release.countDown();
            lockHolder.get(10, TimeUnit.SECONDS);
            executor.shutdownNow();
        }

        assertThat(book("Guest A", "a@example.com", "2027-06-01", "2027-06-03").roomNumber()).isEqualTo("D-1");
    }
}
