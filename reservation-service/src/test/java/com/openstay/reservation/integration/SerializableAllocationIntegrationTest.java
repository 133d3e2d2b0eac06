package com.openstay.reservation.integration;

import com.openstay.reservation.api.dto.BookingResponse;
import com.openstay.reservation.exception.ConcurrentConflictException;
import com.openstay.reservation.exception.NoAvailabilityException;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * The serializable strategy relies on the database aborting one of two conflicting
 * transactions. Aborts may be false positives, so fewer than the free rooms may succeed,
 * but never more.
 */
@SpringBootTest(properties = "reservation.allocation.strategy=serializable")
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class SerializableAllocationIntegrationTest extends ReservationIntegrationSupport {

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

    @Test
    void sequentialBookings_fillCategoryThenReject() {
        book("Guest A", "a@example.com", "2027-06-01", "2027-06-03");
        book("Guest B", "b@example.com", "2027-06-01", "2027-06-03");

        assertThatThrownBy(() -> book("Guest C", "c@example.com", "2027-06-02", "2027-06-03"))
                .isInstanceOf(NoAvailabilityException.class);
    }

    @Test
    void concurrentBookings_neverExceedFreeRooms() throws Exception {
        int threads = 6;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<BookingResponse>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String contact = "serial" + i + "@example.com";
            futures.add(executor.submit(() -> {
                start.await();
                return book("Guest " + contact, contact, "2027-10-01", "2027-10-03");
            }));
        }
        start.countDown();

        int succeeded = 0;
        try {
            for (Future<BookingResponse> future : futures) {
                try {
                    future.get(60, TimeUnit.SECONDS);
                    succeeded++;
                } catch (ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOfAny(NoAvailabilityException.class,
                            ConcurrentConflictException.class);
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(succeeded).isBetween(1, 2);
        assertThat(countOverlappingConfirmedAssignments()).isZero();
    }
}
