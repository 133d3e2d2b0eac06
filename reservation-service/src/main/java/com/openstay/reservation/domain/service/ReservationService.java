package com.openstay.reservation.domain.service;

import com.openstay.common.exception.BusinessException;
import com.openstay.reservation.api.dto.AvailabilityResponse;
import com.openstay.reservation.api.dto.BookingResponse;
import com.openstay.reservation.api.dto.CreateBookingRequest;
import com.openstay.reservation.api.dto.QuoteResponse;
import com.openstay.reservation.config.ReservationProperties;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.model.StayInterval;
import com.openstay.reservation.domain.strategy.AllocationCommand;
import com.openstay.reservation.domain.strategy.AllocationResult;
import com.openstay.reservation.domain.strategy.AllocationStrategy;
import com.openstay.reservation.exception.ConcurrentConflictException;
import com.openstay.reservation.exception.StayValidationException;
import com.openstay.reservation.exception.StorageFailureException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.client.RedisException;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Entry point for availability, quotes and bookings.
 *
 * Allocation strategies are injected as a map keyed by bean name (pessimistic, serializable,
 * distributed) and one is selected with {@code reservation.allocation.strategy}.
 * A booking attempt that loses a race is re-run as a whole by {@code allocationRetryTemplate};
 * every other failure is returned to the caller as is.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReservationService {

    private static final String DEFAULT_STRATEGY = "pessimistic";

    private final Map<String, AllocationStrategy> allocationStrategies;
    private final CategoryCatalog categoryCatalog;
    private final AvailabilityService availabilityService;
    private final ReservationRequestValidator validator;
    private final RetryTemplate allocationRetryTemplate;
    private final ReservationProperties properties;

    @PostConstruct
    public void init() {
        AllocationStrategy strategy = getAllocationStrategy();
        log.info("Initialized ReservationService with strategy: {} (max attempts {})",
                strategy.getStrategyType(), properties.getAllocation().getMaxAttempts());
    }

    /**
     * Advisory: the rooms reported free here are not held for the caller.
     */
    public AvailabilityResponse checkAvailability(String categoryLabel, String checkIn, String checkOut) {
        StayInterval stay = validator.parseStay(checkIn, checkOut);
        RoomCategory category = categoryCatalog.resolve(categoryLabel);
        List<RoomUnit> free = availabilityService.findFreeUnits(category, stay);
        return new AvailabilityResponse(
                category.getName(),
                stay.checkIn(),
                stay.checkOut(),
                free.size(),
                free.stream().map(RoomUnit::getRoomNumber).toList());
    }

    /**
     * Price of a stay without checking availability.
     */
    public QuoteResponse quote(String categoryLabel, String checkIn, String checkOut) {
        StayInterval stay = validator.parseStay(checkIn, checkOut);
        RoomCategory category = categoryCatalog.resolve(categoryLabel);
        return new QuoteResponse(
                category.getName(),
                stay.checkIn(),
                stay.checkOut(),
                stay.nights(),
                category.getBasePrice(),
                validator.priceStay(category, stay));
    }

    public BookingResponse book(CreateBookingRequest request) {
        StayInterval stay = validator.parseStay(request.checkIn(), request.checkOut());
        AllocationCommand command = new AllocationCommand(
                request.category(),
                stay,
                validator.normalizeContact(request.contact()),
                validator.requireGuestName(request.guestName()));

        AllocationStrategy strategy = getAllocationStrategy();
        log.debug("Booking {} for {} using strategy: {}", command.categoryLabel(), stay, strategy.getStrategyType());

        AllocationResult result = allocationRetryTemplate.execute(context -> {
            if (context.getRetryCount() > 0) {
                log.warn("Retrying allocation of {} for {} (attempt {}) after: {}", command.categoryLabel(), stay,
                        context.getRetryCount() + 1, context.getLastThrowable().getMessage());
            }
            return attemptAllocation(strategy, command);
        });

        log.info("Booking {} confirmed: room {} ({}) for {}, total {}", result.booking().getId(),
                result.roomUnit().getRoomNumber(), result.category().getName(), stay,
                result.booking().getTotalAmount());
        return BookingResponse.from(result);
    }

    private AllocationResult attemptAllocation(AllocationStrategy strategy, AllocationCommand command) {
        try {
            return strategy.allocate(command);
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            if (ConflictClassifier.isConcurrentConflict(e)) {
                log.warn("Concurrent conflict while allocating {} for {}: {}",
                        command.categoryLabel(), command.stay(), e.getMessage());
                throw new ConcurrentConflictException(
                        "Another booking competed for the same rooms. Please try again.", e);
            }
            if (ConflictClassifier.isInvalidData(e)) {
                log.warn("Rejected value while allocating {} for {}: {}",
                        command.categoryLabel(), command.stay(), e.getMessage());
                throw new StayValidationException("The booking request contains a value that cannot be stored", e);
            }
            if (e instanceof DataAccessException || e instanceof TransactionException || e instanceof RedisException) {
                log.error("Storage failure while allocating {} for {}", command.categoryLabel(), command.stay(), e);
                throw new StorageFailureException(e);
            }
            throw e;
        }
    }

    /**
     * Looks the configured strategy up by bean name, falling back to pessimistic locking.
     */
    private AllocationStrategy getAllocationStrategy() {
        String strategyKey = properties.getAllocation().getStrategy().toLowerCase(Locale.ROOT);
        AllocationStrategy strategy = allocationStrategies.get(strategyKey);
        if (strategy == null) {
            log.warn("Unknown strategy type: {}. Available strategies: {}. Defaulting to {}",
                    strategyKey, allocationStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = allocationStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(DEFAULT_STRATEGY + " strategy not found. Available strategies: "
                        + allocationStrategies.keySet());
            }
        }
        return strategy;
    }
}
