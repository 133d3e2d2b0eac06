package com.openstay.reservation.api.exception;

import com.openstay.common.dto.BaseResponse;
import com.openstay.common.util.Constants;
import com.openstay.reservation.exception.BookingAlreadyCancelledException;
import com.openstay.reservation.exception.ConcurrentConflictException;
import com.openstay.reservation.exception.NoAvailabilityException;
import com.openstay.reservation.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Reservation-specific status codes, checked before the common GlobalExceptionHandler.
 * Conflicts with current inventory state are 409; a lost race is marked retryable.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class ReservationExceptionHandler {

    @ExceptionHandler(NoAvailabilityException.class)
    public ResponseEntity<BaseResponse<?>> handleNoAvailability(NoAvailabilityException ex) {
        log.info("No availability: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(ConcurrentConflictException.class)
    public ResponseEntity<BaseResponse<?>> handleConcurrentConflict(ConcurrentConflictException ex) {
        log.warn("Allocation gave up after concurrent conflicts: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.retryableError(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BookingAlreadyCancelledException.class)
    public ResponseEntity<BaseResponse<?>> handleAlreadyCancelled(BookingAlreadyCancelledException ex) {
        log.info("Cancel rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    /**
     * Storage errors outside the allocation path (catalog, availability, lookups).
     */
    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<BaseResponse<?>> handleDataAccess(DataAccessException ex) {
        log.error("Storage failure", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(BaseResponse.error(StorageFailureException.MESSAGE, Constants.STORAGE_FAILURE));
    }
}
