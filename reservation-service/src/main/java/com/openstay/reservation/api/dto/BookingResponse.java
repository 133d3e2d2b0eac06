package com.openstay.reservation.api.dto;

import com.openstay.reservation.domain.model.Booking;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.strategy.AllocationResult;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record BookingResponse(
        Long id,
        String guestName,
        String contact,
        String category,
        String roomNumber,
        LocalDate checkIn,
        LocalDate checkOut,
        long nights,
        BigDecimal totalAmount,
        Booking.BookingStatus status,
        LocalDateTime createdAt,
        LocalDateTime cancelledAt
) {
    /**
     * Guest, room and category must be initialized (call inside the loading transaction).
     */
    public static BookingResponse from(Booking booking, RoomUnit room) {
        return new BookingResponse(
                booking.getId(),
                booking.getGuest().getFullName(),
                booking.getGuest().getContactKey(),
                room != null ? room.getCategory().getName() : null,
                room != null ? room.getRoomNumber() : null,
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.stay().nights(),
                booking.getTotalAmount(),
                booking.getStatus(),
                booking.getCreatedAt(),
                booking.getCancelledAt()
        );
    }

    public static BookingResponse from(AllocationResult result) {
        Booking booking = result.booking();
        return new BookingResponse(
                booking.getId(),
                result.guest().getFullName(),
                result.guest().getContactKey(),
                result.category().getName(),
                result.roomUnit().getRoomNumber(),
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.stay().nights(),
                booking.getTotalAmount(),
                booking.getStatus(),
                booking.getCreatedAt(),
                booking.getCancelledAt()
        );
    }
}
