package com.openstay.reservation.domain.service;

import com.openstay.reservation.api.dto.BookingResponse;
import com.openstay.reservation.domain.model.Booking;
import com.openstay.reservation.domain.model.RoomAssignment;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.repository.BookingRepository;
import com.openstay.reservation.domain.repository.RoomAssignmentRepository;
import com.openstay.reservation.exception.BookingAlreadyCancelledException;
import com.openstay.reservation.exception.BookingNotFoundException;
import com.openstay.reservation.exception.StayValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Operations on existing bookings. A booking is only visible to the contact that made it.
 * Cancelling keeps the booking and its room assignment; the room becomes free because only
 * CONFIRMED bookings count as commitments.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingLifecycleService {

    private final BookingRepository bookingRepository;
    private final RoomAssignmentRepository assignmentRepository;
    private final ReservationRequestValidator validator;
    private final Clock clock;

    @Transactional
    public BookingResponse cancel(Long bookingId, String contact) {
        requireBookingId(bookingId);
        String contactKey = validator.normalizeContact(contact);
        Booking booking = bookingRepository.findByIdAndContactKeyForUpdate(bookingId, contactKey)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        if (!booking.isConfirmed()) {
            throw new BookingAlreadyCancelledException(bookingId);
        }
        booking.cancel(LocalDateTime.now(clock));
        bookingRepository.save(booking);
        log.info("Booking {} cancelled ({} to {})", bookingId, booking.getCheckInDate(), booking.getCheckOutDate());
        return BookingResponse.from(booking, roomOf(bookingId));
    }

    @Transactional(readOnly = true)
    public BookingResponse findBooking(Long bookingId, String contact) {
        requireBookingId(bookingId);
        String contactKey = validator.normalizeContact(contact);
        Booking booking = bookingRepository.findByIdAndContactKey(bookingId, contactKey)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        return BookingResponse.from(booking, roomOf(bookingId));
    }

    /**
     * All bookings of the contact, cancelled ones included, by check-in date.
     */
    @Transactional(readOnly = true)
    public List<BookingResponse> listBookings(String contact) {
        String contactKey = validator.normalizeContact(contact);
        List<Booking> bookings = bookingRepository.findByContactKey(contactKey);
        if (bookings.isEmpty()) {
            return List.of();
        }
        Map<Long, RoomUnit> rooms = assignmentRepository
                .findByBookingIdIn(bookings.stream().map(Booking::getId).toList())
                .stream()
                .collect(Collectors.toMap(a -> a.getBooking().getId(), RoomAssignment::getRoomUnit));
        return bookings.stream()
                .map(b -> BookingResponse.from(b, rooms.get(b.getId())))
                .toList();
    }

    private RoomUnit roomOf(Long bookingId) {
        return assignmentRepository.findByBookingId(bookingId)
                .map(RoomAssignment::getRoomUnit)
                .orElse(null);
    }

    private static void requireBookingId(Long bookingId) {
        if (bookingId == null || bookingId <= 0) {
            throw new StayValidationException("A valid booking number is required");
        }
    }
}
