package com.openstay.reservation.domain.service;

import com.openstay.reservation.api.dto.BookingResponse;
import com.openstay.reservation.config.ReservationProperties;
import com.openstay.reservation.domain.model.Booking;
import com.openstay.reservation.domain.model.Guest;
import com.openstay.reservation.domain.model.RoomAssignment;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.repository.BookingRepository;
import com.openstay.reservation.domain.repository.RoomAssignmentRepository;
import com.openstay.reservation.exception.BookingAlreadyCancelledException;
import com.openstay.reservation.exception.BookingNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class BookingLifecycleServiceTest {

    private static final Clock NOW = Clock.fixed(Instant.parse("2026-05-20T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private RoomAssignmentRepository assignmentRepository;

    private BookingLifecycleService service;
    private Guest guest;
    private RoomUnit room;

    @BeforeEach
    void setUp() {
        ReservationRequestValidator validator = new ReservationRequestValidator(new ReservationProperties(), NOW);
        service = new BookingLifecycleService(bookingRepository, assignmentRepository, validator, NOW);
        guest = Guest.builder().id(5L).contactKey("a@example.com").fullName("Guest A").build();
        RoomCategory deluxe = RoomCategory.builder().id(7L).name("Deluxe").basePrice(new BigDecimal("100.00")).build();
        room = RoomUnit.builder().id(1L).roomNumber("701").category(deluxe).build();
    }

    @Test
    void cancel_marksBookingCancelledAndKeepsAssignment() {
        Booking booking = booking(10L, Booking.BookingStatus.CONFIRMED);
        given(bookingRepository.findByIdAndContactKeyForUpdate(10L, "a@example.com")).willReturn(Optional.of(booking));
        given(assignmentRepository.findByBookingId(10L))
                .willReturn(Optional.of(RoomAssignment.builder().booking(booking).roomUnit(room).build()));

        BookingResponse response = service.cancel(10L, " A@example.com ");

        assertThat(booking.getStatus()).isEqualTo(Booking.BookingStatus.CANCELLED);
        assertThat(booking.getCancelledAt()).isEqualTo(LocalDateTime.of(2026, 5, 20, 10, 0));
        assertThat(booking.getUpdatedAt()).isEqualTo(booking.getCancelledAt());
        assertThat(response.status()).isEqualTo(Booking.BookingStatus.CANCELLED);
        assertThat(response.roomNumber()).isEqualTo("701");
        verify(bookingRepository).save(booking);
        verify(assignmentRepository, never()).delete(any());
    }

    @Test
    void cancel_otherContact_looksLikeMissingBooking() {
        given(bookingRepository.findByIdAndContactKeyForUpdate(10L, "b@example.com")).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.cancel(10L, "b@example.com"))
                .isInstanceOf(BookingNotFoundException.class)
                .hasMessage("Booking #10 was not found for this contact");
        verify(bookingRepository, never()).save(any());
    }

    @Test
    void cancel_twice_isRejectedWithoutMutation() {
        Booking booking = booking(10L, Booking.BookingStatus.CANCELLED);
        given(bookingRepository.findByIdAndContactKeyForUpdate(10L, "a@example.com")).willReturn(Optional.of(booking));

        assertThatThrownBy(() -> service.cancel(10L, "a@example.com"))
                .isInstanceOf(BookingAlreadyCancelledException.class)
                .extracting("errorCode")
                .isEqualTo("BOOKING_ALREADY_CANCELLED");
        assertThat(booking.getCancelledAt()).isNull();
        verify(bookingRepository, never()).save(any());
    }

    @Test
    void findBooking_requiresMatchingContact() {
        given(bookingRepository.findByIdAndContactKey(10L, "b@example.com")).willReturn(Optional.empty());

        assertThatThrownBy(() -> service.findBooking(10L, "b@example.com"))
                .isInstanceOf(BookingNotFoundException.class);
    }

    @Test
    void listBookings_attachesRoomNumbers() {
        Booking first = booking(10L, Booking.BookingStatus.CONFIRMED);
        Booking second = booking(11L, Booking.BookingStatus.CANCELLED);
        given(bookingRepository.findByContactKey("a@example.com")).willReturn(List.of(first, second));
        given(assignmentRepository.findByBookingIdIn(List.of(10L, 11L))).willReturn(List.of(
                RoomAssignment.builder().booking(first).roomUnit(room).build(),
                RoomAssignment.builder().booking(second).roomUnit(room).build()));

        List<BookingResponse> bookings = service.listBookings("a@example.com");

        assertThat(bookings).extracting(BookingResponse::id).containsExactly(10L, 11L);
        assertThat(bookings).extracting(BookingResponse::roomNumber).containsOnly("701");
    }

    @Test
    void listBookings_noBookings_skipsAssignmentLookup() {
        given(bookingRepository.findByContactKey("a@example.com")).willReturn(List.of());

        assertThat(service.listBookings("a@example.com")).isEmpty();
        verifyNoInteractions(assignmentRepository);
    }

    private Booking booking(Long id, Booking.BookingStatus status) {
        return Booking.builder()
                .id(id)
                .guest(guest)
                .checkInDate(LocalDate.of(2026, 6, 1))
                .checkOutDate(LocalDate.of(2026, 6, 3))
                .totalAmount(new BigDecimal("200.00"))
                .status(status)
                .build();
    }
}
