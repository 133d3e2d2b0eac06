package com.openstay.reservation.api.controller;

import com.openstay.common.dto.BaseResponse;
import com.openstay.reservation.api.dto.AvailabilityResponse;
import com.openstay.reservation.api.dto.BookingResponse;
import com.openstay.reservation.api.dto.CancelBookingRequest;
import com.openstay.reservation.api.dto.CategoryResponse;
import com.openstay.reservation.api.dto.CreateBookingRequest;
import com.openstay.reservation.api.dto.QuoteResponse;
import com.openstay.reservation.domain.service.BookingLifecycleService;
import com.openstay.reservation.domain.service.CategoryCatalog;
import com.openstay.reservation.domain.service.ReservationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST adapter over the reservation engine. Every response carries a human-readable
 * {@code message} next to the structured {@code data}.
 */
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final CategoryCatalog categoryCatalog;
    private final ReservationService reservationService;
    private final BookingLifecycleService lifecycleService;

    @GetMapping("/categories")
    public ResponseEntity<BaseResponse<List<CategoryResponse>>> listCategories() {
        List<CategoryResponse> categories = categoryCatalog.listCategories().stream()
                .map(CategoryResponse::from)
                .toList();
        String listing = categories.stream()
                .map(CategoryResponse::listingLine)
                .collect(Collectors.joining("\n"));
        return ResponseEntity.ok(BaseResponse.success(listing, categories));
    }

    @GetMapping("/availability")
    public ResponseEntity<BaseResponse<AvailabilityResponse>> checkAvailability(
            @RequestParam String category,
            @RequestParam String checkIn,
            @RequestParam String checkOut) {
        AvailabilityResponse response = reservationService.checkAvailability(category, checkIn, checkOut);
        String message = response.available()
                ? String.format("%d %s room(s) available from %s to %s",
                        response.availableRooms(), response.category(), response.checkIn(), response.checkOut())
                : String.format("%s is not available from %s to %s",
                        response.category(), response.checkIn(), response.checkOut());
        return ResponseEntity.ok(BaseResponse.success(message, response));
    }

    /**
     * Price only; does not check availability.
     */
    @GetMapping("/quote")
    public ResponseEntity<BaseResponse<QuoteResponse>> quote(
            @RequestParam String category,
            @RequestParam String checkIn,
            @RequestParam String checkOut) {
        QuoteResponse response = reservationService.quote(category, checkIn, checkOut);
        String message = String.format("%d night(s) in %s: $%s",
                response.nights(), response.category(), response.totalPrice().toPlainString());
        return ResponseEntity.ok(BaseResponse.success(message, response));
    }

    @PostMapping("/bookings")
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = reservationService.book(request);
        String message = String.format("Booking confirmed! Booking #%d, room %s, total $%s",
                response.id(), response.roomNumber(), response.totalAmount().toPlainString());
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success(message, response));
    }

    @PostMapping("/bookings/{bookingId}/cancel")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(
            @PathVariable Long bookingId,
            @Valid @RequestBody CancelBookingRequest request) {
        BookingResponse response = lifecycleService.cancel(bookingId, request.contact());
        return ResponseEntity.ok(BaseResponse.success(
                String.format("Booking #%d has been cancelled", bookingId), response));
    }

    @GetMapping("/bookings/{bookingId}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @PathVariable Long bookingId,
            @RequestParam String contact) {
        return ResponseEntity.ok(BaseResponse.success(lifecycleService.findBooking(bookingId, contact)));
    }

    @GetMapping("/bookings")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> listBookings(@RequestParam String contact) {
        List<BookingResponse> bookings = lifecycleService.listBookings(contact);
        return ResponseEntity.ok(BaseResponse.success(
                String.format("%d booking(s) found", bookings.size()), bookings));
    }
}
