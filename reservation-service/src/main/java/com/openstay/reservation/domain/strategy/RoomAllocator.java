package com.openstay.reservation.domain.strategy;

import com.openstay.reservation.domain.model.Booking;
import com.openstay.reservation.domain.model.Guest;
import com.openstay.reservation.domain.model.RoomAssignment;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.model.StayInterval;
import com.openstay.reservation.domain.repository.BookingRepository;
import com.openstay.reservation.domain.repository.GuestRepository;
import com.openstay.reservation.domain.repository.RoomAssignmentRepository;
import com.openstay.reservation.domain.service.AvailabilityService;
import com.openstay.reservation.domain.service.ReservationRequestValidator;
import com.openstay.reservation.exception.NoAvailabilityException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * The write steps shared by all allocation strategies. Must run inside the strategy's
 * transaction, after the strategy has done whatever it needs to make {@code candidates}
 * safe to choose from.
 *
 * Flow:
 * 1. Recompute free rooms from the current commitments (never a cached availability answer)
 * 2. Pick the free room with the lowest id
 * 3. Upsert the guest by contact key
 * 4. Price the stay (nights x base price), rejecting totals a booking cannot record
 * 5. Insert the CONFIRMED booking and its room assignment, then flush
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RoomAllocator {

    private final AvailabilityService availabilityService;
    private final GuestRepository guestRepository;
    private final BookingRepository bookingRepository;
    private final RoomAssignmentRepository assignmentRepository;
    private final ReservationRequestValidator validator;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public AllocationResult allocate(RoomCategory category, List<RoomUnit> candidates, AllocationCommand command) {
        StayInterval stay = command.stay();
        List<RoomUnit> free = AvailabilityService.computeFreeUnits(
                candidates, availabilityService.loadCommitments(category, stay), stay);
        if (free.isEmpty()) {
            log.info("No {} room free for {} ({} rooms in category)", category.getName(), stay, candidates.size());
            throw new NoAvailabilityException(category.getName(), stay);
        }
        RoomUnit room = free.get(0);

        BigDecimal total = validator.priceStay(category, stay);
        LocalDateTime now = LocalDateTime.now(clock);
        Guest guest = upsertGuest(command.contactKey(), command.guestName(), now);

        Booking booking = bookingRepository.save(Booking.builder()
                .guest(guest)
                .checkInDate(stay.checkIn())
                .checkOutDate(stay.checkOut())
                .totalAmount(total)
                .status(Booking.BookingStatus.CONFIRMED)
                .createdAt(now)
                .updatedAt(now)
                .build());
        assignmentRepository.save(RoomAssignment.builder()
                .booking(booking)
                .roomUnit(room)
                .assignedAt(now)
                .build());
        // Surface constraint violations here, inside the strategy, rather than at commit
        assignmentRepository.flush();

        log.debug("Allocated room {} to booking {} for {}", room.getRoomNumber(), booking.getId(), stay);
        return new AllocationResult(booking, guest, category, room);
    }

    private Guest upsertGuest(String contactKey, String guestName, LocalDateTime now) {
        return guestRepository.findByContactKey(contactKey)
                .map(existing -> {
                    if (!existing.getFullName().equals(guestName)) {
                        log.debug("Updating name of guest {} to '{}'", existing.getId(), guestName);
                        existing.rename(guestName, now);
                    }
                    return existing;
                })
                .orElseGet(() -> guestRepository.save(Guest.builder()
                        .contactKey(contactKey)
                        .fullName(guestName)
                        .createdAt(now)
                        .updatedAt(now)
                        .build()));
    }
}
