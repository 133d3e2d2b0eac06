package com.openstay.reservation.domain.service;

import com.openstay.reservation.domain.model.Booking;
import com.openstay.reservation.domain.model.RoomAssignment;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.model.StayInterval;
import com.openstay.reservation.domain.repository.RoomAssignmentRepository;
import com.openstay.reservation.domain.repository.RoomUnitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes which rooms of a category are free for a stay.
 *
 * The public query is advisory: it reserves nothing, and a concurrent booking may take the
 * reported rooms before the caller acts. The allocation path re-runs
 * {@link #computeFreeUnits} inside its own transaction instead of trusting this result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AvailabilityService {

    private final RoomUnitRepository roomUnitRepository;
    private final RoomAssignmentRepository assignmentRepository;

    @Transactional(readOnly = true)
    public List<RoomUnit> findFreeUnits(RoomCategory category, StayInterval stay) {
        List<RoomUnit> units = roomUnitRepository.findByCategoryIdOrderByIdAsc(category.getId());
        List<RoomUnit> free = computeFreeUnits(units, loadCommitments(category, stay), stay);
        log.debug("Category {} has {}/{} free rooms for {}", category.getName(), free.size(), units.size(), stay);
        return free;
    }

    /**
     * Confirmed assignments of the category that could still overlap the stay.
     */
    public List<RoomAssignment> loadCommitments(RoomCategory category, StayInterval stay) {
        return assignmentRepository.findCommitmentsForCategory(
                category.getId(), Booking.BookingStatus.CONFIRMED, stay.checkIn());
    }

    /**
     * Units with no confirmed assignment overlapping {@code stay}, in the order given.
     * Cancelled bookings are ignored even if passed in.
     */
    public static List<RoomUnit> computeFreeUnits(List<RoomUnit> units,
                                                  Collection<RoomAssignment> commitments,
                                                  StayInterval stay) {
        Set<Long> occupied = new HashSet<>();
        for (RoomAssignment assignment : commitments) {
            Booking booking = assignment.getBooking();
            if (booking.isConfirmed() && stay.overlaps(booking.getCheckInDate(), booking.getCheckOutDate())) {
                occupied.add(assignment.getRoomUnit().getId());
            }
        }
        return units.stream()
                .filter(unit -> !occupied.contains(unit.getId()))
                .collect(Collectors.toList());
    }
}
