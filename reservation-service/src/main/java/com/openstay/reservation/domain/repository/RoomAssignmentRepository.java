package com.openstay.reservation.domain.repository;

import com.openstay.reservation.domain.model.Booking;
import com.openstay.reservation.domain.model.RoomAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface RoomAssignmentRepository extends JpaRepository<RoomAssignment, Long> {

    /**
     * Confirmed assignments on the category's rooms that have not checked out by {@code from}.
     * Stays that ended on or before {@code from} can never overlap a stay starting at {@code from},
     * so they are pruned here; the actual overlap decision is made by
     * {@link com.openstay.reservation.domain.model.StayInterval#overlaps}.
     */
    @Query("""
           SELECT a FROM RoomAssignment a
           JOIN FETCH a.booking b
           JOIN FETCH a.roomUnit u
           WHERE u.category.id = :categoryId
             AND b.status = :status
             AND b.checkOutDate > :from
           ORDER BY u.id, b.checkInDate
           """)
    List<RoomAssignment> findCommitmentsForCategory(@Param("categoryId") Long categoryId,
                                                    @Param("status") Booking.BookingStatus status,
                                                    @Param("from") LocalDate from);

    @Query("SELECT a FROM RoomAssignment a JOIN FETCH a.roomUnit u JOIN FETCH u.category WHERE a.booking.id = :bookingId")
    Optional<RoomAssignment> findByBookingId(@Param("bookingId") Long bookingId);

    @Query("""
           SELECT a FROM RoomAssignment a
           JOIN FETCH a.roomUnit u
           JOIN FETCH u.category
           WHERE a.booking.id IN :bookingIds
           """)
    List<RoomAssignment> findByBookingIdIn(@Param("bookingIds") Collection<Long> bookingIds);
}
