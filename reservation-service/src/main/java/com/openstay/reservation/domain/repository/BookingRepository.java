package com.openstay.reservation.domain.repository;

import com.openstay.reservation.domain.model.Booking;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Loads a booking only if it belongs to the guest with this contact key, locking the row
     * so a cancellation cannot interleave with another one.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id AND b.guest.contactKey = :contactKey")
    Optional<Booking> findByIdAndContactKeyForUpdate(@Param("id") Long id,
                                                     @Param("contactKey") String contactKey);

    @Query("SELECT b FROM Booking b JOIN FETCH b.guest g WHERE b.id = :id AND g.contactKey = :contactKey")
    Optional<Booking> findByIdAndContactKey(@Param("id") Long id,
                                            @Param("contactKey") String contactKey);

    @Query("SELECT b FROM Booking b JOIN FETCH b.guest g WHERE g.contactKey = :contactKey ORDER BY b.checkInDate, b.id")
    List<Booking> findByContactKey(@Param("contactKey") String contactKey);
}
