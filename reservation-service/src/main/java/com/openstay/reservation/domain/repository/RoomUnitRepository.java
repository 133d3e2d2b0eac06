package com.openstay.reservation.domain.repository;

import com.openstay.reservation.domain.model.RoomUnit;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Repository for physical rooms. Results are always in ascending id order so that
 * allocation picks units deterministically and row locks are taken in a fixed order.
 */
public interface RoomUnitRepository extends JpaRepository<RoomUnit, Long> {

    List<RoomUnit> findByCategoryIdOrderByIdAsc(Long categoryId);

    /**
     * Locks every unit of the category (SELECT ... FOR UPDATE) for the rest of the transaction.
     * Two allocations for the same category therefore run one after the other; allocations for
     * different categories do not block each other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM RoomUnit u WHERE u.category.id = :categoryId ORDER BY u.id")
    List<RoomUnit> findByCategoryIdForUpdate(@Param("categoryId") Long categoryId);

    /**
     * Bounds every lock wait in the current transaction (PostgreSQL {@code lock_timeout},
     * transaction-local). A wait that exceeds it fails with SQLSTATE 55P03.
     *
     * @param timeout a PostgreSQL duration such as {@code 3000ms}
     */
    @Query(value = "SELECT set_config('lock_timeout', :timeout, true)", nativeQuery = true)
    String setLocalLockTimeout(@Param("timeout") String timeout);
}
