package com.openstay.reservation.domain.strategy;

import com.openstay.reservation.config.ReservationProperties;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.repository.RoomUnitRepository;
import com.openstay.reservation.domain.service.CategoryCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Allocation using pessimistic row locks (SELECT FOR UPDATE) on the category's rooms.
 *
 * Flow:
 * 1. Bound lock waits to {@code reservation.allocation.lock-wait-ms}, then lock every room row
 *    of the category, ascending id (fixed order, no lock cycles)
 * 2. Read confirmed commitments; the statement sees everything committed before the lock was granted
 * 3. Pick a room and write booking + assignment
 * 4. Commit (releases locks)
 *
 * A second transaction for the same category blocks at step 1 until the first commits, then
 * sees its assignment at step 2. A wait longer than the lock timeout fails with SQLSTATE 55P03,
 * which the caller classifies as a concurrent conflict.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockAllocationStrategy implements AllocationStrategy {

    private final CategoryCatalog categoryCatalog;
    private final RoomUnitRepository roomUnitRepository;
    private final RoomAllocator roomAllocator;
    private final ReservationProperties properties;

    @Override
    @Transactional
    public AllocationResult allocate(AllocationCommand command) {
        RoomCategory category = categoryCatalog.resolve(command.categoryLabel());
        roomUnitRepository.setLocalLockTimeout(properties.getAllocation().getLockWaitMs() + "ms");
        List<RoomUnit> locked = roomUnitRepository.findByCategoryIdForUpdate(category.getId());
        log.debug("Locked {} rooms of category {}", locked.size(), category.getName());
        return roomAllocator.allocate(category, locked, command);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }
}
