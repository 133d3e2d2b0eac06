package com.openstay.reservation.domain.strategy;

import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.model.RoomUnit;
import com.openstay.reservation.domain.repository.RoomUnitRepository;
import com.openstay.reservation.domain.service.CategoryCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Allocation under SERIALIZABLE isolation, without explicit locks.
 *
 * Two transactions that both see the same room as free and both insert an assignment form a
 * read/write dependency cycle; the database aborts one of them (SQLSTATE 40001) either at the
 * insert or at commit. The caller classifies that as a concurrent conflict and re-runs the
 * allocation, which then sees the winner's assignment.
 *
 * No blocking between requests, at the price of retries under contention.
 */
@Slf4j
@Component("serializable")
@RequiredArgsConstructor
public class SerializableAllocationStrategy implements AllocationStrategy {

    private final CategoryCatalog categoryCatalog;
    private final RoomUnitRepository roomUnitRepository;
    private final RoomAllocator roomAllocator;

    @Override
    @Transactional(isolation = Isolation.SERIALIZABLE)
    public AllocationResult allocate(AllocationCommand command) {
        RoomCategory category = categoryCatalog.resolve(command.categoryLabel());
        List<RoomUnit> units = roomUnitRepository.findByCategoryIdOrderByIdAsc(category.getId());
        return roomAllocator.allocate(category, units, command);
    }

    @Override
    public String getStrategyType() {
        return "SERIALIZABLE";
    }
}
