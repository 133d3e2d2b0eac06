package com.openstay.reservation.domain.strategy;

import com.openstay.common.util.Constants;
import com.openstay.reservation.config.ReservationProperties;
import com.openstay.reservation.domain.model.RoomCategory;
import com.openstay.reservation.domain.repository.RoomUnitRepository;
import com.openstay.reservation.domain.service.CategoryCatalog;
import com.openstay.reservation.exception.ConcurrentConflictException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.TimeUnit;

/**
 * Allocation serialized per category by a Redis/Redisson distributed lock.
 *
 * The lock is taken before the database transaction starts and released only after it has
 * committed or rolled back, so the next holder always reads the previous holder's writes.
 * Correct only while every writer of the category goes through this strategy.
 *
 * Lock key: {@code lock:category:<categoryId>}.
 */
@Slf4j
@Component("distributed")
@ConditionalOnProperty(name = "reservation.allocation.strategy", havingValue = "distributed")
public class DistributedLockAllocationStrategy implements AllocationStrategy {

    private final CategoryCatalog categoryCatalog;
    private final RoomUnitRepository roomUnitRepository;
    private final RoomAllocator roomAllocator;
    private final RedissonClient redissonClient;
    private final TransactionTemplate transactionTemplate;
    private final ReservationProperties properties;

    public DistributedLockAllocationStrategy(CategoryCatalog categoryCatalog,
                                             RoomUnitRepository roomUnitRepository,
                                             RoomAllocator roomAllocator,
                                             RedissonClient redissonClient,
                                             PlatformTransactionManager transactionManager,
                                             ReservationProperties properties) {
        this.categoryCatalog = categoryCatalog;
        this.roomUnitRepository = roomUnitRepository;
        this.roomAllocator = roomAllocator;
        this.redissonClient = redissonClient;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.properties = properties;
    }

    @Override
    public AllocationResult allocate(AllocationCommand command) {
        RoomCategory category = categoryCatalog.resolve(command.categoryLabel());
        String lockKey = Constants.CATEGORY_LOCK_PREFIX + category.getId();
        RLock lock = redissonClient.getLock(lockKey);
        ReservationProperties.Allocation settings = properties.getAllocation();

        try {
            boolean acquired = lock.tryLock(settings.getLockWaitMs(), settings.getLockLeaseMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new ConcurrentConflictException(
                        "Timed out waiting for the " + category.getName() + " inventory lock. Please try again.");
            }
            log.debug("Acquired distributed lock: {}", lockKey);
            return transactionTemplate.execute(status -> roomAllocator.allocate(
                    category, roomUnitRepository.findByCategoryIdOrderByIdAsc(category.getId()), command));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrentConflictException("Interrupted while waiting for the inventory lock", e);
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Released distributed lock: {}", lockKey);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }
}
