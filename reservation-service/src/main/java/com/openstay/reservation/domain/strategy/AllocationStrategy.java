package com.openstay.reservation.domain.strategy;

/**
 * Concurrency-control mechanism around one allocation transaction.
 *
 * Every implementation must guarantee that two concurrent calls can never both commit the
 * same room for overlapping stays. Implementations (bean names):
 * - pessimistic: row locks on the category's rooms (SELECT FOR UPDATE)
 * - serializable: SERIALIZABLE isolation, conflicting transaction is aborted by the database
 * - distributed: Redis/Redisson lock per category around the transaction
 */
public interface AllocationStrategy {

    /**
     * Resolves the category, claims one free room and commits the booking, atomically.
     *
     * @throws com.openstay.reservation.exception.CategoryNotFoundException no category matches the label
     * @throws com.openstay.reservation.exception.NoAvailabilityException every room is taken
     * @throws com.openstay.reservation.exception.ConcurrentConflictException the lock could not be obtained
     */
    AllocationResult allocate(AllocationCommand command);

    /**
     * Returns the strategy type name for identification in logs.
     */
    String getStrategyType();
}
