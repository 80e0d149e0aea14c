package com.openstay.inventory.domain.strategy;

import com.openstay.common.util.DateRange;

/**
 * Concurrency-control mechanism used by the ledger to move {@code reservedCount}.
 *
 * Implementations (bean names, selected by {@code inventory.ledger.strategy}):
 * - pessimistic: SELECT FOR UPDATE on the cells, then a guarded in-memory update
 * - atomic: one guarded UPDATE per night, no entity state involved
 * - distributed: Redisson lock per (hotel, room type) around the atomic update
 *
 * Every method runs inside the caller's transaction; a failure on any night must
 * surface as an exception so the caller's transaction rolls back the nights already done.
 */
public interface LedgerStrategy {

    /**
     * Reserves {@code quantity} rooms of one type for every night of the range.
     *
     * @throws com.openstay.common.exception.InsufficientAvailabilityException on the first night that cannot be covered
     */
    void reserve(Long hotelId, String roomType, DateRange range, int quantity);

    /**
     * Gives back {@code quantity} rooms of one type for every night of the range.
     *
     * @throws com.openstay.common.exception.InventoryUnderflowException when a night holds fewer reserved rooms
     */
    void release(Long hotelId, String roomType, DateRange range, int quantity);

    String getStrategyType();
}
