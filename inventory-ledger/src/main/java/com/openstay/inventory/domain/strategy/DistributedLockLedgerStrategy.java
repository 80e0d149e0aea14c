package com.openstay.inventory.domain.strategy;

import com.openstay.common.exception.TransactionConflictException;
import com.openstay.common.util.Constants;
import com.openstay.common.util.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.concurrent.TimeUnit;

/**
 * Ledger strategy using a Redisson lock per (hotel, room type) plus the guarded
 * UPDATE of {@link AtomicUpdateLedgerStrategy}.
 *
 * The lock coordinates service instances before they reach the database; the guarded
 * UPDATE alone already prevents overselling. The lock is held until the caller's
 * transaction completes, and the ledger takes room types in lexicographic order,
 * so two multi-type bookings never wait on each other in a cycle.
 */
@Slf4j
@Component("distributed")
@RequiredArgsConstructor
public class DistributedLockLedgerStrategy implements LedgerStrategy {

    private final RedissonClient redissonClient;
    private final AtomicUpdateLedgerStrategy atomicUpdate;

    @Value("${inventory.ledger.lock.wait-seconds:5}")
    private long lockWaitSeconds;

    @Value("${inventory.ledger.lock.lease-seconds:30}")
    private long lockLeaseSeconds;

    @Override
    public void reserve(Long hotelId, String roomType, DateRange range, int quantity) {
        RLock lock = acquire(hotelId, roomType);
        boolean handedOff = false;
        try {
            atomicUpdate.reserve(hotelId, roomType, range, quantity);
            handedOff = unlockAfterCompletion(lock);
        } finally {
            if (!handedOff) {
                unlock(lock);
            }
        }
    }

    @Override
    public void release(Long hotelId, String roomType, DateRange range, int quantity) {
        RLock lock = acquire(hotelId, roomType);
        boolean handedOff = false;
        try {
            atomicUpdate.release(hotelId, roomType, range, quantity);
            handedOff = unlockAfterCompletion(lock);
        } finally {
            if (!handedOff) {
                unlock(lock);
            }
        }
    }

    @Override
    public String getStrategyType() {
        return "DISTRIBUTED_LOCK";
    }

    private RLock acquire(Long hotelId, String roomType) {
        String lockKey = buildLockKey(hotelId, roomType);
        RLock lock = redissonClient.getLock(lockKey);
        try {
            boolean acquired = lock.tryLock(lockWaitSeconds, lockLeaseSeconds, TimeUnit.SECONDS);
            if (!acquired) {
                throw new TransactionConflictException(
                        "Unable to acquire inventory lock " + lockKey + ". Please try again.", null);
            }
            log.debug("Acquired distributed lock: {}", lockKey);
            return lock;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransactionConflictException("Interrupted while waiting for inventory lock " + lockKey, e);
        }
    }

    /**
     * Defers the unlock to the end of the surrounding transaction. Returns false when there
     * is no transaction synchronization, in which case the caller unlocks immediately.
     */
    private boolean unlockAfterCompletion(RLock lock) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                unlock(lock);
            }
        });
        return true;
    }

    private void unlock(RLock lock) {
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("Released distributed lock: {}", lock.getName());
        }
    }

    private String buildLockKey(Long hotelId, String roomType) {
        return Constants.LOCK_PREFIX + hotelId + ":" + roomType;
    }
}
