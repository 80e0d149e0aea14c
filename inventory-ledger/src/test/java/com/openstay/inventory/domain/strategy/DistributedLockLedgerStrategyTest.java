package com.openstay.inventory.domain.strategy;

import com.openstay.common.exception.InsufficientAvailabilityException;
import com.openstay.common.exception.TransactionConflictException;
import com.openstay.common.util.DateRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.LocalDate;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link DistributedLockLedgerStrategy}: lock per (hotel, room type),
 * delegation to the guarded UPDATE, and unlock on every path.
 */
@ExtendWith(MockitoExtension.class)
class DistributedLockLedgerStrategyTest {

    private static final DateRange STAY = DateRange.stay(LocalDate.of(2026, 1, 1), LocalDate.of(2026, 1, 3));

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private AtomicUpdateLedgerStrategy atomicUpdate;

    @Mock
    private RLock lock;

    private DistributedLockLedgerStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new DistributedLockLedgerStrategy(redissonClient, atomicUpdate);
        ReflectionTestUtils.setField(strategy, "lockWaitSeconds", 5L);
        ReflectionTestUtils.setField(strategy, "lockLeaseSeconds", 30L);
    }

    @Test
    @DisplayName("reserve() locks hotel and room type, delegates, then unlocks")
    void reserve_locksDelegatesAndUnlocks() throws Exception {
        given(redissonClient.getLock("lock:inventory:7:DELUXE")).willReturn(lock);
        given(lock.tryLock(5L, 30L, TimeUnit.SECONDS)).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);

        strategy.reserve(7L, "DELUXE", STAY, 2);

        verify(atomicUpdate).reserve(7L, "DELUXE", STAY, 2);
        verify(lock).unlock();
    }

    @Test
    @DisplayName("reserve() still unlocks when the guarded UPDATE finds no capacity")
    void reserve_unlocksOnFailure() throws Exception {
        given(redissonClient.getLock(anyString())).willReturn(lock);
        given(lock.tryLock(5L, 30L, TimeUnit.SECONDS)).willReturn(true);
        given(lock.isHeldByCurrentThread()).willReturn(true);
        willThrow(new InsufficientAvailabilityException(7L, "DELUXE", STAY.start(), 2))
                .given(atomicUpdate).reserve(7L, "DELUXE", STAY, 2);

        assertThatThrownBy(() -> strategy.reserve(7L, "DELUXE", STAY, 2))
                .isInstanceOf(InsufficientAvailabilityException.class);
        verify(lock).unlock();
    }

    @Test
    @DisplayName("lock timeout surfaces as a retryable transaction conflict without touching the ledger")
    void reserve_lockNotAcquired_conflict() throws Exception {
        given(redissonClient.getLock(anyString())).willReturn(lock);
        given(lock.tryLock(5L, 30L, TimeUnit.SECONDS)).willReturn(false);

        assertThatThrownBy(() -> strategy.release(7L, "DELUXE", STAY, 1))
                .isInstanceOf(TransactionConflictException.class)
                .extracting("errorCode")
                .isEqualTo("TRANSACTION_CONFLICT");
        verify(atomicUpdate, never()).release(any(), anyString(), any(), anyInt());
        verify(lock, never()).unlock();
    }
}
