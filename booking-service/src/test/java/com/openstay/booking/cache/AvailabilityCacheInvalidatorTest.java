package com.openstay.booking.cache;

import com.openstay.common.util.DateRange;
import com.openstay.inventory.cache.AvailabilityCache;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class AvailabilityCacheInvalidatorTest {

    @Mock
    private AvailabilityCache availabilityCache;

    @InjectMocks
    private AvailabilityCacheInvalidator invalidator;

    @Test
    @DisplayName("touched nights are evicted")
    void invalidate_evicts() {
        DateRange nights = DateRange.of(LocalDate.of(2026, 6, 3), LocalDate.of(2026, 6, 5));

        invalidator.invalidate(1L, nights);

        verify(availabilityCache).evict(1L, nights);
    }

    @Test
    @DisplayName("an empty range touches nothing")
    void invalidate_emptyRange() {
        LocalDate day = LocalDate.of(2026, 6, 5);

        invalidator.invalidate(1L, DateRange.of(day, day));

        verifyNoInteractions(availabilityCache);
    }
}
