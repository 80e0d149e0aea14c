package com.openstay.booking.cache;

import com.openstay.booking.port.CacheInvalidationPort;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.cache.AvailabilityCache;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Drops cached availability for nights a committed booking transition touched.
 */
@Component
@RequiredArgsConstructor
public class AvailabilityCacheInvalidator implements CacheInvalidationPort {

    private final AvailabilityCache availabilityCache;

    @Override
    public void invalidate(Long hotelId, DateRange nights) {
        if (!nights.isEmpty()) {
            availabilityCache.evict(hotelId, nights);
        }
    }
}
