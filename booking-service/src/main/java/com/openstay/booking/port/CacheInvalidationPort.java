package com.openstay.booking.port;

import com.openstay.common.util.DateRange;

/**
 * Told after commit which nights of a hotel changed availability.
 */
public interface CacheInvalidationPort {

    void invalidate(Long hotelId, DateRange nights);
}
