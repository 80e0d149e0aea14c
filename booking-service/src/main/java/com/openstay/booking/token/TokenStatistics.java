package com.openstay.booking.token;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Token counts of one hotel by status. Every status is present, zero when unused.
 */
public record TokenStatistics(Long hotelId, Map<TokenStatus, Long> byStatus, long total) {

    static TokenStatistics of(Long hotelId, List<CheckInTokenRepository.StatusCount> counts) {
        Map<TokenStatus, Long> byStatus = new EnumMap<>(TokenStatus.class);
        for (TokenStatus status : TokenStatus.values()) {
            byStatus.put(status, 0L);
        }
        long total = 0;
        for (CheckInTokenRepository.StatusCount count : counts) {
            byStatus.put(count.getStatus(), count.getTotal());
            total += count.getTotal();
        }
        return new TokenStatistics(hotelId, Collections.unmodifiableMap(byStatus), total);
    }
}
