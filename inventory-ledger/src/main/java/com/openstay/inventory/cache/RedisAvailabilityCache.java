package com.openstay.inventory.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openstay.common.util.Constants;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.api.dto.CellAvailability;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Redis-backed availability cache. One key per (hotel, night) holding the JSON list of
 * that night's cells; the TTL is the staleness bound.
 * Every Redis failure is non-fatal: reads fall back to the database, writes and evictions are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "inventory.ledger.cache.enabled", havingValue = "true", matchIfMissing = true)
public class RedisAvailabilityCache implements AvailabilityCache {

    private static final TypeReference<List<CellAvailability>> CELL_LIST = new TypeReference<>() {
    };

    private final StringRedisTemplate stringRedisTemplate;
    private final ObjectMapper objectMapper;

    @Value("${inventory.ledger.cache.ttl-seconds:30}")
    private long ttlSeconds;

    @Override
    public Optional<List<CellAvailability>> get(Long hotelId, LocalDate stayDate) {
        try {
            String json = stringRedisTemplate.opsForValue().get(key(hotelId, stayDate));
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, CELL_LIST));
        } catch (Exception e) {
            log.debug("Availability cache read missed or failed for hotel {} on {}, falling back to DB: {}",
                    hotelId, stayDate, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(Long hotelId, LocalDate stayDate, List<CellAvailability> cells) {
        try {
            String json = objectMapper.writeValueAsString(cells);
            stringRedisTemplate.opsForValue().set(key(hotelId, stayDate), json, Duration.ofSeconds(ttlSeconds));
        } catch (Exception e) {
            log.warn("Failed to cache availability for hotel {} on {} (non-fatal)", hotelId, stayDate, e);
        }
    }

    @Override
    public void evict(Long hotelId, DateRange range) {
        if (range.isEmpty()) {
            return;
        }
        List<String> keys = range.days().stream().map(day -> key(hotelId, day)).toList();
        try {
            Long deleted = stringRedisTemplate.delete(keys);
            log.debug("Evicted {} availability cache entries for hotel {} over {}", deleted, hotelId, range);
        } catch (Exception e) {
            log.warn("Failed to evict availability cache for hotel {} over {} (non-fatal)", hotelId, range, e);
        }
    }

    static String key(Long hotelId, LocalDate stayDate) {
        return Constants.CACHE_AVAILABILITY_PREFIX + hotelId + ":" + stayDate;
    }
}
