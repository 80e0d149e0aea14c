package com.openstay.inventory.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.api.dto.CellAvailability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNoException;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link RedisAvailabilityCache}: JSON round trip through Redis and
 * best-effort behaviour when Redis fails.
 */
@ExtendWith(MockitoExtension.class)
class RedisAvailabilityCacheTest {

    private static final LocalDate NIGHT = LocalDate.of(2026, 4, 1);

    @Mock
    private StringRedisTemplate stringRedisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private RedisAvailabilityCache cache;

    @BeforeEach
    void setUp() {
        lenient().when(stringRedisTemplate.opsForValue()).thenReturn(valueOps);
        cache = new RedisAvailabilityCache(stringRedisTemplate, objectMapper);
        ReflectionTestUtils.setField(cache, "ttlSeconds", 30L);
    }

    @Test
    @DisplayName("put() stores the night's cells with the staleness TTL and get() reads them back")
    void putThenGet_usesTtlAndKey() throws Exception {
        List<CellAvailability> cells = List.of(new CellAvailability("DELUXE", NIGHT, 5, 2, 3));

        cache.put(9L, NIGHT, cells);

        String json = objectMapper.writeValueAsString(cells);
        verify(valueOps).set("availability:9:2026-04-01", json, Duration.ofSeconds(30));

        given(valueOps.get("availability:9:2026-04-01")).willReturn(json);
        assertThat(cache.get(9L, NIGHT)).contains(cells);
    }

    @Test
    @DisplayName("get() treats a Redis failure as a miss")
    void get_redisDown_isMiss() {
        given(valueOps.get(anyString())).willThrow(new RedisConnectionFailureException("down"));

        assertThat(cache.get(9L, NIGHT)).isEmpty();
    }

    @Test
    @DisplayName("evict() deletes one key per night and swallows Redis failures")
    void evict_deletesEveryNight() {
        cache.evict(9L, DateRange.stay(NIGHT, NIGHT.plusDays(2)));

        verify(stringRedisTemplate).delete(argThat((Collection<String> keys) ->
                keys.containsAll(List.of("availability:9:2026-04-01", "availability:9:2026-04-02"))
                        && keys.size() == 2));

        given(stringRedisTemplate.delete(anyCollection())).willThrow(new RedisConnectionFailureException("down"));
        assertThatNoException().isThrownBy(() -> cache.evict(9L, DateRange.stay(NIGHT, NIGHT.plusDays(1))));
    }

    @Test
    @DisplayName("key layout is availability:{hotelId}:{date}")
    void keyLayout() {
        assertThat(RedisAvailabilityCache.key(3L, NIGHT)).isEqualTo("availability:3:2026-04-01");
    }
}
