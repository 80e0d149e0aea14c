package com.openstay.booking.token;

import com.openstay.common.exception.TokenRateLimitedException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Caps on-demand token generation per customer. Each customer gets its own limiter built
 * from the {@code resilience4j.ratelimiter.configs.checkin-token-issue} settings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TokenIssueRateLimiter {

    static final String CONFIG_NAME = "checkin-token-issue";

    private final RateLimiterRegistry rateLimiterRegistry;

    /**
     * @throws TokenRateLimitedException when the customer's window is used up
     */
    public void acquire(Long customerId) {
        RateLimiter limiter = rateLimiterRegistry.rateLimiter(CONFIG_NAME + ":" + customerId, CONFIG_NAME);
        if (!limiter.acquirePermission()) {
            log.warn("Check-in token generation throttled for customer {}", customerId);
            throw new TokenRateLimitedException(customerId);
        }
    }
}
