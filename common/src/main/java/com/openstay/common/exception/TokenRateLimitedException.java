package com.openstay.common.exception;

/**
 * Too many check-in tokens generated for one customer in the current window.
 */
public class TokenRateLimitedException extends BusinessException {

    public TokenRateLimitedException(Long customerId) {
        super("Too many check-in tokens generated for customer " + customerId + ", try again later",
                ErrorCodes.TOKEN_RATE_LIMITED);
        detail("customerId", customerId);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
