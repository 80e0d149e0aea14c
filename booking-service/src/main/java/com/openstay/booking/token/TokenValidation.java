package com.openstay.booking.token;

import com.openstay.common.exception.CheckInTokenException;

import java.util.List;
import java.util.UUID;

/**
 * Result of checking a token. Either {@code valid} with optional warnings (for example
 * accepted inside the expiry grace period), or carrying the failure that stopped it.
 */
public record TokenValidation(
        boolean valid,
        UUID tokenId,
        Long bookingId,
        int remainingUses,
        List<String> warnings,
        CheckInTokenException failure
) {

    static TokenValidation valid(CheckInToken token, List<String> warnings) {
        return new TokenValidation(true, token.getTokenId(), token.getBookingId(), token.remainingUses(),
                List.copyOf(warnings), null);
    }

    static TokenValidation failed(CheckInTokenException failure) {
        return new TokenValidation(false, null, null, 0, List.of(), failure);
    }

    public String errorCode() {
        return failure == null ? null : failure.getErrorCode();
    }

    public TokenValidation orElseThrow() {
        if (failure != null) {
            throw failure;
        }
        return this;
    }
}
