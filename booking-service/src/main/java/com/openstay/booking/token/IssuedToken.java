package com.openstay.booking.token;

import java.time.Instant;
import java.util.UUID;

/**
 * A freshly issued token. {@code token} is the signed string handed to the guest.
 */
public record IssuedToken(
        UUID tokenId,
        Long bookingId,
        String token,
        Instant notBefore,
        Instant expiresAt,
        int maxUsage
) {

    static IssuedToken of(CheckInToken token, String signed) {
        return new IssuedToken(token.getTokenId(), token.getBookingId(), signed,
                token.getNotBefore(), token.getExpiresAt(), token.getMaxUsage());
    }
}
