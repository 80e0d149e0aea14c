package com.openstay.booking.token;

import java.util.UUID;

/**
 * Signed payload of a check-in token. Instants are epoch seconds.
 */
public record TokenClaims(
        UUID tokenId,
        Long bookingId,
        Long hotelId,
        Long customerId,
        long issuedAt,
        long notBefore,
        long expiresAt,
        int maxUsage
) {

    static TokenClaims of(CheckInToken token) {
        return new TokenClaims(
                token.getTokenId(),
                token.getBookingId(),
                token.getHotelId(),
                token.getCustomerId(),
                token.getIssuedAt().getEpochSecond(),
                token.getNotBefore().getEpochSecond(),
                token.getExpiresAt().getEpochSecond(),
                token.getMaxUsage());
    }

    /** Whether these claims describe the stored token exactly. */
    boolean matches(CheckInToken token) {
        return equals(of(token));
    }
}
