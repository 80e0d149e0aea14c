package com.openstay.booking.api.dto;

import com.openstay.booking.token.CheckInToken;
import com.openstay.booking.token.TokenStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored token as seen by staff. Never contains the signed token string.
 */
public record CheckInTokenResponse(
        UUID tokenId,
        Long bookingId,
        Long hotelId,
        TokenStatus status,
        Instant issuedAt,
        Instant notBefore,
        Instant expiresAt,
        int currentUsage,
        int maxUsage,
        int riskScore,
        Instant revokedAt,
        String revocationReason
) {
    public static CheckInTokenResponse from(CheckInToken token) {
        return new CheckInTokenResponse(
                token.getTokenId(),
                token.getBookingId(),
                token.getHotelId(),
                token.getStatus(),
                token.getIssuedAt(),
                token.getNotBefore(),
                token.getExpiresAt(),
                token.getCurrentUsage(),
                token.getMaxUsage(),
                token.getSecurityContext().getRiskScore(),
                token.getRevokedAt(),
                token.getRevocationReason()
        );
    }
}
