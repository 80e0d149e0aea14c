package com.openstay.booking.token;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Lifecycle and every recorded use of one token, for staff review.
 */
public record TokenAuditTrail(
        UUID tokenId,
        Long bookingId,
        Long hotelId,
        Long customerId,
        TokenStatus status,
        Instant issuedAt,
        String issuedFromIp,
        String issuedFromDevice,
        int riskScore,
        Instant revokedAt,
        Long revokedBy,
        String revocationReason,
        List<Use> uses
) {

    public record Use(Instant usedAt, Long usedBy, Long hotelId, String ipAddress, String deviceFingerprint) {
    }

    static TokenAuditTrail of(CheckInToken token) {
        TokenSecurityContext security = token.getSecurityContext();
        return new TokenAuditTrail(
                token.getTokenId(),
                token.getBookingId(),
                token.getHotelId(),
                token.getCustomerId(),
                token.getStatus(),
                token.getIssuedAt(),
                security.getIssuedFromIp(),
                security.getDeviceFingerprint(),
                security.getRiskScore(),
                token.getRevokedAt(),
                token.getRevokedBy(),
                token.getRevocationReason(),
                token.getUsageLog().stream()
                        .map(use -> new Use(use.getUsedAt(), use.getUsedBy(), use.getHotelId(),
                                use.getIpAddress(), use.getDeviceFingerprint()))
                        .toList());
    }
}
