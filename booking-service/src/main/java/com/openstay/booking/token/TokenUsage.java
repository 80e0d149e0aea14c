package com.openstay.booking.token;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One successful use of a check-in token.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PACKAGE)
public class TokenUsage {

    @Column(name = "used_at", nullable = false)
    private Instant usedAt;

    @Column(name = "used_by", nullable = false)
    private Long usedBy;

    @Column(name = "hotel_id", nullable = false)
    private Long hotelId;

    @Column(name = "ip_address", length = 64)
    private String ipAddress;

    @Column(name = "device_fingerprint", length = 255)
    private String deviceFingerprint;
}
