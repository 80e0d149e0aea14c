package com.openstay.booking.token;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TokenSecurityContext {

    @Column(name = "issued_from_ip", length = 64)
    private String issuedFromIp;

    @Column(name = "device_fingerprint", length = 255)
    private String deviceFingerprint;

    /** 0 (no concern) to 100. */
    @Column(name = "risk_score", nullable = false)
    private int riskScore;

    static TokenSecurityContext issuedFrom(IssueContext context) {
        return new TokenSecurityContext(context.ipAddress(), context.deviceFingerprint(), 0);
    }

    TokenSecurityContext withRiskScore(int score) {
        return new TokenSecurityContext(issuedFromIp, deviceFingerprint, score);
    }
}
