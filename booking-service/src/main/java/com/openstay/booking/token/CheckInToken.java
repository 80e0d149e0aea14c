package com.openstay.booking.token;

import com.openstay.common.exception.InvalidTransitionException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Server-side record of a check-in token. The signed string handed to the guest only
 * carries {@link TokenClaims}; status and usage live here.
 */
@Entity
@Table(name = "checkin_tokens", indexes = {
        @Index(name = "idx_checkin_tokens_booking", columnList = "booking_id"),
        @Index(name = "idx_checkin_tokens_status_expiry", columnList = "status, expires_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CheckInToken {

    @Id
    @Column(name = "token_id", nullable = false)
    private UUID tokenId;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "hotel_id", nullable = false)
    private Long hotelId;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "not_before", nullable = false)
    private Instant notBefore;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "max_usage", nullable = false)
    private int maxUsage;

    @Column(name = "current_usage", nullable = false)
    private int currentUsage;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TokenStatus status;

    @Embedded
    private TokenSecurityContext securityContext;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Column(name = "revoked_by")
    private Long revokedBy;

    @Column(name = "revocation_reason", length = 500)
    private String revocationReason;

    @Getter(AccessLevel.NONE)
    @ElementCollection
    @CollectionTable(name = "checkin_token_usages", joinColumns = @JoinColumn(name = "token_id"))
    @OrderColumn(name = "usage_index")
    private List<TokenUsage> usageLog = new ArrayList<>();

    @Version
    private Long version;

    static CheckInToken issue(Long bookingId, Long hotelId, Long customerId, Instant issuedAt,
                              Instant notBefore, Instant expiresAt, int maxUsage, IssueContext context) {
        CheckInToken token = new CheckInToken();
        token.tokenId = UUID.randomUUID();
        token.bookingId = bookingId;
        token.hotelId = hotelId;
        token.customerId = customerId;
        token.issuedAt = issuedAt;
        token.notBefore = notBefore;
        token.expiresAt = expiresAt;
        token.maxUsage = maxUsage;
        token.currentUsage = 0;
        token.status = TokenStatus.ACTIVE;
        token.securityContext = TokenSecurityContext.issuedFrom(context);
        return token;
    }

    public List<TokenUsage> getUsageLog() {
        return Collections.unmodifiableList(usageLog);
    }

    public boolean isActive() {
        return status == TokenStatus.ACTIVE;
    }

    public int remainingUses() {
        return Math.max(0, maxUsage - currentUsage);
    }

    /**
     * Counts one successful use. The token becomes USED when it reaches its cap.
     */
    void recordUse(TokenUsage usage) {
        if (status != TokenStatus.ACTIVE) {
            throw new InvalidTransitionException("Check-in token " + tokenId, status, "use");
        }
        usageLog.add(usage);
        currentUsage++;
        if (currentUsage >= maxUsage) {
            status = TokenStatus.USED;
        }
        securityContext = securityContext.withRiskScore(riskScoreAt(usage.getUsedAt()));
    }

    /**
     * @return false when the token was already revoked
     */
    boolean revoke(Long actorId, String reason, Instant now) {
        if (status == TokenStatus.REVOKED) {
            return false;
        }
        if (status != TokenStatus.ACTIVE) {
            throw new InvalidTransitionException("Check-in token " + tokenId, status, TokenStatus.REVOKED);
        }
        status = TokenStatus.REVOKED;
        revokedAt = now;
        revokedBy = actorId;
        revocationReason = reason;
        return true;
    }

    void expire() {
        if (status == TokenStatus.ACTIVE) {
            status = TokenStatus.EXPIRED;
        }
    }

    /**
     * Heuristic 0..100: older tokens, tokens close to their cap, and tokens used from
     * many different places score higher.
     */
    int riskScoreAt(Instant now) {
        int score = 0;
        long ageHours = Duration.between(issuedAt, now).toHours();
        if (ageHours > 168) {
            score += 20;
        } else if (ageHours > 24) {
            score += 10;
        }
        if (maxUsage > 0 && (double) currentUsage / maxUsage > 0.8) {
            score += 15;
        }
        Set<String> origins = new HashSet<>();
        for (TokenUsage usage : usageLog) {
            if (usage.getIpAddress() != null) {
                origins.add("ip:" + usage.getIpAddress());
            }
            if (usage.getDeviceFingerprint() != null) {
                origins.add("device:" + usage.getDeviceFingerprint());
            }
        }
        if (origins.size() > 3) {
            score += 20;
        }
        return Math.min(100, Math.max(0, score));
    }
}
