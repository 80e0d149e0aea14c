package com.openstay.booking.token;

import com.openstay.booking.config.CheckInTokenProperties;
import com.openstay.booking.domain.model.Actor;
import com.openstay.booking.domain.model.Booking;
import com.openstay.booking.domain.model.BookingStatus;
import com.openstay.booking.domain.repository.BookingRepository;
import com.openstay.booking.domain.service.BookingTransactions;
import com.openstay.booking.domain.service.StayCalendar;
import com.openstay.common.exception.ActionNotPermittedException;
import com.openstay.common.exception.CheckInTokenException;
import com.openstay.common.exception.InvalidTransitionException;
import com.openstay.common.exception.ResourceNotFoundException;
import com.openstay.common.exception.TokenAlreadyActiveException;
import com.openstay.common.exception.TokenContextMismatchException;
import com.openstay.common.exception.TokenExpiredException;
import com.openstay.common.exception.TokenInvalidException;
import com.openstay.common.exception.TokenNotYetValidException;
import com.openstay.common.exception.TokenRevokedException;
import com.openstay.common.exception.TokenUsageExceededException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues, validates, consumes and revokes check-in tokens.
 *
 * Methods taking a {@link Booking} run inside the caller's booking transition
 * ({@link Propagation#MANDATORY}); the remaining public methods open their own transaction.
 * A booking has at most one ACTIVE token at a time.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CheckInTokenService {

    private final CheckInTokenRepository tokenRepository;
    private final BookingRepository bookingRepository;
    private final TokenSigner tokenSigner;
    private final CheckInTokenProperties properties;
    private final StayCalendar calendar;
    private final BookingTransactions transactions;
    private final TokenIssueRateLimiter issueRateLimiter;

    /**
     * @throws TokenAlreadyActiveException when the booking already has an ACTIVE token
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IssuedToken issue(Booking booking, IssueContext context) {
        Optional<CheckInToken> active = tokenRepository.findByBookingIdAndStatus(booking.getId(), TokenStatus.ACTIVE);
        if (active.isPresent()) {
            throw new TokenAlreadyActiveException(active.get().getTokenId());
        }
        Instant checkIn = calendar.checkInInstant(booking.getCheckInDate());
        CheckInToken token = CheckInToken.issue(
                booking.getId(),
                booking.getHotelId(),
                booking.getCustomerId(),
                calendar.now(),
                checkIn.minus(Duration.ofHours(properties.getValidFromHoursBeforeCheckIn())),
                checkIn.plus(Duration.ofHours(properties.getValidUntilHoursAfterCheckIn())),
                properties.getMaxUsage(),
                context == null ? IssueContext.none() : context);
        tokenRepository.save(token);
        log.info("Issued check-in token {} for booking {}, valid {} to {}",
                token.getTokenId(), booking.getId(), token.getNotBefore(), token.getExpiresAt());
        return IssuedToken.of(token, tokenSigner.sign(TokenClaims.of(token)));
    }

    /**
     * Revokes the booking's ACTIVE token, if any, and issues a new one.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public IssuedToken reissue(Booking booking, Actor actor, String reason, IssueContext context) {
        revokeActive(booking.getId(), actor, reason);
        // the revocation must reach the database before the insert of the new ACTIVE token
        tokenRepository.flush();
        return issue(booking, context);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void revokeActive(Long bookingId, Actor actor, String reason) {
        tokenRepository.findByBookingIdAndStatus(bookingId, TokenStatus.ACTIVE)
                .ifPresent(token -> {
                    token.revoke(actor.actorId(), reason, calendar.now());
                    log.info("Revoked check-in token {} of booking {}: {}", token.getTokenId(), bookingId, reason);
                });
    }

    /**
     * Validates the token against {@code context} and counts one use. Runs in the caller's
     * check-in transaction so the use only sticks if the check-in commits.
     *
     * @throws CheckInTokenException the first check that failed
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TokenValidation use(String token, TokenContext context, Actor actor, String ipAddress,
                               String deviceFingerprint) {
        Instant now = calendar.now();
        List<String> warnings = new ArrayList<>();
        CheckInToken checked = check(token, context, now, warnings);
        checked.recordUse(new TokenUsage(now, actor.actorId(), context.hotelId(), ipAddress, deviceFingerprint));
        log.info("Check-in token {} used for booking {} ({} of {}), risk score {}",
                checked.getTokenId(), checked.getBookingId(), checked.getCurrentUsage(), checked.getMaxUsage(),
                checked.getSecurityContext().getRiskScore());
        return TokenValidation.valid(checked, warnings);
    }

    /**
     * Read-only check. Never consumes a use.
     */
    @Transactional(readOnly = true)
    public TokenValidation validate(String token, TokenContext context) {
        List<String> warnings = new ArrayList<>();
        try {
            return TokenValidation.valid(check(token, context, calendar.now(), warnings), warnings);
        } catch (CheckInTokenException e) {
            log.info("Check-in token rejected [{}]: {}", e.getErrorCode(), e.getMessage());
            return TokenValidation.failed(e);
        }
    }

    /**
     * Issues a token for a CONFIRMED booking that has none ACTIVE, e.g. after the previous
     * one was revoked or expired. Counts against the guest's generation limit.
     */
    public IssuedToken issueForBooking(Long bookingId, Actor actor, IssueContext context) {
        requireStaff(actor, "issue check-in tokens");
        return transactions.execute("Issue check-in token", () -> {
            Booking booking = lockConfirmed(bookingId);
            issueRateLimiter.acquire(booking.getCustomerId());
            return issue(booking, context);
        });
    }

    public IssuedToken reissueForBooking(Long bookingId, Actor actor, String reason, IssueContext context) {
        requireStaff(actor, "reissue check-in tokens");
        return transactions.execute("Reissue check-in token", () -> {
            Booking booking = lockConfirmed(bookingId);
            issueRateLimiter.acquire(booking.getCustomerId());
            return reissue(booking, actor, reason, context);
        });
    }

    /**
     * Revoking an already revoked token is a no-op; USED and EXPIRED tokens cannot be revoked.
     */
    public void revoke(UUID tokenId, Actor actor, String reason) {
        transactions.execute("Revoke check-in token", () -> {
            CheckInToken token = tokenRepository.findById(tokenId)
                    .orElseThrow(() -> new ResourceNotFoundException("Check-in token", tokenId));
            if (!actor.isStaff() && !actor.isSystem() && !token.getCustomerId().equals(actor.actorId())) {
                throw new ActionNotPermittedException("revoke this check-in token", actor.role());
            }
            if (token.revoke(actor.actorId(), reason, calendar.now())) {
                log.info("Revoked check-in token {} of booking {}: {}", tokenId, token.getBookingId(), reason);
            } else {
                log.debug("Check-in token {} was already revoked", tokenId);
            }
            return null;
        });
    }

    @Transactional(readOnly = true)
    public List<CheckInToken> tokensForBooking(Long bookingId, Actor actor) {
        requireStaff(actor, "list check-in tokens");
        return tokenRepository.findByBookingIdOrderByIssuedAtDesc(bookingId);
    }

    /**
     * The caller's own ACTIVE tokens, re-signed so the guest can present them again.
     */
    @Transactional(readOnly = true)
    public List<IssuedToken> activeTokensOf(Actor actor) {
        if (actor.isSystem()) {
            throw new ActionNotPermittedException("list its own check-in tokens", actor.role());
        }
        return tokenRepository.findByCustomerIdAndStatusOrderByNotBeforeAsc(actor.actorId(), TokenStatus.ACTIVE)
                .stream()
                .map(token -> IssuedToken.of(token, tokenSigner.sign(TokenClaims.of(token))))
                .toList();
    }

    @Transactional(readOnly = true)
    public TokenAuditTrail auditTrail(UUID tokenId, Actor actor) {
        requireStaff(actor, "read check-in token audit trails");
        CheckInToken token = tokenRepository.findById(tokenId)
                .orElseThrow(() -> new ResourceNotFoundException("Check-in token", tokenId));
        return TokenAuditTrail.of(token);
    }

    @Transactional(readOnly = true)
    public TokenStatistics statistics(Long hotelId, Actor actor) {
        requireStaff(actor, "read check-in token statistics");
        return TokenStatistics.of(hotelId, tokenRepository.countByStatusForHotel(hotelId));
    }

    /**
     * Marks ACTIVE tokens whose grace period has passed as EXPIRED.
     *
     * @return number of tokens expired
     */
    @Transactional
    public int expireOverdueTokens() {
        Instant threshold = calendar.now().minus(grace());
        List<CheckInToken> overdue = tokenRepository.findByStatusAndExpiresAtBefore(TokenStatus.ACTIVE, threshold);
        overdue.forEach(CheckInToken::expire);
        if (!overdue.isEmpty()) {
            log.info("Expired {} check-in token(s)", overdue.size());
        }
        return overdue.size();
    }

    /**
     * Checks run in a fixed order and the first failure wins: signature, stored record,
     * hotel and booking context, status, expiry, not-before, usage.
     */
    private CheckInToken check(String token, TokenContext context, Instant now, List<String> warnings) {
        TokenClaims claims = tokenSigner.verify(token);
        CheckInToken stored = tokenRepository.findById(claims.tokenId())
                .orElseThrow(() -> new TokenInvalidException(claims.tokenId()));
        if (!claims.matches(stored)) {
            log.warn("Check-in token {} claims do not match the stored record", stored.getTokenId());
            throw new TokenInvalidException(stored.getTokenId());
        }
        if (context == null
                || !Objects.equals(context.hotelId(), stored.getHotelId())
                || !Objects.equals(context.bookingId(), stored.getBookingId())) {
            throw new TokenContextMismatchException(stored.getTokenId());
        }
        switch (stored.getStatus()) {
            case USED -> throw new TokenUsageExceededException(stored.getTokenId());
            case EXPIRED -> throw new TokenExpiredException(stored.getTokenId());
            case REVOKED -> throw new TokenRevokedException(stored.getTokenId());
            case ACTIVE -> { }
        }
        if (!now.isBefore(stored.getExpiresAt())) {
            if (now.isBefore(stored.getExpiresAt().plus(grace()))) {
                warnings.add("Token expired " + Duration.between(stored.getExpiresAt(), now).toMinutes()
                        + " minute(s) ago and was accepted within the grace period");
            } else {
                throw new TokenExpiredException(stored.getTokenId());
            }
        }
        if (now.isBefore(stored.getNotBefore())) {
            throw new TokenNotYetValidException(stored.getTokenId());
        }
        if (stored.getCurrentUsage() >= stored.getMaxUsage()) {
            throw new TokenUsageExceededException(stored.getTokenId());
        }
        return stored;
    }

    private Booking lockConfirmed(Long bookingId) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        if (booking.getStatus() != BookingStatus.CONFIRMED) {
            throw new InvalidTransitionException("Check-in tokens are only issued for CONFIRMED bookings, booking "
                    + bookingId + " is " + booking.getStatus());
        }
        return booking;
    }

    private Duration grace() {
        return Duration.ofMinutes(properties.getGracePeriodMinutes());
    }

    private static void requireStaff(Actor actor, String action) {
        if (!actor.isStaff()) {
            throw new ActionNotPermittedException(action, actor.role());
        }
    }
}
