package com.openstay.booking.domain.service;

import com.openstay.booking.config.CancellationPolicyProperties;
import com.openstay.booking.domain.model.Actor;
import com.openstay.booking.domain.model.Booking;
import com.openstay.common.exception.ActionNotPermittedException;
import com.openstay.common.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

/**
 * Tiered refund policy measured against the stay's check-in instant.
 * Staff may replace the computed amount with any amount between zero and the booking total.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CancellationPolicyEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final CancellationPolicyProperties policy;

    public int refundPercentage(double hoursUntilCheckIn) {
        if (hoursUntilCheckIn >= policy.getFullRefundHours()) {
            return 100;
        }
        if (hoursUntilCheckIn >= policy.getPartialRefundHours()) {
            return policy.getPartialRefundPercentage();
        }
        return 0;
    }

    /**
     * @param overrideAmount refund requested by staff, or null to apply the policy
     */
    public RefundDecision decide(Booking booking, Instant checkInInstant, Instant now, Actor actor,
                                 BigDecimal overrideAmount) {
        BigDecimal total = booking.getTotalPrice();
        double hours = Duration.between(now, checkInInstant).toMinutes() / 60.0;

        if (overrideAmount != null) {
            if (!actor.isStaff()) {
                throw new ActionNotPermittedException("override the refund amount", actor.role());
            }
            if (overrideAmount.signum() < 0 || overrideAmount.compareTo(total) > 0) {
                throw new ValidationException("refundOverride",
                        "Refund override must be between 0 and the booking total " + total);
            }
            BigDecimal amount = overrideAmount.setScale(2, RoundingMode.HALF_UP);
            int percentage = total.signum() == 0 ? 0
                    : amount.multiply(HUNDRED).divide(total, 0, RoundingMode.HALF_UP).intValue();
            log.info("Refund for booking {} overridden by actor {}: {} of {}",
                    booking.getId(), actor.actorId(), amount, total);
            return new RefundDecision(percentage, amount, total.subtract(amount), true, hours);
        }

        int percentage = refundPercentage(hours);
        BigDecimal amount = total.multiply(BigDecimal.valueOf(percentage))
                .divide(HUNDRED, 2, RoundingMode.HALF_UP);
        return new RefundDecision(percentage, amount, total.subtract(amount), false, hours);
    }
}
