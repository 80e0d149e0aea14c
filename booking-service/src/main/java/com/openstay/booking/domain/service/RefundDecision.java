package com.openstay.booking.domain.service;

import java.math.BigDecimal;

/**
 * Outcome of the cancellation policy for one booking.
 * {@code refundAmount + cancellationFee} always equals the booking total.
 */
public record RefundDecision(
        int refundPercentage,
        BigDecimal refundAmount,
        BigDecimal cancellationFee,
        boolean overridden,
        double hoursUntilCheckIn
) {
}
