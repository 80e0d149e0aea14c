package com.openstay.booking.port;

import com.openstay.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Snapshot of a booking right after a committed transition.
 * {@code refundAmount} is only set for cancellations.
 */
public record BookingNotification(
        Long bookingId,
        Long hotelId,
        Long customerId,
        BookingStatus status,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        BigDecimal totalPrice,
        BigDecimal refundAmount,
        Instant occurredAt
) {
}
