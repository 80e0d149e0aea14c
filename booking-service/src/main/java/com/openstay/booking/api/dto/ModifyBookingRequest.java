package com.openstay.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.Map;

/**
 * New dates and, for PENDING bookings only, new rooms. {@code rooms == null} keeps the
 * current rooms. A CONFIRMED booking can only be moved by staff with {@code revalidate}.
 */
public record ModifyBookingRequest(
        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkInDate,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOutDate,

        Map<String, @NotNull @Positive(message = "Quantity must be positive") Integer> rooms,

        boolean revalidate
) {
}
