package com.openstay.booking.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.LocalDate;
import java.util.Map;

public record CreateBookingRequest(
        @NotNull(message = "Hotel ID cannot be null")
        Long hotelId,

        @NotNull(message = "Customer ID cannot be null")
        Long customerId,

        @NotNull(message = "Check-in date cannot be null")
        LocalDate checkInDate,

        @NotNull(message = "Check-out date cannot be null")
        LocalDate checkOutDate,

        /** Room type to number of rooms. */
        @NotEmpty(message = "At least one room type is required")
        Map<String, @NotNull @Positive(message = "Quantity must be positive") Integer> rooms
) {
}
