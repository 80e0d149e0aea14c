package com.openstay.booking.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.LocalDate;

public record ProvisionInventoryRequest(
        @NotNull(message = "From date cannot be null")
        LocalDate from,

        /** Exclusive. */
        @NotNull(message = "To date cannot be null")
        LocalDate to,

        @NotNull(message = "Total rooms cannot be null")
        @PositiveOrZero(message = "Total rooms cannot be negative")
        Integer totalRooms
) {
}
