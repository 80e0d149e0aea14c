package com.openstay.booking.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TokenValidationRequest(
        @NotBlank(message = "Token cannot be blank")
        String token,

        @NotNull(message = "Hotel ID cannot be null")
        Long hotelId,

        @NotNull(message = "Booking ID cannot be null")
        Long bookingId
) {
}
