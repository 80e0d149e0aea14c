package com.openstay.booking.api.dto;

import com.openstay.booking.domain.model.ValidationDecision;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ValidateBookingRequest(
        @NotNull(message = "Decision cannot be null")
        ValidationDecision decision,

        @Size(max = 500)
        String reason
) {
}
