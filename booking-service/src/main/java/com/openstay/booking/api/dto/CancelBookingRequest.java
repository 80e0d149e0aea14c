package com.openstay.booking.api.dto;

import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CancelBookingRequest(
        @Size(max = 500)
        String reason,

        /** Staff only: refund this amount instead of the policy amount. */
        BigDecimal refundOverride
) {
}
