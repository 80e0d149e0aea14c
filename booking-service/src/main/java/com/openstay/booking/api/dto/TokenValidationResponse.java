package com.openstay.booking.api.dto;

import com.openstay.booking.token.TokenValidation;

import java.util.List;
import java.util.UUID;

public record TokenValidationResponse(
        boolean valid,
        UUID tokenId,
        Long bookingId,
        int remainingUses,
        List<String> warnings,
        String errorCode,
        String message
) {
    public static TokenValidationResponse from(TokenValidation validation) {
        return new TokenValidationResponse(
                validation.valid(),
                validation.tokenId(),
                validation.bookingId(),
                validation.remainingUses(),
                validation.warnings(),
                validation.errorCode(),
                validation.failure() == null ? null : validation.failure().getMessage()
        );
    }
}
