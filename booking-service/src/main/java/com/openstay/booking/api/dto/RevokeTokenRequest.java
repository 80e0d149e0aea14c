package com.openstay.booking.api.dto;

import jakarta.validation.constraints.Size;

public record RevokeTokenRequest(@Size(max = 500) String reason) {
}
