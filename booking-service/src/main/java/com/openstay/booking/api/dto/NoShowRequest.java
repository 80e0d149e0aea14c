package com.openstay.booking.api.dto;

import jakarta.validation.constraints.Size;

public record NoShowRequest(@Size(max = 500) String reason) {
}
