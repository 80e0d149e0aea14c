package com.openstay.booking.domain.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Physical room handed to the guest at check-in for one room of the given type.
 */
public record RoomAssignment(
        @NotBlank(message = "Room type cannot be blank")
        String roomType,

        @NotBlank(message = "Room id cannot be blank")
        String roomId
) {
}
