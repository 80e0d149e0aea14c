package com.openstay.booking.api.dto;

import com.openstay.booking.domain.model.RoomAssignment;
import jakarta.validation.Valid;

import java.util.List;

/**
 * Manual check-in when {@code token} is null, token check-in otherwise.
 */
public record CheckInRequest(
        List<@Valid RoomAssignment> roomAssignments,
        String token
) {
    public List<RoomAssignment> assignments() {
        return roomAssignments == null ? List.of() : roomAssignments;
    }
}
