package com.openstay.common.exception;

import lombok.Getter;

/**
 * A physical room handed out at check-in is still occupied by another in-house booking.
 */
@Getter
public class RoomOccupiedException extends BusinessException {
    private final Long hotelId;
    private final String roomId;
    private final Long occupiedByBookingId;

    public RoomOccupiedException(Long hotelId, String roomId, Long occupiedByBookingId) {
        super(String.format("Room %s of hotel %d is occupied by booking %s", roomId, hotelId,
                occupiedByBookingId == null ? "of a concurrent check-in" : occupiedByBookingId),
                ErrorCodes.ROOM_OCCUPIED);
        this.hotelId = hotelId;
        this.roomId = roomId;
        this.occupiedByBookingId = occupiedByBookingId;
        detail("hotelId", hotelId);
        detail("roomId", roomId);
        detail("occupiedByBookingId", occupiedByBookingId);
    }
}
