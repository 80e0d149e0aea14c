package com.openstay.common.exception;

import lombok.Getter;

import java.time.LocalDate;

/**
 * The ledger cannot cover the requested quantity.
 * Carries the first room type and day that failed.
 */
@Getter
public class InsufficientAvailabilityException extends BusinessException {
    private final Long hotelId;
    private final String roomType;
    private final LocalDate stayDate;

    public InsufficientAvailabilityException(Long hotelId, String roomType, LocalDate stayDate, int requested) {
        super(String.format("Insufficient availability for hotel %d, room type %s on %s when reserving %d room(s)",
                hotelId, roomType, stayDate, requested), ErrorCodes.INSUFFICIENT_AVAILABILITY);
        this.hotelId = hotelId;
        this.roomType = roomType;
        this.stayDate = stayDate;
        detail("hotelId", hotelId);
        detail("roomType", roomType);
        detail("stayDate", String.valueOf(stayDate));
        detail("requested", requested);
    }
}
