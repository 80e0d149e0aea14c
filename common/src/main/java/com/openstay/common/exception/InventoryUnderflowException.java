package com.openstay.common.exception;

import java.time.LocalDate;

/**
 * A release or consistency check found fewer reserved rooms than the booking holds.
 * Signals ledger corruption; never retried.
 */
public class InventoryUnderflowException extends BusinessException {

    public InventoryUnderflowException(Long hotelId, String roomType, LocalDate stayDate, int quantity) {
        super(String.format("Ledger does not hold %d room(s) of type %s for hotel %d on %s",
                quantity, roomType, hotelId, stayDate), ErrorCodes.INVENTORY_UNDERFLOW);
        detail("hotelId", hotelId);
        detail("roomType", roomType);
        detail("stayDate", String.valueOf(stayDate));
        detail("quantity", quantity);
    }
}
