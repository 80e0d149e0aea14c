package com.openstay.inventory.api.dto;

import com.openstay.inventory.domain.model.InventoryCell;

import java.time.LocalDate;

/**
 * Read-only view of one inventory cell.
 */
public record CellAvailability(
        String roomType,
        LocalDate stayDate,
        int totalRooms,
        int reservedCount,
        int availableRooms
) {
    public static CellAvailability from(InventoryCell cell) {
        return new CellAvailability(
                cell.getRoomType(),
                cell.getStayDate(),
                cell.getTotalRooms(),
                cell.getReservedCount(),
                cell.availableRooms()
        );
    }
}
