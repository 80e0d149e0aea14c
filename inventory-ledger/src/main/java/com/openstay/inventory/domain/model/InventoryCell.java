package com.openstay.inventory.domain.model;

import com.openstay.common.exception.InsufficientAvailabilityException;
import com.openstay.common.exception.InventoryUnderflowException;
import com.openstay.common.exception.ValidationException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Rooms sold versus physical capacity for one (hotel, room type, night).
 * Available rooms are always derived as {@code totalRooms - reservedCount}; only
 * {@code reservedCount} moves, and only through the guarded methods below or the
 * guarded UPDATEs in {@link com.openstay.inventory.domain.repository.InventoryCellRepository}.
 */
@Entity
@Table(name = "inventory_cells",
        uniqueConstraints = @UniqueConstraint(name = "uk_inventory_cell",
                columnNames = {"hotel_id", "room_type", "stay_date"}),
        indexes = @Index(name = "idx_inventory_hotel_date", columnList = "hotel_id,stay_date"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class InventoryCell {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hotel_id", nullable = false)
    private Long hotelId;

    @Column(name = "room_type", nullable = false, length = 50)
    private String roomType;

    @Column(name = "stay_date", nullable = false)
    private LocalDate stayDate;

    @Column(name = "total_rooms", nullable = false)
    private int totalRooms;

    @Column(name = "reserved_count", nullable = false)
    private int reservedCount;

    @Version
    @Column(name = "version")
    private Long version;

    public static InventoryCell provisioned(Long hotelId, String roomType, LocalDate stayDate, int totalRooms) {
        if (totalRooms < 0) {
            throw new ValidationException("totalRooms", "Total rooms cannot be negative");
        }
        InventoryCell cell = new InventoryCell();
        cell.hotelId = hotelId;
        cell.roomType = roomType;
        cell.stayDate = stayDate;
        cell.totalRooms = totalRooms;
        cell.reservedCount = 0;
        return cell;
    }

    public int availableRooms() {
        return totalRooms - reservedCount;
    }

    public void reserve(int quantity) {
        if (availableRooms() < quantity) {
            throw new InsufficientAvailabilityException(hotelId, roomType, stayDate, quantity);
        }
        reservedCount += quantity;
    }

    public void release(int quantity) {
        if (reservedCount < quantity) {
            throw new InventoryUnderflowException(hotelId, roomType, stayDate, quantity);
        }
        reservedCount -= quantity;
    }

    /**
     * Changes physical capacity. Capacity may never drop below what is already sold.
     */
    public void resize(int newTotalRooms) {
        if (newTotalRooms < reservedCount) {
            throw new ValidationException("totalRooms", String.format(
                    "Cannot set capacity of %s on %s to %d: %d room(s) already reserved",
                    roomType, stayDate, newTotalRooms, reservedCount));
        }
        this.totalRooms = newTotalRooms;
    }
}
