package com.openstay.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * One room of a booking. The physical room is only known once the guest checks in.
 */
@Embeddable
@Getter
@ToString
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BookingRoom {

    @Column(name = "room_type", nullable = false, length = 50)
    private String roomType;

    @Column(name = "assigned_room_id", length = 50)
    private String assignedRoomId;

    /** Price of this room for the whole stay. */
    @Column(name = "price_per_room", nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePerRoom;

    public static BookingRoom unassigned(String roomType, BigDecimal pricePerRoom) {
        return new BookingRoom(roomType, null, pricePerRoom);
    }

    BookingRoom assignedTo(String roomId) {
        return new BookingRoom(roomType, roomId, pricePerRoom);
    }

    public boolean isAssigned() {
        return assignedRoomId != null;
    }
}
