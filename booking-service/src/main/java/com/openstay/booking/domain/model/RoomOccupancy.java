package com.openstay.booking.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A physical room held by a checked-in booking. Created at check-in and removed at
 * check-out; the unique key keeps a room with at most one in-house booking.
 */
@Entity
@Table(name = "room_occupancies",
        uniqueConstraints = @UniqueConstraint(name = "uk_room_occupancy_room", columnNames = {"hotel_id", "room_id"}),
        indexes = @Index(name = "idx_room_occupancy_booking", columnList = "booking_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RoomOccupancy {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hotel_id", nullable = false)
    private Long hotelId;

    @Column(name = "room_id", nullable = false, length = 50)
    private String roomId;

    @Column(name = "booking_id", nullable = false)
    private Long bookingId;

    @Column(name = "occupied_until", nullable = false)
    private LocalDate occupiedUntil;

    @Column(name = "occupied_since", nullable = false)
    private Instant occupiedSince;

    public static RoomOccupancy of(Booking booking, String roomId, Instant now) {
        RoomOccupancy occupancy = new RoomOccupancy();
        occupancy.hotelId = booking.getHotelId();
        occupancy.roomId = roomId;
        occupancy.bookingId = booking.getId();
        occupancy.occupiedUntil = booking.getCheckOutDate();
        occupancy.occupiedSince = now;
        return occupancy;
    }
}
