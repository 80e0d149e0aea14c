package com.openstay.booking.domain.model;

import com.openstay.common.exception.InvalidTransitionException;
import com.openstay.common.exception.ValidationException;
import com.openstay.common.util.DateRange;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A hotel booking: one or more rooms for a half-open range of nights.
 *
 * State only changes through the methods below, which keep the status history in step
 * with {@link #getStatus()} and reject moves the lifecycle does not allow.
 * Persistence of the matching inventory is the caller's job.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_customer_id", columnList = "customer_id"),
        @Index(name = "idx_bookings_status_check_in", columnList = "status, check_in_date")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_id", nullable = false)
    private Long customerId;

    @Column(name = "hotel_id", nullable = false)
    private Long hotelId;

    @Column(name = "check_in_date", nullable = false)
    private LocalDate checkInDate;

    @Column(name = "check_out_date", nullable = false)
    private LocalDate checkOutDate;

    @Getter(AccessLevel.NONE)
    @ElementCollection
    @CollectionTable(name = "booking_rooms", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "room_index")
    private List<BookingRoom> rooms = new ArrayList<>();

    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @Getter(AccessLevel.NONE)
    @ElementCollection
    @CollectionTable(name = "booking_status_history", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderColumn(name = "entry_index")
    private List<StatusChange> statusHistory = new ArrayList<>();

    @Embedded
    private PricingBreakdown pricing;

    @Embedded
    private CancellationRecord cancellation;

    @Embedded
    private StayRecord stay;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    public static Booking create(Long hotelId, Long customerId, DateRange stayRange, List<BookingRoom> rooms,
                                 PricingBreakdown pricing, Actor actor, Instant now) {
        if (rooms == null || rooms.isEmpty()) {
            throw new ValidationException("rooms", "A booking needs at least one room");
        }
        Booking booking = new Booking();
        booking.hotelId = hotelId;
        booking.customerId = customerId;
        booking.checkInDate = stayRange.start();
        booking.checkOutDate = stayRange.endExclusive();
        booking.rooms.addAll(rooms);
        booking.totalPrice = sum(rooms);
        booking.pricing = pricing;
        booking.status = BookingStatus.PENDING;
        booking.statusHistory.add(StatusChange.of(null, BookingStatus.PENDING, "Booking created", actor.actorId(), now));
        booking.createdAt = now;
        booking.updatedAt = now;
        return booking;
    }

    public List<BookingRoom> getRooms() {
        return Collections.unmodifiableList(rooms);
    }

    /** Physical rooms handed out so far, in room order. */
    public List<String> assignedRoomIds() {
        return rooms.stream()
                .filter(BookingRoom::isAssigned)
                .map(BookingRoom::getAssignedRoomId)
                .toList();
    }

    public List<StatusChange> getStatusHistory() {
        return Collections.unmodifiableList(statusHistory);
    }

    public DateRange stayRange() {
        return DateRange.stay(checkInDate, checkOutDate);
    }

    /** Rooms per type, in the order the inventory ledger locks them. */
    public SortedMap<String, Integer> roomQuantities() {
        return quantitiesOf(rooms);
    }

    public boolean isOwnedBy(Long actorId) {
        return customerId.equals(actorId);
    }

    public void assertCanTransitionTo(BookingStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException("Booking " + id, status, next);
        }
    }

    public void transitionTo(BookingStatus next, String reason, Long actorId, Instant now) {
        assertCanTransitionTo(next);
        statusHistory.add(StatusChange.of(status, next, reason, actorId, now));
        status = next;
        updatedAt = now;
    }

    /**
     * Moves the stay to new dates and/or rooms. Once a booking has left PENDING the number of
     * rooms per type is fixed.
     */
    public void reschedule(DateRange newStay, List<BookingRoom> newRooms, PricingBreakdown newPricing, Instant now) {
        if (status != BookingStatus.PENDING && status != BookingStatus.CONFIRMED) {
            throw new InvalidTransitionException("Booking " + id + " cannot be modified in status " + status);
        }
        if (newRooms == null || newRooms.isEmpty()) {
            throw new ValidationException("rooms", "A booking needs at least one room");
        }
        if (status != BookingStatus.PENDING && !quantitiesOf(newRooms).equals(roomQuantities())) {
            throw new InvalidTransitionException("Rooms of booking " + id + " are fixed once it leaves PENDING");
        }
        checkInDate = newStay.start();
        checkOutDate = newStay.endExclusive();
        rooms.clear();
        rooms.addAll(newRooms);
        totalPrice = sum(newRooms);
        pricing = newPricing;
        updatedAt = now;
    }

    /**
     * Hands out physical rooms. Every assignment must match an unassigned room of its type
     * and a room id may appear only once; nothing changes unless all assignments fit.
     */
    public void assignRooms(List<RoomAssignment> assignments) {
        if (status != BookingStatus.CONFIRMED) {
            throw new InvalidTransitionException("Rooms can only be assigned to a CONFIRMED booking, booking "
                    + id + " is " + status);
        }
        List<BookingRoom> updated = new ArrayList<>(rooms);
        Set<String> seenRoomIds = new HashSet<>();
        for (RoomAssignment assignment : assignments) {
            if (!seenRoomIds.add(assignment.roomId())) {
                throw new ValidationException("roomAssignments",
                        "Room " + assignment.roomId() + " is assigned more than once");
            }
            int slot = firstUnassigned(updated, assignment.roomType());
            if (slot < 0) {
                throw new ValidationException("roomAssignments", roomQuantities().containsKey(assignment.roomType())
                        ? "More rooms assigned than booked for type " + assignment.roomType()
                        : "Booking " + id + " has no room of type " + assignment.roomType());
            }
            updated.set(slot, updated.get(slot).assignedTo(assignment.roomId()));
        }
        for (int i = 0; i < updated.size(); i++) {
            rooms.set(i, updated.get(i));
        }
    }

    public void recordCheckIn(CheckInMethod method, Long actorId, Instant now) {
        stay = StayRecord.checkedIn(now, actorId, method);
    }

    public void recordCheckOut(Instant now) {
        if (stay == null) {
            throw new InvalidTransitionException("Booking " + id + " has no check-in to close");
        }
        stay = stay.checkedOut(now);
    }

    public void recordCancellation(CancellationRecord record) {
        cancellation = record;
    }

    private static int firstUnassigned(List<BookingRoom> rooms, String roomType) {
        for (int i = 0; i < rooms.size(); i++) {
            BookingRoom room = rooms.get(i);
            if (room.getRoomType().equals(roomType) && !room.isAssigned()) {
                return i;
            }
        }
        return -1;
    }

    private static SortedMap<String, Integer> quantitiesOf(List<BookingRoom> rooms) {
        SortedMap<String, Integer> quantities = new TreeMap<>();
        rooms.forEach(room -> quantities.merge(room.getRoomType(), 1, Integer::sum));
        return quantities;
    }

    private static BigDecimal sum(List<BookingRoom> rooms) {
        return rooms.stream()
                .map(BookingRoom::getPricePerRoom)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
