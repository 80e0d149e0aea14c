package com.openstay.booking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openstay.booking.domain.model.Booking;
import com.openstay.booking.domain.model.BookingRoom;
import com.openstay.booking.domain.model.BookingStatus;
import com.openstay.booking.domain.model.CancellationRecord;
import com.openstay.booking.domain.model.CheckInMethod;
import com.openstay.booking.domain.model.PricingSource;
import com.openstay.booking.domain.model.StatusChange;
import com.openstay.booking.domain.model.StayRecord;
import com.openstay.booking.token.IssuedToken;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Booking view. {@code checkInToken} is only present on the response of the transition that
 * issued it; the signed string is not stored and cannot be fetched again.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookingResponse(
        Long id,
        Long customerId,
        Long hotelId,
        LocalDate checkInDate,
        LocalDate checkOutDate,
        BookingStatus status,
        List<Room> rooms,
        BigDecimal totalPrice,
        Integer nights,
        PricingSource pricingSource,
        List<StatusEntry> statusHistory,
        Cancellation cancellation,
        Instant checkedInAt,
        Instant checkedOutAt,
        CheckInMethod checkInMethod,
        Instant createdAt,
        Instant updatedAt,
        IssuedToken checkInToken
) {
    public static BookingResponse from(Booking booking) {
        return from(booking, null);
    }

    public static BookingResponse from(Booking booking, IssuedToken checkInToken) {
        StayRecord stay = booking.getStay();
        return new BookingResponse(
                booking.getId(),
                booking.getCustomerId(),
                booking.getHotelId(),
                booking.getCheckInDate(),
                booking.getCheckOutDate(),
                booking.getStatus(),
                booking.getRooms().stream().map(Room::from).toList(),
                booking.getTotalPrice(),
                booking.getPricing() == null ? null : booking.getPricing().getNights(),
                booking.getPricing() == null ? null : booking.getPricing().getPricingSource(),
                booking.getStatusHistory().stream().map(StatusEntry::from).toList(),
                Cancellation.from(booking.getCancellation()),
                stay == null ? null : stay.getCheckedInAt(),
                stay == null ? null : stay.getCheckedOutAt(),
                stay == null ? null : stay.getCheckInMethod(),
                booking.getCreatedAt(),
                booking.getUpdatedAt(),
                checkInToken
        );
    }

    public record Room(String roomType, String assignedRoomId, BigDecimal pricePerRoom) {
        static Room from(BookingRoom room) {
            return new Room(room.getRoomType(), room.getAssignedRoomId(), room.getPricePerRoom());
        }
    }

    public record StatusEntry(BookingStatus previousStatus, BookingStatus newStatus, String reason,
                              Long actorId, Instant changedAt) {
        static StatusEntry from(StatusChange change) {
            return new StatusEntry(change.getPreviousStatus(), change.getNewStatus(), change.getReason(),
                    change.getActorId(), change.getChangedAt());
        }
    }

    public record Cancellation(Instant cancelledAt, Integer refundPercentage, BigDecimal refundAmount,
                               BigDecimal cancellationFee, String reason, Boolean overridden) {
        static Cancellation from(CancellationRecord record) {
            if (record == null) {
                return null;
            }
            return new Cancellation(record.getCancelledAt(), record.getRefundPercentage(), record.getRefundAmount(),
                    record.getCancellationFee(), record.getReason(), record.getOverridden());
        }
    }
}
