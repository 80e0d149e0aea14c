package com.openstay.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Message published on {@code booking-events} for every committed booking transition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingLifecycleEvent {
    private String eventType;
    private Long bookingId;
    private Long hotelId;
    private Long customerId;
    private String status;
    private LocalDate checkInDate;
    private LocalDate checkOutDate;
    private BigDecimal totalPrice;
    /** Only set for cancellations. */
    private BigDecimal refundAmount;
    private Instant timestamp;
}
