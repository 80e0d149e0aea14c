package com.openstay.booking.port;

public enum BookingEventType {
    BOOKING_CREATED,
    BOOKING_CONFIRMED,
    BOOKING_REJECTED,
    BOOKING_MODIFIED,
    BOOKING_CHECKED_IN,
    BOOKING_COMPLETED,
    BOOKING_CANCELLED,
    BOOKING_NO_SHOW
}
