package com.openstay.booking.port;

/**
 * Receives booking lifecycle notifications after the transition committed.
 * Delivery is best effort; a failure here never undoes the transition.
 */
public interface NotificationPort {

    void notify(BookingEventType eventType, BookingNotification notification);
}
