package com.openstay.common.util;

/**
 * Keys, topics and header names shared across modules.
 */
public final class Constants {
    private Constants() {
        // Utility class
    }

    public static final String LOCK_PREFIX = "lock:inventory:";
    public static final String CACHE_AVAILABILITY_PREFIX = "availability:";

    public static final String TOPIC_BOOKING_EVENTS = "booking-events";

    public static final String HEADER_ACTOR_ID = "X-Actor-Id";
    public static final String HEADER_ACTOR_ROLE = "X-Actor-Role";
    public static final String HEADER_DEVICE_FINGERPRINT = "X-Device-Fingerprint";
}
