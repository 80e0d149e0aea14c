package com.openstay.booking.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Booking lifecycle. Every allowed move is listed in {@link #allowedTransitions()};
 * anything else is rejected by the state machine.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    REJECTED,
    CHECKED_IN,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    private static final Map<BookingStatus, Set<BookingStatus>> TRANSITIONS = new EnumMap<>(BookingStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(CONFIRMED, REJECTED, CANCELLED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(CHECKED_IN, CANCELLED, NO_SHOW));
        TRANSITIONS.put(CHECKED_IN, EnumSet.of(COMPLETED));
        TRANSITIONS.put(REJECTED, EnumSet.noneOf(BookingStatus.class));
        TRANSITIONS.put(COMPLETED, EnumSet.noneOf(BookingStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(BookingStatus.class));
        TRANSITIONS.put(NO_SHOW, EnumSet.noneOf(BookingStatus.class));
    }

    public boolean canTransitionTo(BookingStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<BookingStatus> allowedTransitions() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /** Statuses in which the booking's rooms are reserved in the inventory ledger. */
    public boolean holdsInventory() {
        return this == PENDING || this == CONFIRMED || this == CHECKED_IN;
    }
}
