package com.openstay.booking.domain.model;

public enum ActorRole {
    CUSTOMER,
    STAFF,
    ADMIN,
    /** Scheduled jobs acting on their own. */
    SYSTEM;

    public boolean isStaff() {
        return this == STAFF || this == ADMIN;
    }
}
