package com.openstay.booking.token;

public enum TokenStatus {
    ACTIVE,
    /** Usage cap reached. */
    USED,
    EXPIRED,
    REVOKED
}
