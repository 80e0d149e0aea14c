package com.openstay.booking.domain.model;

/**
 * Staff decision on a PENDING booking.
 */
public enum ValidationDecision {
    APPROVE,
    REJECT
}
