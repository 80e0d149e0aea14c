package com.openstay.booking.domain.model;

/**
 * Where a room price came from, ordered from most to least trustworthy.
 */
public enum PricingSource {
    ORACLE,
    LAST_KNOWN,
    DEFAULT;

    public PricingSource worst(PricingSource other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
