package com.openstay.booking.domain.model;

public enum CheckInMethod {
    TOKEN,
    MANUAL
}
