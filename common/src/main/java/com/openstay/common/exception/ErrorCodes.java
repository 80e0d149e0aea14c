package com.openstay.common.exception;

/**
 * Error codes carried by {@link BusinessException} and echoed in API error envelopes.
 */
public final class ErrorCodes {
    private ErrorCodes() {
    }

    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";
    public static final String INSUFFICIENT_AVAILABILITY = "INSUFFICIENT_AVAILABILITY";
    public static final String INVENTORY_UNDERFLOW = "INVENTORY_UNDERFLOW";
    public static final String ROOM_OCCUPIED = "ROOM_OCCUPIED";
    public static final String TOKEN_INVALID = "TOKEN_INVALID";
    public static final String TOKEN_EXPIRED = "TOKEN_EXPIRED";
    public static final String TOKEN_REVOKED = "TOKEN_REVOKED";
    public static final String TOKEN_USAGE_EXCEEDED = "TOKEN_USAGE_EXCEEDED";
    public static final String TOKEN_CONTEXT_MISMATCH = "TOKEN_CONTEXT_MISMATCH";
    public static final String TOKEN_NOT_YET_VALID = "TOKEN_NOT_YET_VALID";
    public static final String TOKEN_ALREADY_ACTIVE = "TOKEN_ALREADY_ACTIVE";
    public static final String TOKEN_RATE_LIMITED = "TOKEN_RATE_LIMITED";
    public static final String TRANSACTION_CONFLICT = "TRANSACTION_CONFLICT";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String ACTION_NOT_PERMITTED = "ACTION_NOT_PERMITTED";
    public static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
