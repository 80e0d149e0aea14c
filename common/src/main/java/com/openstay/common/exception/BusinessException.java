package com.openstay.common.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every domain failure raised by the booking engine.
 * Each subclass fixes its error code; callers branch on the type or on {@link #getErrorCode()}.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;
    private final Map<String, Object> details;

    public BusinessException(String message, String errorCode) {
        this(message, null, errorCode);
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = new LinkedHashMap<>();
    }

    /**
     * Whether the caller may retry the same command with backoff.
     */
    public boolean isRetryable() {
        return false;
    }

    public Map<String, Object> getDetails() {
        return Collections.unmodifiableMap(details);
    }

    protected void detail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
    }
}
