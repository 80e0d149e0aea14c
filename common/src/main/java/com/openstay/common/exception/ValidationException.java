package com.openstay.common.exception;

/**
 * Malformed command input, e.g. a check-in date not before the check-out date.
 */
public class ValidationException extends BusinessException {

    public ValidationException(String message) {
        super(message, ErrorCodes.VALIDATION_ERROR);
    }

    public ValidationException(String field, String message) {
        super(message, ErrorCodes.VALIDATION_ERROR);
        detail("field", field);
    }
}
