package com.openstay.common.exception;

/**
 * A state machine guard rejected the requested transition.
 */
public class InvalidTransitionException extends BusinessException {

    public InvalidTransitionException(String message) {
        super(message, ErrorCodes.INVALID_TRANSITION);
    }

    public InvalidTransitionException(String subject, Object from, Object to) {
        super(String.format("%s cannot move from %s to %s", subject, from, to), ErrorCodes.INVALID_TRANSITION);
        detail("from", String.valueOf(from));
        detail("to", String.valueOf(to));
    }
}
