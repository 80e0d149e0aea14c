package com.openstay.common.exception;

/**
 * The acting user's role does not allow the operation.
 */
public class ActionNotPermittedException extends BusinessException {

    public ActionNotPermittedException(String action, Object role) {
        super(String.format("Role %s is not permitted to %s", role, action), ErrorCodes.ACTION_NOT_PERMITTED);
        detail("action", action);
        detail("role", String.valueOf(role));
    }
}
