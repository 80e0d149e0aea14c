package com.openstay.common.exception;

/**
 * Base type for check-in token failures. The message never echoes the raw token.
 */
public abstract class CheckInTokenException extends BusinessException {

    protected CheckInTokenException(String message, String errorCode, Object tokenId) {
        super(message, errorCode);
        detail("tokenId", tokenId == null ? null : tokenId.toString());
    }
}
