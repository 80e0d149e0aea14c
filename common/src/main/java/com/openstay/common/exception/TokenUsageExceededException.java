package com.openstay.common.exception;

/**
 * Token reached its usage cap.
 */
public class TokenUsageExceededException extends CheckInTokenException {

    public TokenUsageExceededException(Object tokenId) {
        super("Check-in token has no remaining uses", ErrorCodes.TOKEN_USAGE_EXCEEDED, tokenId);
    }
}
