package com.openstay.common.exception;

/**
 * Token presented before its validity window opens.
 */
public class TokenNotYetValidException extends CheckInTokenException {

    public TokenNotYetValidException(Object tokenId) {
        super("Check-in token is not valid yet", ErrorCodes.TOKEN_NOT_YET_VALID, tokenId);
    }
}
