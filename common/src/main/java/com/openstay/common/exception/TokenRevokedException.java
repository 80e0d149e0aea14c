package com.openstay.common.exception;

/**
 * Token was revoked by staff or by a booking transition.
 */
public class TokenRevokedException extends CheckInTokenException {

    public TokenRevokedException(Object tokenId) {
        super("Check-in token has been revoked", ErrorCodes.TOKEN_REVOKED, tokenId);
    }
}
