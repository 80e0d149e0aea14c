package com.openstay.common.exception;

/**
 * Issue refused because the booking already has an ACTIVE token; revoke it first.
 */
public class TokenAlreadyActiveException extends CheckInTokenException {

    public TokenAlreadyActiveException(Object tokenId) {
        super("Booking already has an active check-in token", ErrorCodes.TOKEN_ALREADY_ACTIVE, tokenId);
    }
}
