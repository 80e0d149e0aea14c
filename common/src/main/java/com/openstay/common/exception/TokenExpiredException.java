package com.openstay.common.exception;

/**
 * Token is past its expiry (beyond the grace period) or already marked EXPIRED.
 */
public class TokenExpiredException extends CheckInTokenException {

    public TokenExpiredException(Object tokenId) {
        super("Check-in token has expired", ErrorCodes.TOKEN_EXPIRED, tokenId);
    }
}
