package com.openstay.common.exception;

/**
 * Signature or integrity check failed, or the claims do not match the stored token.
 */
public class TokenInvalidException extends CheckInTokenException {

    public TokenInvalidException(Object tokenId) {
        super("Check-in token is malformed or its signature does not verify", ErrorCodes.TOKEN_INVALID, tokenId);
    }
}
