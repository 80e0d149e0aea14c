package com.openstay.common.exception;

/**
 * Token presented for a hotel or booking other than the one it was issued for. Always fatal.
 */
public class TokenContextMismatchException extends CheckInTokenException {

    public TokenContextMismatchException(Object tokenId) {
        super("Check-in token does not belong to this hotel or booking", ErrorCodes.TOKEN_CONTEXT_MISMATCH, tokenId);
    }
}
