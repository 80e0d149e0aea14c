package com.openstay.common.exception;

/**
 * The transaction could not commit because of lock contention, a serialization
 * failure or its timeout. Everything was rolled back; the only retryable failure.
 */
public class TransactionConflictException extends BusinessException {

    public TransactionConflictException(String message, Throwable cause) {
        super(message, cause, ErrorCodes.TRANSACTION_CONFLICT);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
