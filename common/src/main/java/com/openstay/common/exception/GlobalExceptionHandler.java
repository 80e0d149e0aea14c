package com.openstay.common.exception;

import com.openstay.common.dto.BaseResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Translates the typed failures of the booking engine into HTTP responses.
 * The domain layer never sees HTTP; this is the only place status codes are chosen.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Set<String> CONFLICT_CODES = Set.of(
            ErrorCodes.INVALID_TRANSITION,
            ErrorCodes.INSUFFICIENT_AVAILABILITY,
            ErrorCodes.ROOM_OCCUPIED,
            ErrorCodes.TOKEN_ALREADY_ACTIVE);

    private static final Set<String> GONE_CODES = Set.of(
            ErrorCodes.TOKEN_EXPIRED,
            ErrorCodes.TOKEN_REVOKED,
            ErrorCodes.TOKEN_USAGE_EXCEEDED);

    private static final Set<String> UNPROCESSABLE_CODES = Set.of(
            ErrorCodes.TOKEN_INVALID,
            ErrorCodes.TOKEN_NOT_YET_VALID,
            ErrorCodes.TOKEN_CONTEXT_MISMATCH);

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<BaseResponse<?>> handleBusinessException(BusinessException ex) {
        HttpStatus status = statusFor(ex.getErrorCode());
        log.warn("Business exception [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(envelope(ex));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<BaseResponse<?>> handleResourceNotFoundException(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(envelope(ex));
    }

    @ExceptionHandler(ActionNotPermittedException.class)
    public ResponseEntity<BaseResponse<?>> handleActionNotPermitted(ActionNotPermittedException ex) {
        log.warn("Action not permitted: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(envelope(ex));
    }

    @ExceptionHandler(TransactionConflictException.class)
    public ResponseEntity<BaseResponse<?>> handleTransactionConflict(TransactionConflictException ex) {
        log.warn("Transaction conflict, caller may retry: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(envelope(ex));
    }

    @ExceptionHandler(TokenRateLimitedException.class)
    public ResponseEntity<BaseResponse<?>> handleTokenRateLimited(TokenRateLimitedException ex) {
        log.warn("Token generation throttled: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, "60")
                .body(envelope(ex));
    }

    @ExceptionHandler(InventoryUnderflowException.class)
    public ResponseEntity<BaseResponse<?>> handleInventoryUnderflow(InventoryUnderflowException ex) {
        log.error("Inventory ledger inconsistency: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(envelope(ex));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<BaseResponse<Map<String, String>>> handleValidationException(
            MethodArgumentNotValidException ex) {
        log.warn("Validation exception: {}", ex.getMessage());
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        BaseResponse<Map<String, String>> response = BaseResponse.error("Validation failed", ErrorCodes.VALIDATION_ERROR);
        response.setData(errors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler({
            MissingRequestHeaderException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<BaseResponse<?>> handleMalformedRequest(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        BaseResponse<?> response = BaseResponse.error("Malformed request: " + ex.getMessage(), ErrorCodes.VALIDATION_ERROR);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<BaseResponse<?>> handleGenericException(Exception ex) {
        log.error("Unexpected error occurred", ex);
        BaseResponse<?> response = BaseResponse.error("An unexpected error occurred", ErrorCodes.INTERNAL_ERROR);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    static HttpStatus statusFor(String errorCode) {
        if (CONFLICT_CODES.contains(errorCode)) {
            return HttpStatus.CONFLICT;
        }
        if (GONE_CODES.contains(errorCode)) {
            return HttpStatus.GONE;
        }
        if (UNPROCESSABLE_CODES.contains(errorCode)) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private BaseResponse<?> envelope(BusinessException ex) {
        return BaseResponse.error(ex.getMessage(), ex.getErrorCode(), new LinkedHashMap<>(ex.getDetails()));
    }
}
