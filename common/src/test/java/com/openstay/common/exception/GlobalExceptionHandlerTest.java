package com.openstay.common.exception;

import com.openstay.common.dto.BaseResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("capacity and transition failures map to 409 with structured details")
    void insufficientAvailability_is409WithDetails() {
        ResponseEntity<BaseResponse<?>> response = handler.handleBusinessException(
                new InsufficientAvailabilityException(7L, "DELUXE", LocalDate.of(2026, 3, 2), 2));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getErrorCode()).isEqualTo("INSUFFICIENT_AVAILABILITY");
        assertThat(response.getBody().getDetails())
                .containsEntry("roomType", "DELUXE")
                .containsEntry("stayDate", "2026-03-02");
    }

    @Test
    @DisplayName("token failures map to 410 (spent) or 422 (wrong token)")
    void tokenFailures_mapToGoneOrUnprocessable() {
        assertThat(handler.handleBusinessException(new TokenExpiredException("t-1")).getStatusCode())
                .isEqualTo(HttpStatus.GONE);
        assertThat(handler.handleBusinessException(new TokenUsageExceededException("t-1")).getStatusCode())
                .isEqualTo(HttpStatus.GONE);
        assertThat(handler.handleBusinessException(new TokenContextMismatchException("t-1")).getStatusCode())
                .isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(handler.handleBusinessException(new ValidationException("bad")).getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    @DisplayName("transaction conflict is the only retryable failure and carries Retry-After")
    void transactionConflict_isRetryable() {
        TransactionConflictException ex = new TransactionConflictException("lock timeout", null);

        ResponseEntity<BaseResponse<?>> response = handler.handleTransactionConflict(ex);

        assertThat(ex.isRetryable()).isTrue();
        assertThat(new InvalidTransitionException("nope").isRetryable()).isFalse();
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("1");
    }

    @Test
    @DisplayName("an occupied room is a conflict naming the in-house booking")
    void roomOccupied_is409() {
        ResponseEntity<BaseResponse<?>> response = handler.handleBusinessException(
                new RoomOccupiedException(7L, "301", 12L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getErrorCode()).isEqualTo("ROOM_OCCUPIED");
        assertThat(response.getBody().getDetails())
                .containsEntry("roomId", "301")
                .containsEntry("occupiedByBookingId", 12L);
    }

    @Test
    @DisplayName("throttled token generation maps to 429 with a retry hint")
    void tokenRateLimited_is429() {
        ResponseEntity<BaseResponse<?>> response = handler.handleTokenRateLimited(new TokenRateLimitedException(42L));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getHeaders().getFirst("Retry-After")).isEqualTo("60");
        assertThat(response.getBody().getDetails()).containsEntry("customerId", 42L);
    }
}
