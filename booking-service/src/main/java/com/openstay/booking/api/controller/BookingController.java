package com.openstay.booking.api.controller;

import com.openstay.booking.api.dto.BookingResponse;
import com.openstay.booking.api.dto.CancelBookingRequest;
import com.openstay.booking.api.dto.CheckInRequest;
import com.openstay.booking.api.dto.CreateBookingRequest;
import com.openstay.booking.api.dto.ModifyBookingRequest;
import com.openstay.booking.api.dto.NoShowRequest;
import com.openstay.booking.api.dto.ValidateBookingRequest;
import com.openstay.booking.domain.model.Actor;
import com.openstay.booking.domain.model.ActorRole;
import com.openstay.booking.domain.service.BookingStateMachine;
import com.openstay.booking.token.IssueContext;
import com.openstay.common.dto.BaseResponse;
import com.openstay.common.util.Constants;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST surface of the booking lifecycle. The caller identifies itself with the
 * {@code X-Actor-Id} and {@code X-Actor-Role} headers.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingStateMachine stateMachine;

    @PostMapping
    public ResponseEntity<BaseResponse<BookingResponse>> createBooking(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @Valid @RequestBody CreateBookingRequest request) {
        BookingResponse response = stateMachine.create(request, Actor.fromHeaders(actorId, role));
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Booking created successfully", response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success(stateMachine.get(id, Actor.fromHeaders(actorId, role))));
    }

    @GetMapping("/customer/{customerId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookingsByCustomer(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long customerId) {
        return ResponseEntity.ok(BaseResponse.success(stateMachine.listForCustomer(customerId, Actor.fromHeaders(actorId, role))));
    }

    @PostMapping("/{id}/validation")
    public ResponseEntity<BaseResponse<BookingResponse>> validateBooking(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @RequestHeader(value = Constants.HEADER_DEVICE_FINGERPRINT, required = false) String deviceFingerprint,
            @PathVariable Long id,
            @Valid @RequestBody ValidateBookingRequest request,
            HttpServletRequest servletRequest) {
        BookingResponse response = stateMachine.validate(id, request, Actor.fromHeaders(actorId, role),
                new IssueContext(servletRequest.getRemoteAddr(), deviceFingerprint));
        return ResponseEntity.ok(BaseResponse.success("Booking validated: " + request.decision(), response));
    }

    @PostMapping("/{id}/check-in")
    public ResponseEntity<BaseResponse<BookingResponse>> checkIn(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @RequestHeader(value = Constants.HEADER_DEVICE_FINGERPRINT, required = false) String deviceFingerprint,
            @PathVariable Long id,
            @Valid @RequestBody CheckInRequest request,
            HttpServletRequest servletRequest) {
        BookingResponse response = stateMachine.checkIn(id, request, Actor.fromHeaders(actorId, role),
                servletRequest.getRemoteAddr(), deviceFingerprint);
        return ResponseEntity.ok(BaseResponse.success("Guest checked in", response));
    }

    @PostMapping("/{id}/check-out")
    public ResponseEntity<BaseResponse<BookingResponse>> checkOut(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long id) {
        return ResponseEntity.ok(BaseResponse.success("Guest checked out",
                stateMachine.checkOut(id, Actor.fromHeaders(actorId, role))));
    }

    @PostMapping("/{id}/cancellation")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long id,
            @Valid @RequestBody CancelBookingRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled",
                stateMachine.cancel(id, request, Actor.fromHeaders(actorId, role))));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> modifyBooking(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long id,
            @Valid @RequestBody ModifyBookingRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking modified",
                stateMachine.modify(id, request, Actor.fromHeaders(actorId, role))));
    }

    @PostMapping("/{id}/no-show")
    public ResponseEntity<BaseResponse<BookingResponse>> markNoShow(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long id,
            @Valid @RequestBody(required = false) NoShowRequest request) {
        return ResponseEntity.ok(BaseResponse.success("Booking marked as no-show",
                stateMachine.markNoShow(id, Actor.fromHeaders(actorId, role), request == null ? null : request.reason())));
    }
}
