package com.openstay.booking.api.controller;

import com.openstay.booking.api.dto.CheckInTokenResponse;
import com.openstay.booking.api.dto.RevokeTokenRequest;
import com.openstay.booking.api.dto.TokenValidationRequest;
import com.openstay.booking.api.dto.TokenValidationResponse;
import com.openstay.booking.domain.model.Actor;
import com.openstay.booking.domain.model.ActorRole;
import com.openstay.booking.token.CheckInTokenService;
import com.openstay.booking.token.IssueContext;
import com.openstay.booking.token.IssuedToken;
import com.openstay.booking.token.TokenAuditTrail;
import com.openstay.booking.token.TokenContext;
import com.openstay.booking.token.TokenStatistics;
import com.openstay.common.dto.BaseResponse;
import com.openstay.common.util.Constants;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/checkin-tokens")
@RequiredArgsConstructor
public class CheckInTokenController {

    private final CheckInTokenService tokenService;

    @PostMapping("/bookings/{bookingId}")
    public ResponseEntity<BaseResponse<IssuedToken>> issueToken(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @RequestHeader(value = Constants.HEADER_DEVICE_FINGERPRINT, required = false) String deviceFingerprint,
            @PathVariable Long bookingId,
            HttpServletRequest servletRequest) {
        IssuedToken token = tokenService.issueForBooking(bookingId, Actor.fromHeaders(actorId, role),
                new IssueContext(servletRequest.getRemoteAddr(), deviceFingerprint));
        return ResponseEntity.ok(BaseResponse.success("Check-in token issued", token));
    }

    @PostMapping("/bookings/{bookingId}/reissue")
    public ResponseEntity<BaseResponse<IssuedToken>> reissueToken(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @RequestHeader(value = Constants.HEADER_DEVICE_FINGERPRINT, required = false) String deviceFingerprint,
            @PathVariable Long bookingId,
            @Valid @RequestBody(required = false) RevokeTokenRequest request,
            HttpServletRequest servletRequest) {
        String reason = request == null || request.reason() == null ? "Reissued" : request.reason();
        IssuedToken token = tokenService.reissueForBooking(bookingId, Actor.fromHeaders(actorId, role), reason,
                new IssueContext(servletRequest.getRemoteAddr(), deviceFingerprint));
        return ResponseEntity.ok(BaseResponse.success("Check-in token reissued", token));
    }

    @GetMapping("/bookings/{bookingId}")
    public ResponseEntity<BaseResponse<List<CheckInTokenResponse>>> tokensForBooking(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long bookingId) {
        List<CheckInTokenResponse> tokens = tokenService.tokensForBooking(bookingId, Actor.fromHeaders(actorId, role)).stream()
                .map(CheckInTokenResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(tokens));
    }

    /**
     * The caller's own ACTIVE tokens.
     */
    @GetMapping("/mine")
    public ResponseEntity<BaseResponse<List<IssuedToken>>> myTokens(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role) {
        return ResponseEntity.ok(BaseResponse.success(tokenService.activeTokensOf(Actor.fromHeaders(actorId, role))));
    }

    @GetMapping("/{tokenId}/audit")
    public ResponseEntity<BaseResponse<TokenAuditTrail>> auditTrail(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable UUID tokenId) {
        return ResponseEntity.ok(BaseResponse.success(tokenService.auditTrail(tokenId, Actor.fromHeaders(actorId, role))));
    }

    @GetMapping("/hotels/{hotelId}/stats")
    public ResponseEntity<BaseResponse<TokenStatistics>> statistics(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable Long hotelId) {
        return ResponseEntity.ok(BaseResponse.success(tokenService.statistics(hotelId, Actor.fromHeaders(actorId, role))));
    }

    /**
     * Dry-run check: reports why a token would be refused without consuming a use.
     */
    @PostMapping("/validation")
    public ResponseEntity<BaseResponse<TokenValidationResponse>> validateToken(
            @Valid @RequestBody TokenValidationRequest request) {
        TokenValidationResponse response = TokenValidationResponse.from(
                tokenService.validate(request.token(), new TokenContext(request.hotelId(), request.bookingId())));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/{tokenId}/revocation")
    public ResponseEntity<BaseResponse<Void>> revokeToken(
            @RequestHeader(Constants.HEADER_ACTOR_ID) Long actorId,
            @RequestHeader(Constants.HEADER_ACTOR_ROLE) ActorRole role,
            @PathVariable UUID tokenId,
            @Valid @RequestBody(required = false) RevokeTokenRequest request) {
        tokenService.revoke(tokenId, Actor.fromHeaders(actorId, role), request == null ? null : request.reason());
        return ResponseEntity.ok(BaseResponse.success("Check-in token revoked", null));
    }
}
