package com.openstay.booking.token;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openstay.booking.config.CheckInTokenProperties;
import com.openstay.common.exception.ErrorCodes;
import com.openstay.common.exception.TokenInvalidException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Base64;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenSignerTest {

    private static final String SECRET = "test-secret-that-is-at-least-32-bytes-long";

    private TokenSigner signer;
    private TokenClaims claims;

    @BeforeEach
    void setUp() {
        signer = new TokenSigner(new ObjectMapper(), properties(SECRET));
        claims = new TokenClaims(UUID.randomUUID(), 10L, 1L, 42L,
                1_780_000_000L, 1_780_100_000L, 1_780_300_000L, 5);
    }

    @Test
    @DisplayName("a signed token verifies back to its claims")
    void signAndVerify() {
        String token = signer.sign(claims);

        assertThat(token).doesNotContain("=").contains(".");
        assertThat(signer.verify(token)).isEqualTo(claims);
    }

    @Test
    @DisplayName("a changed payload breaks the signature")
    void tamperedPayload_rejected() {
        // given
        String token = signer.sign(claims);
        TokenClaims forged = new TokenClaims(claims.tokenId(), 11L, claims.hotelId(), claims.customerId(),
                claims.issuedAt(), claims.notBefore(), claims.expiresAt(), 50);
        String forgedPayload = signer.sign(forged).split("\\.")[0];
        String tampered = forgedPayload + "." + token.split("\\.")[1];

        // when / then
        assertThatThrownBy(() -> signer.verify(tampered))
                .isInstanceOf(TokenInvalidException.class)
                .extracting("errorCode").isEqualTo(ErrorCodes.TOKEN_INVALID);
    }

    @Test
    @DisplayName("a token signed with another key is rejected")
    void otherKey_rejected() {
        TokenSigner other = new TokenSigner(new ObjectMapper(), properties("another-secret-that-is-also-32-bytes-or-more"));

        assertThatThrownBy(() -> signer.verify(other.sign(claims)))
                .isInstanceOf(TokenInvalidException.class);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "no-dot", ".sig", "payload.", "a.b.c", "!!!.???"})
    @DisplayName("malformed tokens are rejected without leaking anything")
    void malformed_rejected(String token) {
        assertThatThrownBy(() -> signer.verify(token))
                .isInstanceOf(TokenInvalidException.class);
    }

    @Test
    @DisplayName("a correctly signed payload that is not a claims document is rejected")
    void signedGarbage_rejected() {
        String payload = Base64.getUrlEncoder().withoutPadding().encodeToString("not json".getBytes());
        String validSignatureOverGarbage = signer.sign(claims).split("\\.")[1];

        assertThatThrownBy(() -> signer.verify(payload + "." + validSignatureOverGarbage))
                .isInstanceOf(TokenInvalidException.class);
    }

    @Test
    @DisplayName("a secret shorter than 32 bytes refuses to start")
    void shortSecret_rejected() {
        assertThatThrownBy(() -> new TokenSigner(new ObjectMapper(), properties("too-short")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 bytes");
    }

    private static CheckInTokenProperties properties(String secret) {
        CheckInTokenProperties properties = new CheckInTokenProperties();
        properties.setSecret(secret);
        return properties;
    }
}
