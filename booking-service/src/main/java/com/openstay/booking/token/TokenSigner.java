package com.openstay.booking.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openstay.booking.config.CheckInTokenProperties;
import com.openstay.common.exception.TokenInvalidException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;

/**
 * Encodes {@link TokenClaims} as {@code base64url(json).base64url(hmacSha256)}.
 */
@Slf4j
@Component
public class TokenSigner {

    private static final String ALGORITHM = "HmacSHA256";
    private static final int MIN_SECRET_BYTES = 32;

    private final ObjectMapper objectMapper;
    private final SecretKeySpec key;

    public TokenSigner(ObjectMapper objectMapper, CheckInTokenProperties properties) {
        String secret = properties.getSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("booking.checkin-token.secret must be at least "
                    + MIN_SECRET_BYTES + " bytes");
        }
        this.objectMapper = objectMapper;
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
    }

    public String sign(TokenClaims claims) {
        try {
            String payload = encode(objectMapper.writeValueAsBytes(claims));
            return payload + "." + encode(mac(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize token claims", e);
        }
    }

    /**
     * @throws TokenInvalidException when the token is malformed or the signature does not verify
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenInvalidException(null);
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw new TokenInvalidException(null);
        }
        String payload = token.substring(0, dot);
        byte[] signature;
        byte[] json;
        try {
            signature = Base64.getUrlDecoder().decode(token.substring(dot + 1));
            json = Base64.getUrlDecoder().decode(payload);
        } catch (IllegalArgumentException e) {
            throw new TokenInvalidException(null);
        }
        if (!MessageDigest.isEqual(mac(payload), signature)) {
            log.warn("Rejected check-in token with a bad signature");
            throw new TokenInvalidException(null);
        }
        try {
            return objectMapper.readValue(json, TokenClaims.class);
        } catch (IOException e) {
            throw new TokenInvalidException(null);
        }
    }

    private byte[] mac(String payload) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(payload.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }

    private static String encode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
