package com.openstay.booking.job;

import com.openstay.booking.token.CheckInTokenService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class TokenExpiryJob {

    private final CheckInTokenService tokenService;

    @Scheduled(fixedDelayString = "${booking.checkin-token.expiry-interval-ms:300000}")
    public void expireTokens() {
        try {
            tokenService.expireOverdueTokens();
        } catch (Exception e) {
            log.error("Check-in token expiry run failed", e);
        }
    }
}
