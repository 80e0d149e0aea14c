package com.openstay.booking.job;

import com.openstay.booking.token.CheckInTokenService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenExpiryJobTest {

    @Mock
    private CheckInTokenService tokenService;

    @InjectMocks
    private TokenExpiryJob job;

    @Test
    @DisplayName("a failing run is logged and the next run still happens")
    void expireTokens_survivesFailure() {
        when(tokenService.expireOverdueTokens()).thenThrow(new IllegalStateException("database gone"));

        assertThatCode(() -> job.expireTokens()).doesNotThrowAnyException();
        verify(tokenService).expireOverdueTokens();
    }
}
