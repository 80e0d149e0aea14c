package com.openstay.booking.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Check-in token policy ({@code booking.checkin-token.*}).
 * The validity window is anchored on the stay's check-in instant.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking.checkin-token")
public class CheckInTokenProperties {

    /** HMAC-SHA256 key; at least 32 bytes. */
    @NotBlank
    private String secret;

    @Min(0)
    private int validFromHoursBeforeCheckIn = 48;

    @Min(0)
    private int validUntilHoursAfterCheckIn = 12;

    /** Past expiry, validation still passes with a warning for this long. */
    @Min(0)
    private int gracePeriodMinutes = 15;

    @Min(1)
    private int maxUsage = 5;
}
