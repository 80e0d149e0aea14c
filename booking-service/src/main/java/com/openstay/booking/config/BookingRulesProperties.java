package com.openstay.booking.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Business limits for bookings ({@code booking.rules.*}).
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking.rules")
public class BookingRulesProperties {

    @Min(1)
    private int minNights = 1;

    @Min(1)
    private int maxNights = 365;

    @Min(1)
    private int maxRoomsPerBooking = 10;

    /** Upper bound for one state transition's database transaction. */
    @Min(1)
    private int transactionTimeoutSeconds = 5;

    /** Zone in which stay dates are interpreted. */
    @NotNull
    private ZoneId zone = ZoneId.of("UTC");

    /** Local time at which a stay starts on its check-in date. */
    @NotNull
    private LocalTime checkInTime = LocalTime.of(15, 0);
}
