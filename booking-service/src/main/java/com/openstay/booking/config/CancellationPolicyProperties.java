package com.openstay.booking.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Refund thresholds ({@code booking.cancellation.*}): cancelling at least
 * {@code fullRefundHours} before check-in refunds everything, at least
 * {@code partialRefundHours} refunds {@code partialRefundPercentage}, later refunds nothing.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "booking.cancellation")
public class CancellationPolicyProperties {

    @Min(0)
    private int fullRefundHours = 24;

    @Min(0)
    private int partialRefundHours = 12;

    @Min(0)
    @Max(100)
    private int partialRefundPercentage = 50;
}
