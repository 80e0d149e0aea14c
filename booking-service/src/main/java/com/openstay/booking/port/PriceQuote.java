package com.openstay.booking.port;

import com.openstay.booking.domain.model.PricingSource;

import java.math.BigDecimal;

public record PriceQuote(BigDecimal pricePerNight, PricingSource source) {
}
