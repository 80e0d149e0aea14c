package com.openstay.booking.client.dto;

import java.math.BigDecimal;

public record PricingQuoteResponse(
        Long hotelId,
        String roomType,
        BigDecimal pricePerNight,
        String currency
) {
}
