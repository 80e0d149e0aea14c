package com.openstay.booking.port;

import com.openstay.common.util.DateRange;

/**
 * Source of nightly room prices. Implementations degrade instead of failing, so a quote
 * is always returned; {@link PriceQuote#source()} tells how trustworthy it is.
 */
public interface PricingOracle {

    PriceQuote priceFor(Long hotelId, String roomType, DateRange stay);
}
