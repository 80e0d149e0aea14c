package com.openstay.booking.client;

import com.openstay.booking.client.dto.PricingQuoteResponse;
import com.openstay.booking.domain.model.PricingSource;
import com.openstay.booking.port.PriceQuote;
import com.openstay.booking.port.PricingOracle;
import com.openstay.common.util.DateRange;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link PricingOracle} backed by the remote pricing service.
 *
 * Calls go through a circuit breaker and a retry ({@code resilience4j.*.instances.pricing-oracle}).
 * When the retries are exhausted or the breaker is open, the last price seen for the same
 * hotel and room type is used, and failing that the configured default.
 */
@Slf4j
@Component
public class PricingOracleAdapter implements PricingOracle {

    private final PricingClient pricingClient;
    private final Map<String, BigDecimal> lastKnownPrices = new ConcurrentHashMap<>();

    @Value("${booking.pricing.default-price-per-night:100.00}")
    private BigDecimal defaultPricePerNight;

    public PricingOracleAdapter(PricingClient pricingClient) {
        this.pricingClient = pricingClient;
    }

    @Override
    @Retry(name = "pricing-oracle", fallbackMethod = "fallbackPrice")
    @CircuitBreaker(name = "pricing-oracle")
    public PriceQuote priceFor(Long hotelId, String roomType, DateRange stay) {
        PricingQuoteResponse response = pricingClient.quote(hotelId, roomType,
                stay.start().toString(), stay.endExclusive().toString());
        if (response == null || response.pricePerNight() == null || response.pricePerNight().signum() < 0) {
            throw new IllegalStateException("Pricing oracle returned no usable price for " + roomType
                    + " at hotel " + hotelId);
        }
        lastKnownPrices.put(key(hotelId, roomType), response.pricePerNight());
        return new PriceQuote(response.pricePerNight(), PricingSource.ORACLE);
    }

    PriceQuote fallbackPrice(Long hotelId, String roomType, DateRange stay, Throwable ex) {
        BigDecimal lastKnown = lastKnownPrices.get(key(hotelId, roomType));
        if (lastKnown != null) {
            log.warn("Pricing oracle unavailable for hotel {} type {} ({}), using last known price {}",
                    hotelId, roomType, ex.toString(), lastKnown);
            return new PriceQuote(lastKnown, PricingSource.LAST_KNOWN);
        }
        log.warn("Pricing oracle unavailable for hotel {} type {} ({}), using default price {}",
                hotelId, roomType, ex.toString(), defaultPricePerNight);
        return new PriceQuote(defaultPricePerNight, PricingSource.DEFAULT);
    }

    private static String key(Long hotelId, String roomType) {
        return hotelId + ":" + roomType;
    }
}
