package com.openstay.booking.domain.service;

import com.openstay.booking.domain.model.BookingRoom;
import com.openstay.booking.domain.model.PricingBreakdown;
import com.openstay.booking.domain.model.PricingSource;
import com.openstay.booking.port.PriceQuote;
import com.openstay.booking.port.PricingOracle;
import com.openstay.common.util.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Prices a stay room by room. Called before the booking transaction opens so a slow
 * oracle never holds inventory locks.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPricer {

    private final PricingOracle pricingOracle;

    public PricedStay price(Long hotelId, Map<String, Integer> quantities, DateRange stay) {
        List<BookingRoom> rooms = new ArrayList<>();
        PricingSource source = PricingSource.ORACLE;
        BigDecimal nights = BigDecimal.valueOf(stay.nights());
        for (Map.Entry<String, Integer> entry : new TreeMap<>(quantities).entrySet()) {
            PriceQuote quote = pricingOracle.priceFor(hotelId, entry.getKey(), stay);
            BigDecimal perRoom = quote.pricePerNight().multiply(nights).setScale(2, RoundingMode.HALF_UP);
            for (int i = 0; i < entry.getValue(); i++) {
                rooms.add(BookingRoom.unassigned(entry.getKey(), perRoom));
            }
            source = source.worst(quote.source());
        }
        if (source != PricingSource.ORACLE) {
            log.warn("Stay {} at hotel {} priced with {} prices", stay, hotelId, source);
        }
        return new PricedStay(rooms, new PricingBreakdown(stay.nights(), source));
    }
}
