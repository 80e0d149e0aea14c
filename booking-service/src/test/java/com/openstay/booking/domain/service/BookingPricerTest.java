package com.openstay.booking.domain.service;

import com.openstay.booking.domain.model.BookingRoom;
import com.openstay.booking.domain.model.PricingSource;
import com.openstay.booking.port.PriceQuote;
import com.openstay.booking.port.PricingOracle;
import com.openstay.common.util.DateRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingPricerTest {

    private static final DateRange STAY = DateRange.stay(LocalDate.of(2026, 6, 3), LocalDate.of(2026, 6, 6));

    @Mock
    private PricingOracle pricingOracle;

    @InjectMocks
    private BookingPricer pricer;

    @Test
    @DisplayName("each room is priced for the whole stay and the worst source is reported")
    void price_perRoomAndWorstSource() {
        // given
        when(pricingOracle.priceFor(eq(7L), eq("DELUXE"), any()))
                .thenReturn(new PriceQuote(new BigDecimal("120.50"), PricingSource.ORACLE));
        when(pricingOracle.priceFor(eq(7L), eq("STANDARD"), any()))
                .thenReturn(new PriceQuote(new BigDecimal("80"), PricingSource.LAST_KNOWN));

        // when
        PricedStay priced = pricer.price(7L, Map.of("STANDARD", 1, "DELUXE", 2), STAY);

        // then
        assertThat(priced.rooms()).extracting(BookingRoom::getRoomType)
                .containsExactly("DELUXE", "DELUXE", "STANDARD");
        assertThat(priced.rooms()).extracting(BookingRoom::getPricePerRoom)
                .containsExactly(new BigDecimal("361.50"), new BigDecimal("361.50"), new BigDecimal("240.00"));
        assertThat(priced.pricing().getNights()).isEqualTo(3);
        assertThat(priced.pricing().getPricingSource()).isEqualTo(PricingSource.LAST_KNOWN);
    }
}
