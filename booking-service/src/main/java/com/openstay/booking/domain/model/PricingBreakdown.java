package com.openstay.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

@Embeddable
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class PricingBreakdown {

    @Column(name = "pricing_nights")
    private Integer nights;

    /** Least trustworthy source among the quotes that priced the booking. */
    @Enumerated(EnumType.STRING)
    @Column(name = "pricing_source", length = 20)
    private PricingSource pricingSource;
}
