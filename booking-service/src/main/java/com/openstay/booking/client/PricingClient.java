package com.openstay.booking.client;

import com.openstay.booking.client.dto.PricingQuoteResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the external pricing oracle.
 */
@FeignClient(name = "pricing-oracle", url = "${booking.pricing.url}", path = "/api/v1/pricing")
public interface PricingClient {

    @GetMapping("/quote")
    PricingQuoteResponse quote(@RequestParam("hotelId") Long hotelId,
                               @RequestParam("roomType") String roomType,
                               @RequestParam("checkIn") String checkIn,
                               @RequestParam("checkOut") String checkOut);
}
