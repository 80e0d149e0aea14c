package com.openstay.booking.domain.service;

import com.openstay.booking.domain.model.BookingRoom;
import com.openstay.booking.domain.model.PricingBreakdown;

import java.util.List;

public record PricedStay(List<BookingRoom> rooms, PricingBreakdown pricing) {
}
