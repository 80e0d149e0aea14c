package com.openstay.booking.domain.service;

import com.openstay.booking.config.BookingRulesProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Maps stay dates onto instants in the hotel zone.
 */
@Component
@RequiredArgsConstructor
public class StayCalendar {

    private final Clock clock;
    private final BookingRulesProperties rules;

    public Instant now() {
        return clock.instant();
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), rules.getZone());
    }

    /** Moment the stay starts: the check-in date at the configured check-in time. */
    public Instant checkInInstant(LocalDate checkInDate) {
        return checkInDate.atTime(rules.getCheckInTime()).atZone(rules.getZone()).toInstant();
    }
}
