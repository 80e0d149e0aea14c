package com.openstay.booking.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(BookingRulesProperties rules) {
        return Clock.system(rules.getZone());
    }
}
