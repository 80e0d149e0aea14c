package com.openstay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Booking lifecycle and inventory engine. Lives in the root package so the booking,
 * inventory and common modules are all scanned, including their entities and repositories.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class OpenStayApplication {

    public static void main(String[] args) {
        SpringApplication.run(OpenStayApplication.class, args);
    }
}
