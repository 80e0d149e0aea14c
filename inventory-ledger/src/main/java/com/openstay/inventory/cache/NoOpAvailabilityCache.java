package com.openstay.inventory.cache;

import com.openstay.common.util.DateRange;
import com.openstay.inventory.api.dto.CellAvailability;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Used when {@code inventory.ledger.cache.enabled=false}: every query reads the database.
 */
@Component
@ConditionalOnProperty(name = "inventory.ledger.cache.enabled", havingValue = "false")
public class NoOpAvailabilityCache implements AvailabilityCache {

    @Override
    public Optional<List<CellAvailability>> get(Long hotelId, LocalDate stayDate) {
        return Optional.empty();
    }

    @Override
    public void put(Long hotelId, LocalDate stayDate, List<CellAvailability> cells) {
    }

    @Override
    public void evict(Long hotelId, DateRange range) {
    }
}
