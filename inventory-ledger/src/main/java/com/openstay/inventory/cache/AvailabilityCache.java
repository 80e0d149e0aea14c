package com.openstay.inventory.cache;

import com.openstay.common.util.DateRange;
import com.openstay.inventory.api.dto.CellAvailability;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Bounded-staleness cache of a hotel's cells for one night, all room types together.
 * Used only for browsing reads; reservation decisions never consult it.
 * Entries are evicted after each committed mutation, never updated in place.
 */
public interface AvailabilityCache {

    Optional<List<CellAvailability>> get(Long hotelId, LocalDate stayDate);

    void put(Long hotelId, LocalDate stayDate, List<CellAvailability> cells);

    void evict(Long hotelId, DateRange range);
}
