package com.openstay.inventory.api.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Availability of some room types over a date range.
 * {@code fromCache} is true when at least one night came from the availability cache,
 * in which case the figures may be stale by up to the cache TTL.
 */
public record AvailabilitySnapshot(
        Long hotelId,
        LocalDate from,
        LocalDate to,
        List<CellAvailability> cells,
        boolean fromCache
) {
    /**
     * Rooms of the given type bookable for the whole range: the minimum over all nights,
     * with a night that has no cell counting as zero.
     */
    public int bookableRooms(String roomType) {
        long nights = from.datesUntil(to).count();
        List<CellAvailability> ofType = cells.stream()
                .filter(c -> c.roomType().equals(roomType))
                .toList();
        if (nights == 0 || ofType.size() < nights) {
            return 0;
        }
        return ofType.stream().mapToInt(CellAvailability::availableRooms).min().orElse(0);
    }

    public Map<String, Integer> bookableRooms(Set<String> roomTypes) {
        Map<String, Integer> result = new TreeMap<>();
        roomTypes.forEach(type -> result.put(type, bookableRooms(type)));
        return result;
    }
}
