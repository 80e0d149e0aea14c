package com.openstay.inventory.domain.service;

import com.openstay.common.exception.InventoryUnderflowException;
import com.openstay.common.exception.ValidationException;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.api.dto.AvailabilitySnapshot;
import com.openstay.inventory.api.dto.CellAvailability;
import com.openstay.inventory.cache.AvailabilityCache;
import com.openstay.inventory.domain.model.InventoryCell;
import com.openstay.inventory.domain.repository.InventoryCellRepository;
import com.openstay.inventory.domain.strategy.LedgerStrategy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Authoritative record of rooms sold per (hotel, room type, night).
 *
 * Mutations are {@link Propagation#MANDATORY}: they only run inside a caller's transaction,
 * so a booking transition commits or rolls back its ledger changes together with the
 * booking and token writes. The concurrency mechanism is a {@link LedgerStrategy} looked up
 * by bean name from {@code inventory.ledger.strategy} (pessimistic | atomic | distributed).
 *
 * Multi-type operations walk room types in lexicographic order so concurrent bookings
 * lock cells in the same order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryLedger {

    private static final String DEFAULT_STRATEGY = "pessimistic";

    private final Map<String, LedgerStrategy> ledgerStrategies;
    private final InventoryCellRepository repository;
    private final AvailabilityCache availabilityCache;

    @Value("${inventory.ledger.strategy:pessimistic}")
    private String strategyType;

    @PostConstruct
    public void init() {
        log.info("Initialized InventoryLedger with strategy: {}", getLedgerStrategy().getStrategyType());
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void reserve(Long hotelId, String roomType, DateRange range, int quantity) {
        requirePositive(roomType, quantity);
        getLedgerStrategy().reserve(hotelId, roomType, range, quantity);
    }

    /**
     * Reserves every room type or nothing: the first failure propagates and the caller's
     * transaction discards the types already reserved.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void reserveAll(Long hotelId, Map<String, Integer> quantities, DateRange range) {
        SortedMap<String, Integer> ordered = canonical(quantities);
        LedgerStrategy strategy = getLedgerStrategy();
        ordered.forEach((roomType, quantity) -> strategy.reserve(hotelId, roomType, range, quantity));
        log.info("Reserved {} for hotel {} over {}", ordered, hotelId, range);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void release(Long hotelId, String roomType, DateRange range, int quantity) {
        requirePositive(roomType, quantity);
        getLedgerStrategy().release(hotelId, roomType, range, quantity);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void releaseAll(Long hotelId, Map<String, Integer> quantities, DateRange range) {
        if (range.isEmpty()) {
            log.debug("Nothing to release for hotel {}: empty range", hotelId);
            return;
        }
        SortedMap<String, Integer> ordered = canonical(quantities);
        LedgerStrategy strategy = getLedgerStrategy();
        ordered.forEach((roomType, quantity) -> strategy.release(hotelId, roomType, range, quantity));
        log.info("Released {} for hotel {} over {}", ordered, hotelId, range);
    }

    /**
     * Consistency check for a reservation that already exists: every night must still carry
     * at least the held quantity and must not be oversold. Makes no availability decision.
     *
     * @throws InventoryUnderflowException when the ledger no longer holds the rooms
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void assertHeld(Long hotelId, Map<String, Integer> quantities, DateRange range) {
        canonical(quantities).forEach((roomType, quantity) -> {
            Map<LocalDate, InventoryCell> cells = repository
                    .findRange(hotelId, roomType, range.start(), range.endExclusive()).stream()
                    .collect(Collectors.toMap(InventoryCell::getStayDate, Function.identity()));
            for (LocalDate date : range.days()) {
                InventoryCell cell = cells.get(date);
                if (cell == null || cell.getReservedCount() < quantity || cell.availableRooms() < 0) {
                    log.error("Ledger no longer holds {} x {} for hotel {} on {}", quantity, roomType, hotelId, date);
                    throw new InventoryUnderflowException(hotelId, roomType, date, quantity);
                }
            }
        });
    }

    /**
     * Browsing read. Nights may be served from the availability cache and be stale by up
     * to its TTL; a miss falls through to the database and refills the cache.
     */
    @Transactional(readOnly = true)
    public AvailabilitySnapshot query(Long hotelId, Set<String> roomTypes, DateRange range) {
        Map<LocalDate, List<CellAvailability>> byDay = new TreeMap<>();
        List<LocalDate> misses = new ArrayList<>();
        for (LocalDate day : range.days()) {
            availabilityCache.get(hotelId, day).ifPresentOrElse(
                    cells -> byDay.put(day, cells),
                    () -> misses.add(day));
        }
        boolean fromCache = misses.size() < range.nights();
        if (!misses.isEmpty()) {
            Map<LocalDate, List<CellAvailability>> loaded = loadDays(hotelId, misses);
            for (LocalDate day : misses) {
                List<CellAvailability> cells = loaded.getOrDefault(day, List.of());
                byDay.put(day, cells);
                availabilityCache.put(hotelId, day, cells);
            }
        }
        log.debug("Availability query for hotel {} over {}: {} night(s) from cache", hotelId, range,
                range.nights() - misses.size());
        return snapshot(hotelId, range, filter(byDay.values(), roomTypes), fromCache);
    }

    /**
     * Read that always goes to the database. Never cached, never caches.
     */
    @Transactional(readOnly = true)
    public AvailabilitySnapshot queryAuthoritative(Long hotelId, Set<String> roomTypes, DateRange range) {
        List<CellAvailability> cells = repository
                .findHotelRange(hotelId, range.start(), range.endExclusive()).stream()
                .map(CellAvailability::from)
                .toList();
        return snapshot(hotelId, range, filter(List.of(cells), roomTypes), false);
    }

    /**
     * Creates or resizes the cells of one room type. Capacity can never drop below the
     * rooms already reserved on a night. Cached nights are evicted once the change commits.
     */
    @Transactional
    public List<CellAvailability> provision(Long hotelId, String roomType, DateRange range, int totalRooms) {
        if (roomType == null || roomType.isBlank()) {
            throw new ValidationException("roomType", "Room type is required");
        }
        Map<LocalDate, InventoryCell> existing = repository
                .findForUpdate(hotelId, roomType, range.start(), range.endExclusive()).stream()
                .collect(Collectors.toMap(InventoryCell::getStayDate, Function.identity()));
        List<CellAvailability> result = new ArrayList<>();
        for (LocalDate date : range.days()) {
            InventoryCell cell = existing.get(date);
            if (cell == null) {
                cell = repository.save(InventoryCell.provisioned(hotelId, roomType, date, totalRooms));
            } else {
                cell.resize(totalRooms);
            }
            result.add(CellAvailability.from(cell));
        }
        evictAfterCommit(hotelId, range);
        log.info("Provisioned {} room(s) of type {} for hotel {} over {}", totalRooms, roomType, hotelId, range);
        return result;
    }

    private Map<LocalDate, List<CellAvailability>> loadDays(Long hotelId, Collection<LocalDate> days) {
        return repository.findHotelDates(hotelId, days).stream()
                .map(CellAvailability::from)
                .collect(Collectors.groupingBy(CellAvailability::stayDate, TreeMap::new, Collectors.toList()));
    }

    private List<CellAvailability> filter(Collection<List<CellAvailability>> days, Set<String> roomTypes) {
        return days.stream()
                .flatMap(List::stream)
                .filter(cell -> roomTypes == null || roomTypes.isEmpty() || roomTypes.contains(cell.roomType()))
                .toList();
    }

    private AvailabilitySnapshot snapshot(Long hotelId, DateRange range, List<CellAvailability> cells, boolean fromCache) {
        return new AvailabilitySnapshot(hotelId, range.start(), range.endExclusive(), cells, fromCache);
    }

    private void evictAfterCommit(Long hotelId, DateRange range) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            availabilityCache.evict(hotelId, range);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                availabilityCache.evict(hotelId, range);
            }
        });
    }

    private SortedMap<String, Integer> canonical(Map<String, Integer> quantities) {
        if (quantities == null || quantities.isEmpty()) {
            throw new ValidationException("rooms", "At least one room type is required");
        }
        SortedMap<String, Integer> ordered = new TreeMap<>(quantities);
        ordered.forEach(this::requirePositive);
        return ordered;
    }

    private void requirePositive(String roomType, Integer quantity) {
        if (quantity == null || quantity < 1) {
            throw new ValidationException("quantity",
                    String.format("Quantity for room type %s must be at least 1", roomType));
        }
    }

    /**
     * Strategy lookup by bean name; falls back to pessimistic when the configured name is unknown.
     */
    private LedgerStrategy getLedgerStrategy() {
        LedgerStrategy strategy = ledgerStrategies.get(strategyType.toLowerCase());
        if (strategy == null) {
            log.warn("Unknown ledger strategy: {}. Available strategies: {}. Defaulting to {}",
                    strategyType, ledgerStrategies.keySet(), DEFAULT_STRATEGY);
            strategy = ledgerStrategies.get(DEFAULT_STRATEGY);
            if (strategy == null) {
                throw new IllegalStateException(
                        DEFAULT_STRATEGY + " strategy not found. Available strategies: " + ledgerStrategies.keySet());
            }
        }
        return strategy;
    }
}
