package com.openstay.inventory.domain.strategy;

import com.openstay.common.exception.InsufficientAvailabilityException;
import com.openstay.common.exception.InventoryUnderflowException;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.domain.model.InventoryCell;
import com.openstay.inventory.domain.repository.InventoryCellRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Ledger strategy using pessimistic row locks (SELECT FOR UPDATE).
 *
 * Flow:
 * 1. Lock every cell of the room type in the range, ordered by date
 * 2. Check each night (a missing cell means zero capacity)
 * 3. Move reservedCount on the locked entities; flushed on commit
 *
 * Locks are held until the caller's transaction ends, so a competing booking for the
 * same cells waits and then sees the committed counts.
 */
@Slf4j
@Component("pessimistic")
@RequiredArgsConstructor
public class PessimisticLockLedgerStrategy implements LedgerStrategy {

    private final InventoryCellRepository repository;

    @Override
    public void reserve(Long hotelId, String roomType, DateRange range, int quantity) {
        Map<LocalDate, InventoryCell> cells = lockCells(hotelId, roomType, range);
        for (LocalDate date : range.days()) {
            InventoryCell cell = cells.get(date);
            if (cell == null) {
                throw new InsufficientAvailabilityException(hotelId, roomType, date, quantity);
            }
            cell.reserve(quantity);
        }
        log.debug("Reserved {} x {} for hotel {} over {} (pessimistic)", quantity, roomType, hotelId, range);
    }

    @Override
    public void release(Long hotelId, String roomType, DateRange range, int quantity) {
        Map<LocalDate, InventoryCell> cells = lockCells(hotelId, roomType, range);
        for (LocalDate date : range.days()) {
            InventoryCell cell = cells.get(date);
            if (cell == null) {
                throw new InventoryUnderflowException(hotelId, roomType, date, quantity);
            }
            cell.release(quantity);
        }
        log.debug("Released {} x {} for hotel {} over {} (pessimistic)", quantity, roomType, hotelId, range);
    }

    @Override
    public String getStrategyType() {
        return "PESSIMISTIC_LOCK";
    }

    private Map<LocalDate, InventoryCell> lockCells(Long hotelId, String roomType, DateRange range) {
        List<InventoryCell> locked = repository.findForUpdate(hotelId, roomType, range.start(), range.endExclusive());
        return locked.stream().collect(Collectors.toMap(InventoryCell::getStayDate, Function.identity()));
    }
}
