package com.openstay.inventory.domain.strategy;

import com.openstay.common.exception.InsufficientAvailabilityException;
import com.openstay.common.exception.InventoryUnderflowException;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.domain.repository.InventoryCellRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Ledger strategy using one guarded UPDATE per night:
 *
 *   UPDATE inventory_cells
 *   SET reserved_count = reserved_count + :quantity
 *   WHERE hotel_id = :hotelId AND room_type = :roomType AND stay_date = :date
 *     AND reserved_count + :quantity <= total_rooms;
 *
 * Availability is never derived from in-memory entity state. An UPDATE that touches
 * 0 rows means the night is missing or full; the exception rolls back the nights
 * already incremented in the caller's transaction.
 */
@Slf4j
@Component("atomic")
@RequiredArgsConstructor
public class AtomicUpdateLedgerStrategy implements LedgerStrategy {

    private final InventoryCellRepository repository;

    @Override
    public void reserve(Long hotelId, String roomType, DateRange range, int quantity) {
        for (LocalDate date : range.days()) {
            int updatedRows = repository.reserveAtomically(hotelId, roomType, date, quantity);
            if (updatedRows == 0) {
                throw new InsufficientAvailabilityException(hotelId, roomType, date, quantity);
            }
        }
        log.debug("Reserved {} x {} for hotel {} over {} (atomic)", quantity, roomType, hotelId, range);
    }

    @Override
    public void release(Long hotelId, String roomType, DateRange range, int quantity) {
        for (LocalDate date : range.days()) {
            int updatedRows = repository.releaseAtomically(hotelId, roomType, date, quantity);
            if (updatedRows == 0) {
                throw new InventoryUnderflowException(hotelId, roomType, date, quantity);
            }
        }
        log.debug("Released {} x {} for hotel {} over {} (atomic)", quantity, roomType, hotelId, range);
    }

    @Override
    public String getStrategyType() {
        return "ATOMIC_UPDATE";
    }
}
