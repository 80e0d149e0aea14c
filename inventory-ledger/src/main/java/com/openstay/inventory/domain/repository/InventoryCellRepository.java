package com.openstay.inventory.domain.repository;

import com.openstay.inventory.domain.model.InventoryCell;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for {@link InventoryCell}. Ranges are half-open: {@code from <= stayDate < to}.
 */
public interface InventoryCellRepository extends JpaRepository<InventoryCell, Long> {

    /**
     * Locks the cells of one room type for a stay (SELECT FOR UPDATE), ordered by date
     * so concurrent callers acquire row locks in the same order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
           SELECT c FROM InventoryCell c
           WHERE c.hotelId = :hotelId
             AND c.roomType = :roomType
             AND c.stayDate >= :from
             AND c.stayDate < :to
           ORDER BY c.stayDate
           """)
    List<InventoryCell> findForUpdate(@Param("hotelId") Long hotelId,
                                      @Param("roomType") String roomType,
                                      @Param("from") LocalDate from,
                                      @Param("to") LocalDate to);

    @Query("""
           SELECT c FROM InventoryCell c
           WHERE c.hotelId = :hotelId
             AND c.roomType = :roomType
             AND c.stayDate >= :from
             AND c.stayDate < :to
           ORDER BY c.stayDate
           """)
    List<InventoryCell> findRange(@Param("hotelId") Long hotelId,
                                  @Param("roomType") String roomType,
                                  @Param("from") LocalDate from,
                                  @Param("to") LocalDate to);

    @Query("""
           SELECT c FROM InventoryCell c
           WHERE c.hotelId = :hotelId
             AND c.stayDate >= :from
             AND c.stayDate < :to
           ORDER BY c.stayDate, c.roomType
           """)
    List<InventoryCell> findHotelRange(@Param("hotelId") Long hotelId,
                                       @Param("from") LocalDate from,
                                       @Param("to") LocalDate to);

    @Query("""
           SELECT c FROM InventoryCell c
           WHERE c.hotelId = :hotelId
             AND c.stayDate IN :dates
           ORDER BY c.stayDate, c.roomType
           """)
    List<InventoryCell> findHotelDates(@Param("hotelId") Long hotelId,
                                       @Param("dates") Collection<LocalDate> dates);

    Optional<InventoryCell> findByHotelIdAndRoomTypeAndStayDate(Long hotelId, String roomType, LocalDate stayDate);

    /**
     * Guarded increment: succeeds only while the night still has {@code quantity} free rooms.
     * Returns 1 on success, 0 when there is no cell or not enough capacity.
     * Managed entities are left attached; callers that need fresh counts must re-read.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           UPDATE InventoryCell c
           SET c.reservedCount = c.reservedCount + :quantity,
               c.version = c.version + 1
           WHERE c.hotelId = :hotelId
             AND c.roomType = :roomType
             AND c.stayDate = :date
             AND c.reservedCount + :quantity <= c.totalRooms
           """)
    int reserveAtomically(@Param("hotelId") Long hotelId,
                          @Param("roomType") String roomType,
                          @Param("date") LocalDate date,
                          @Param("quantity") int quantity);

    /**
     * Guarded decrement: never drives {@code reservedCount} below zero.
     * Returns 0 when the night holds fewer than {@code quantity} reserved rooms.
     */
    @Modifying(flushAutomatically = true)
    @Query("""
           UPDATE InventoryCell c
           SET c.reservedCount = c.reservedCount - :quantity,
               c.version = c.version + 1
           WHERE c.hotelId = :hotelId
             AND c.roomType = :roomType
             AND c.stayDate = :date
             AND c.reservedCount >= :quantity
           """)
    int releaseAtomically(@Param("hotelId") Long hotelId,
                          @Param("roomType") String roomType,
                          @Param("date") LocalDate date,
                          @Param("quantity") int quantity);
}
