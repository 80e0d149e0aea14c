package com.openstay.booking.domain.repository;

import com.openstay.booking.domain.model.Booking;
import com.openstay.booking.domain.model.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    /**
     * Row lock taken by every state transition, so two transitions of the same booking
     * never interleave.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    List<Booking> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    @Query("SELECT b.id FROM Booking b WHERE b.status = :status AND b.checkInDate < :date ORDER BY b.id")
    List<Long> findIdsByStatusAndCheckInDateBefore(@Param("status") BookingStatus status,
                                                   @Param("date") LocalDate date);
}
