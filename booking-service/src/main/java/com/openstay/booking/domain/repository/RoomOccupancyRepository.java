package com.openstay.booking.domain.repository;

import com.openstay.booking.domain.model.RoomOccupancy;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RoomOccupancyRepository extends JpaRepository<RoomOccupancy, Long> {

    /**
     * Occupancies of the given rooms, locked until the check-in transaction ends.
     * A concurrent insert of a missing row is caught by {@code uk_room_occupancy_room}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM RoomOccupancy o WHERE o.hotelId = :hotelId AND o.roomId IN :roomIds ORDER BY o.roomId")
    List<RoomOccupancy> findByHotelIdAndRoomIdsForUpdate(@Param("hotelId") Long hotelId,
                                                         @Param("roomIds") Collection<String> roomIds);

    List<RoomOccupancy> findByHotelIdOrderByRoomId(Long hotelId);

    @Modifying
    @Query("DELETE FROM RoomOccupancy o WHERE o.bookingId = :bookingId")
    int deleteByBookingId(@Param("bookingId") Long bookingId);
}
