package com.openstay.booking.token;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CheckInTokenRepository extends JpaRepository<CheckInToken, UUID> {

    Optional<CheckInToken> findByBookingIdAndStatus(Long bookingId, TokenStatus status);

    List<CheckInToken> findByBookingIdOrderByIssuedAtDesc(Long bookingId);

    List<CheckInToken> findByCustomerIdAndStatusOrderByNotBeforeAsc(Long customerId, TokenStatus status);

    List<CheckInToken> findByStatusAndExpiresAtBefore(TokenStatus status, Instant threshold);

    @Query("SELECT t.status AS status, COUNT(t) AS total FROM CheckInToken t WHERE t.hotelId = :hotelId GROUP BY t.status")
    List<StatusCount> countByStatusForHotel(@Param("hotelId") Long hotelId);

    interface StatusCount {
        TokenStatus getStatus();

        Long getTotal();
    }
}
