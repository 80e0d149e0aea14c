package com.openstay.booking.job;

import com.openstay.booking.domain.model.Actor;
import com.openstay.booking.domain.model.BookingStatus;
import com.openstay.booking.domain.repository.BookingRepository;
import com.openstay.booking.domain.service.BookingStateMachine;
import com.openstay.booking.domain.service.StayCalendar;
import com.openstay.common.exception.BusinessException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Marks CONFIRMED bookings whose check-in day has passed as NO_SHOW, one transition per
 * booking so a failure only skips that booking.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NoShowSweeper {

    private final BookingRepository bookingRepository;
    private final BookingStateMachine stateMachine;
    private final StayCalendar calendar;

    @Value("${booking.no-show.sweep-enabled:true}")
    private boolean sweepEnabled;

    @Scheduled(fixedDelayString = "${booking.no-show.sweep-interval-ms:3600000}")
    public void sweep() {
        if (!sweepEnabled) return;
        markOverdueBookings();
    }

    /**
     * @return number of bookings marked NO_SHOW
     */
    public int markOverdueBookings() {
        List<Long> overdue = bookingRepository.findIdsByStatusAndCheckInDateBefore(
                BookingStatus.CONFIRMED, calendar.today());
        if (overdue.isEmpty()) return 0;
        log.info("No-show sweep: found {} overdue booking(s)", overdue.size());
        int marked = 0;
        for (Long bookingId : overdue) {
            try {
                stateMachine.markNoShow(bookingId, Actor.system(), "Check-in day passed without arrival");
                marked++;
            } catch (BusinessException e) {
                log.warn("No-show sweep skipped booking {} [{}]: {}", bookingId, e.getErrorCode(), e.getMessage());
            } catch (Exception e) {
                log.error("No-show sweep failed for booking {}", bookingId, e);
            }
        }
        return marked;
    }
}
