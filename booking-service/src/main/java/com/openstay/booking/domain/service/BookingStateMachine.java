package com.openstay.booking.domain.service;

import com.openstay.booking.api.dto.BookingResponse;
import com.openstay.booking.api.dto.CancelBookingRequest;
import com.openstay.booking.api.dto.CheckInRequest;
import com.openstay.booking.api.dto.CreateBookingRequest;
import com.openstay.booking.api.dto.ModifyBookingRequest;
import com.openstay.booking.api.dto.ValidateBookingRequest;
import com.openstay.booking.config.BookingRulesProperties;
import com.openstay.booking.domain.model.Actor;
import com.openstay.booking.domain.model.Booking;
import com.openstay.booking.domain.model.BookingStatus;
import com.openstay.booking.domain.model.CancellationRecord;
import com.openstay.booking.domain.model.CheckInMethod;
import com.openstay.booking.domain.model.RoomOccupancy;
import com.openstay.booking.domain.model.ValidationDecision;
import com.openstay.booking.domain.repository.BookingRepository;
import com.openstay.booking.domain.repository.RoomOccupancyRepository;
import com.openstay.booking.port.BookingEventType;
import com.openstay.booking.port.BookingNotification;
import com.openstay.booking.port.CacheInvalidationPort;
import com.openstay.booking.port.NotificationPort;
import com.openstay.booking.token.CheckInTokenService;
import com.openstay.booking.token.IssueContext;
import com.openstay.booking.token.IssuedToken;
import com.openstay.booking.token.TokenContext;
import com.openstay.common.exception.ActionNotPermittedException;
import com.openstay.common.exception.InvalidTransitionException;
import com.openstay.common.exception.ResourceNotFoundException;
import com.openstay.common.exception.RoomOccupiedException;
import com.openstay.common.exception.TransactionConflictException;
import com.openstay.common.exception.ValidationException;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.domain.service.InventoryLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Drives bookings through their lifecycle.
 *
 * Each transition locks the booking row and runs its ledger, booking and token writes in one
 * {@link BookingTransactions} transaction: it either commits completely or leaves nothing
 * behind. Pricing happens before the transaction opens. Cache invalidation and notifications
 * run only after commit and their failures are logged, never propagated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingStateMachine {

    private final BookingRepository bookingRepository;
    private final RoomOccupancyRepository occupancyRepository;
    private final InventoryLedger inventoryLedger;
    private final CheckInTokenService tokenService;
    private final CancellationPolicyEngine cancellationPolicy;
    private final BookingPricer pricer;
    private final BookingTransactions transactions;
    private final StayCalendar calendar;
    private final BookingRulesProperties rules;
    private final CacheInvalidationPort cacheInvalidation;
    private final NotificationPort notifications;

    public BookingResponse create(CreateBookingRequest request, Actor actor) {
        if (!actor.isStaff() && !actor.actorId().equals(request.customerId())) {
            throw new ActionNotPermittedException("create bookings for another customer", actor.role());
        }
        DateRange stay = validateStay(request.checkInDate(), request.checkOutDate());
        SortedMap<String, Integer> rooms = validateRooms(request.rooms());
        log.info("Creating booking for customer {} at hotel {}: {} over {}",
                request.customerId(), request.hotelId(), rooms, stay);

        PricedStay priced = pricer.price(request.hotelId(), rooms, stay);

        Outcome outcome = transactions.execute("Create booking", () -> {
            inventoryLedger.reserveAll(request.hotelId(), rooms, stay);
            Booking booking = Booking.create(request.hotelId(), request.customerId(), stay,
                    priced.rooms(), priced.pricing(), actor, calendar.now());
            booking = bookingRepository.save(booking);
            return outcome(booking, BookingEventType.BOOKING_CREATED, null, stay);
        });
        return publish(outcome);
    }

    /**
     * Staff decision on a PENDING booking. Approval re-checks that the ledger still holds the
     * rooms and issues a check-in token; rejection releases them.
     */
    public BookingResponse validate(Long bookingId, ValidateBookingRequest request, Actor actor,
                                    IssueContext issueContext) {
        requireStaff(actor, "validate bookings");
        Outcome outcome = transactions.execute("Validate booking", () -> {
            Booking booking = lock(bookingId);
            if (request.decision() == ValidationDecision.APPROVE) {
                booking.assertCanTransitionTo(BookingStatus.CONFIRMED);
                inventoryLedger.assertHeld(booking.getHotelId(), booking.roomQuantities(), booking.stayRange());
                booking.transitionTo(BookingStatus.CONFIRMED, reasonOr(request.reason(), "Approved"),
                        actor.actorId(), calendar.now());
                IssuedToken token = tokenService.issue(booking, issueContext);
                return outcome(booking, BookingEventType.BOOKING_CONFIRMED, token);
            }
            booking.assertCanTransitionTo(BookingStatus.REJECTED);
            inventoryLedger.releaseAll(booking.getHotelId(), booking.roomQuantities(), booking.stayRange());
            booking.transitionTo(BookingStatus.REJECTED, reasonOr(request.reason(), "Rejected"),
                    actor.actorId(), calendar.now());
            return outcome(booking, BookingEventType.BOOKING_REJECTED, null, booking.stayRange());
        });
        return publish(outcome);
    }

    /**
     * Checks the guest in. With a token the token is validated against this booking and one
     * use is consumed in the same transaction; without one the check-in is recorded as manual.
     */
    public BookingResponse checkIn(Long bookingId, CheckInRequest request, Actor actor, String ipAddress,
                                   String deviceFingerprint) {
        requireStaff(actor, "check guests in");
        Outcome outcome = transactions.execute("Check in", () -> {
            Booking booking = lock(bookingId);
            booking.assertCanTransitionTo(BookingStatus.CHECKED_IN);
            if (!calendar.today().isBefore(booking.getCheckOutDate())) {
                throw new InvalidTransitionException("Booking " + bookingId
                        + " cannot be checked in on or after its check-out date " + booking.getCheckOutDate());
            }
            booking.assignRooms(request.assignments());
            CheckInMethod method = CheckInMethod.MANUAL;
            if (request.token() != null && !request.token().isBlank()) {
                tokenService.use(request.token(), new TokenContext(booking.getHotelId(), booking.getId()),
                        actor, ipAddress, deviceFingerprint);
                method = CheckInMethod.TOKEN;
            }
            Instant now = calendar.now();
            occupyRooms(booking, now);
            booking.recordCheckIn(method, actor.actorId(), now);
            booking.transitionTo(BookingStatus.CHECKED_IN, "Checked in (" + method + ")", actor.actorId(), now);
            return outcome(booking, BookingEventType.BOOKING_CHECKED_IN, null);
        });
        return publish(outcome);
    }

    /**
     * Completes the stay. Nights from today on are released; nights already past stay
     * counted as sold.
     */
    public BookingResponse checkOut(Long bookingId, Actor actor) {
        requireStaff(actor, "check guests out");
        Outcome outcome = transactions.execute("Check out", () -> {
            Booking booking = lock(bookingId);
            booking.assertCanTransitionTo(BookingStatus.COMPLETED);
            DateRange unused = booking.stayRange().remainingFrom(calendar.today());
            inventoryLedger.releaseAll(booking.getHotelId(), booking.roomQuantities(), unused);
            int vacated = occupancyRepository.deleteByBookingId(booking.getId());
            Instant now = calendar.now();
            booking.recordCheckOut(now);
            log.debug("Booking {} vacated {} room(s)", bookingId, vacated);
            booking.transitionTo(BookingStatus.COMPLETED, "Checked out", actor.actorId(), now);
            return outcome(booking, BookingEventType.BOOKING_COMPLETED, null, unused);
        });
        return publish(outcome);
    }

    public BookingResponse cancel(Long bookingId, CancelBookingRequest request, Actor actor) {
        Outcome outcome = transactions.execute("Cancel booking", () -> {
            Booking booking = lock(bookingId);
            requireOwnerOrStaff(booking, actor, "cancel this booking");
            booking.assertCanTransitionTo(BookingStatus.CANCELLED);
            Instant now = calendar.now();
            RefundDecision refund = cancellationPolicy.decide(booking,
                    calendar.checkInInstant(booking.getCheckInDate()), now, actor, request.refundOverride());

            inventoryLedger.releaseAll(booking.getHotelId(), booking.roomQuantities(), booking.stayRange());
            tokenService.revokeActive(booking.getId(), actor, "Booking cancelled");
            String reason = reasonOr(request.reason(), "Cancelled");
            booking.recordCancellation(CancellationRecord.builder()
                    .cancelledAt(now)
                    .cancelledBy(actor.actorId())
                    .refundPercentage(refund.refundPercentage())
                    .refundAmount(refund.refundAmount())
                    .cancellationFee(refund.cancellationFee())
                    .reason(reason)
                    .overridden(refund.overridden())
                    .build());
            booking.transitionTo(BookingStatus.CANCELLED, reason, actor.actorId(), now);
            log.info("Booking {} cancelled {} h before check-in, refund {}% ({})", bookingId,
                    String.format("%.1f", refund.hoursUntilCheckIn()), refund.refundPercentage(), refund.refundAmount());
            return outcome(booking, BookingEventType.BOOKING_CANCELLED, null, booking.stayRange());
        });
        return publish(outcome);
    }

    /**
     * Moves a booking to new dates (and, while PENDING, new rooms). The old reservation is
     * released and the new one taken in the same transaction, so on failure the booking keeps
     * its original rooms and dates. A CONFIRMED booking whose dates move gets a new token.
     */
    public BookingResponse modify(Long bookingId, ModifyBookingRequest request, Actor actor) {
        DateRange newStay = validateStay(request.checkInDate(), request.checkOutDate());
        BookingSnapshot current = transactions.execute("Load booking", () -> {
            Booking booking = bookingRepository.findById(bookingId)
                    .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
            return new BookingSnapshot(booking.getHotelId(), booking.roomQuantities(), booking.getVersion());
        });
        SortedMap<String, Integer> newRooms = request.rooms() == null
                ? current.rooms()
                : validateRooms(request.rooms());
        PricedStay priced = pricer.price(current.hotelId(), newRooms, newStay);

        Outcome outcome = transactions.execute("Modify booking", () -> {
            Booking booking = lock(bookingId);
            requireModifiable(booking, request, actor);
            if (!booking.getVersion().equals(current.version())) {
                throw new TransactionConflictException("Booking " + bookingId + " changed while it was being repriced", null);
            }
            DateRange oldStay = booking.stayRange();
            SortedMap<String, Integer> oldRooms = booking.roomQuantities();
            inventoryLedger.releaseAll(booking.getHotelId(), oldRooms, oldStay);
            inventoryLedger.reserveAll(booking.getHotelId(), newRooms, newStay);
            booking.reschedule(newStay, priced.rooms(), priced.pricing(), calendar.now());

            IssuedToken token = null;
            if (booking.getStatus() == BookingStatus.CONFIRMED && !oldStay.equals(newStay)) {
                token = tokenService.reissue(booking, actor, "Booking dates changed", IssueContext.none());
            }
            log.info("Booking {} moved from {} {} to {} {}", bookingId, oldStay, oldRooms, newStay, newRooms);
            return outcome(booking, BookingEventType.BOOKING_MODIFIED, token, oldStay, newStay);
        });
        return publish(outcome);
    }

    /**
     * Closes a CONFIRMED booking whose guest never arrived. Only allowed once the check-in
     * day is over; nights from today on are released.
     */
    public BookingResponse markNoShow(Long bookingId, Actor actor, String reason) {
        if (!actor.isStaff() && !actor.isSystem()) {
            throw new ActionNotPermittedException("mark bookings as no-show", actor.role());
        }
        Outcome outcome = transactions.execute("Mark no-show", () -> {
            Booking booking = lock(bookingId);
            booking.assertCanTransitionTo(BookingStatus.NO_SHOW);
            LocalDate today = calendar.today();
            if (!today.isAfter(booking.getCheckInDate())) {
                throw new InvalidTransitionException("Booking " + bookingId
                        + " cannot be marked no-show before its check-in day " + booking.getCheckInDate() + " is over");
            }
            DateRange unused = booking.stayRange().remainingFrom(today);
            inventoryLedger.releaseAll(booking.getHotelId(), booking.roomQuantities(), unused);
            tokenService.revokeActive(booking.getId(), actor, "No-show");
            booking.transitionTo(BookingStatus.NO_SHOW, reasonOr(reason, "Guest did not arrive"),
                    actor.actorId(), calendar.now());
            return outcome(booking, BookingEventType.BOOKING_NO_SHOW, null, unused);
        });
        return publish(outcome);
    }

    @Transactional(readOnly = true)
    public BookingResponse get(Long bookingId, Actor actor) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        requireOwnerOrStaff(booking, actor, "view this booking");
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public List<BookingResponse> listForCustomer(Long customerId, Actor actor) {
        if (!actor.isStaff() && !actor.actorId().equals(customerId)) {
            throw new ActionNotPermittedException("list another customer's bookings", actor.role());
        }
        return bookingRepository.findByCustomerIdOrderByCreatedAtDesc(customerId).stream()
                .map(BookingResponse::from)
                .toList();
    }

    private void requireModifiable(Booking booking, ModifyBookingRequest request, Actor actor) {
        switch (booking.getStatus()) {
            case PENDING -> requireOwnerOrStaff(booking, actor, "modify this booking");
            case CONFIRMED -> {
                if (!actor.isStaff()) {
                    throw new ActionNotPermittedException("modify a confirmed booking", actor.role());
                }
                if (!request.revalidate()) {
                    throw new InvalidTransitionException("Booking " + booking.getId()
                            + " is CONFIRMED; modifying it requires revalidation");
                }
                if (request.rooms() != null && !new TreeMap<>(request.rooms()).equals(booking.roomQuantities())) {
                    throw new ValidationException("rooms", "Only the dates of a confirmed booking can change");
                }
            }
            default -> throw new InvalidTransitionException("Booking " + booking.getId()
                    + " cannot be modified in status " + booking.getStatus());
        }
    }

    private DateRange validateStay(LocalDate checkIn, LocalDate checkOut) {
        DateRange stay = DateRange.stay(checkIn, checkOut);
        if (checkIn.isBefore(calendar.today())) {
            throw new ValidationException("checkInDate", "Check-in date cannot be in the past");
        }
        if (stay.nights() < rules.getMinNights() || stay.nights() > rules.getMaxNights()) {
            throw new ValidationException("checkOutDate", String.format("A stay must be between %d and %d nights",
                    rules.getMinNights(), rules.getMaxNights()));
        }
        return stay;
    }

    private SortedMap<String, Integer> validateRooms(Map<String, Integer> rooms) {
        if (rooms == null || rooms.isEmpty()) {
            throw new ValidationException("rooms", "At least one room type is required");
        }
        SortedMap<String, Integer> ordered = new TreeMap<>();
        int total = 0;
        for (Map.Entry<String, Integer> entry : rooms.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ValidationException("rooms", "Room type cannot be blank");
            }
            if (entry.getValue() == null || entry.getValue() < 1) {
                throw new ValidationException("rooms", "Quantity for room type " + entry.getKey() + " must be at least 1");
            }
            ordered.put(entry.getKey(), entry.getValue());
            total += entry.getValue();
        }
        if (total > rules.getMaxRoomsPerBooking()) {
            throw new ValidationException("rooms", String.format("A booking can hold at most %d rooms",
                    rules.getMaxRoomsPerBooking()));
        }
        return ordered;
    }

    private Booking lock(Long bookingId) {
        return bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    /**
     * Marks the assigned rooms occupied. A room still held by another in-house booking fails
     * the check-in; two check-ins racing for the same free room collide on the unique key.
     */
    private void occupyRooms(Booking booking, Instant now) {
        List<String> roomIds = booking.assignedRoomIds();
        if (roomIds.isEmpty()) {
            return;
        }
        List<RoomOccupancy> held = occupancyRepository.findByHotelIdAndRoomIdsForUpdate(booking.getHotelId(), roomIds);
        if (!held.isEmpty()) {
            RoomOccupancy first = held.get(0);
            throw new RoomOccupiedException(first.getHotelId(), first.getRoomId(), first.getBookingId());
        }
        try {
            occupancyRepository.saveAllAndFlush(roomIds.stream()
                    .map(roomId -> RoomOccupancy.of(booking, roomId, now))
                    .toList());
        } catch (DataIntegrityViolationException e) {
            log.warn("Concurrent check-in took one of rooms {} at hotel {}", roomIds, booking.getHotelId());
            throw new RoomOccupiedException(booking.getHotelId(), String.join(",", roomIds), null);
        }
    }

    private static void requireStaff(Actor actor, String action) {
        if (!actor.isStaff()) {
            throw new ActionNotPermittedException(action, actor.role());
        }
    }

    private static void requireOwnerOrStaff(Booking booking, Actor actor, String action) {
        if (!actor.isStaff() && !booking.isOwnedBy(actor.actorId())) {
            throw new ActionNotPermittedException(action, actor.role());
        }
    }

    private static String reasonOr(String reason, String fallback) {
        return reason == null || reason.isBlank() ? fallback : reason;
    }

    private Outcome outcome(Booking booking, BookingEventType eventType, IssuedToken token, DateRange... touched) {
        BigDecimal refund = booking.getCancellation() == null ? null : booking.getCancellation().getRefundAmount();
        BookingNotification notification = new BookingNotification(booking.getId(), booking.getHotelId(),
                booking.getCustomerId(), booking.getStatus(), booking.getCheckInDate(), booking.getCheckOutDate(),
                booking.getTotalPrice(), refund, calendar.now());
        List<DateRange> ranges = new ArrayList<>();
        for (DateRange range : touched) {
            if (!range.isEmpty()) {
                ranges.add(range);
            }
        }
        return new Outcome(BookingResponse.from(booking, token), booking.getHotelId(), ranges, eventType, notification);
    }

    /**
     * Post-commit side effects. The transition already committed, so failures are logged only.
     */
    private BookingResponse publish(Outcome outcome) {
        for (DateRange range : outcome.touched()) {
            try {
                cacheInvalidation.invalidate(outcome.hotelId(), range);
            } catch (RuntimeException e) {
                log.warn("Cache invalidation failed for hotel {} over {}: {}", outcome.hotelId(), range, e.getMessage());
            }
        }
        try {
            notifications.notify(outcome.eventType(), outcome.notification());
        } catch (RuntimeException e) {
            log.warn("Notification {} failed for booking {}: {}", outcome.eventType(),
                    outcome.notification().bookingId(), e.getMessage());
        }
        return outcome.response();
    }

    /** State a modification was priced against. */
    private record BookingSnapshot(Long hotelId, SortedMap<String, Integer> rooms, Long version) {
    }

    private record Outcome(BookingResponse response, Long hotelId, List<DateRange> touched,
                           BookingEventType eventType, BookingNotification notification) {
    }
}
