package com.openstay.booking;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openstay.booking.api.dto.BookingResponse;
import com.openstay.booking.api.dto.CancelBookingRequest;
import com.openstay.booking.api.dto.CheckInRequest;
import com.openstay.booking.api.dto.CreateBookingRequest;
import com.openstay.booking.api.dto.ModifyBookingRequest;
import com.openstay.booking.api.dto.ValidateBookingRequest;
import com.openstay.booking.config.BookingRulesProperties;
import com.openstay.booking.config.CancellationPolicyProperties;
import com.openstay.booking.config.CheckInTokenProperties;
import com.openstay.booking.domain.model.Actor;
import com.openstay.booking.domain.model.ActorRole;
import com.openstay.booking.domain.model.BookingStatus;
import com.openstay.booking.domain.model.CheckInMethod;
import com.openstay.booking.domain.model.PricingSource;
import com.openstay.booking.domain.model.RoomAssignment;
import com.openstay.booking.domain.model.ValidationDecision;
import com.openstay.booking.domain.service.BookingPricer;
import com.openstay.booking.domain.service.BookingStateMachine;
import com.openstay.booking.domain.service.BookingTransactions;
import com.openstay.booking.domain.service.CancellationPolicyEngine;
import com.openstay.booking.domain.service.StayCalendar;
import com.openstay.booking.port.BookingEventType;
import com.openstay.booking.port.CacheInvalidationPort;
import com.openstay.booking.port.NotificationPort;
import com.openstay.booking.port.PriceQuote;
import com.openstay.booking.port.PricingOracle;
import com.openstay.booking.support.MutableClock;
import com.openstay.booking.token.CheckInTokenService;
import com.openstay.booking.token.IssueContext;
import com.openstay.booking.token.TokenContext;
import com.openstay.booking.token.TokenIssueRateLimiter;
import com.openstay.booking.token.TokenSigner;
import com.openstay.booking.token.TokenStatus;
import com.openstay.common.exception.BusinessException;
import com.openstay.common.exception.ErrorCodes;
import com.openstay.common.exception.InsufficientAvailabilityException;
import com.openstay.common.exception.InvalidTransitionException;
import com.openstay.common.exception.RoomOccupiedException;
import com.openstay.common.exception.TokenContextMismatchException;
import com.openstay.common.util.DateRange;
import com.openstay.inventory.cache.NoOpAvailabilityCache;
import com.openstay.inventory.domain.service.InventoryLedger;
import com.openstay.inventory.domain.strategy.PessimisticLockLedgerStrategy;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * End-to-end lifecycle against a real database: every transition commits, so each test
 * works on its own hotel.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        BookingStateMachine.class,
        CheckInTokenService.class,
        TokenIssueRateLimiter.class,
        TokenSigner.class,
        CancellationPolicyEngine.class,
        BookingPricer.class,
        BookingTransactions.class,
        StayCalendar.class,
        InventoryLedger.class,
        PessimisticLockLedgerStrategy.class,
        NoOpAvailabilityCache.class,
        BookingLifecycleIntegrationTest.TestConfig.class
})
class BookingLifecycleIntegrationTest {

    private static final Instant START = Instant.parse("2026-06-01T09:00:00Z");
    private static final LocalDate CHECK_IN = LocalDate.of(2026, 6, 3);
    private static final LocalDate CHECK_OUT = LocalDate.of(2026, 6, 5);
    private static final Actor STAFF = Actor.of(900L, ActorRole.STAFF);
    private static final AtomicLong HOTEL_IDS = new AtomicLong(1000);

    @TestConfiguration
    @EnableConfigurationProperties({
            BookingRulesProperties.class,
            CancellationPolicyProperties.class,
            CheckInTokenProperties.class})
    static class TestConfig {

        @Bean
        MutableClock clock() {
            return new MutableClock(START, ZoneOffset.UTC);
        }

        @Bean
        ObjectMapper objectMapper() {
            return new ObjectMapper();
        }

        @Bean
        RateLimiterRegistry rateLimiterRegistry() {
            return RateLimiterRegistry.of(Map.of("checkin-token-issue", RateLimiterConfig.custom()
                    .limitForPeriod(5)
                    .limitRefreshPeriod(Duration.ofMinutes(1))
                    .timeoutDuration(Duration.ZERO)
                    .build()));
        }
    }

    @Autowired
    private BookingStateMachine stateMachine;

    @Autowired
    private CheckInTokenService tokenService;

    @Autowired
    private InventoryLedger inventoryLedger;

    @Autowired
    private CheckInTokenProperties tokenProperties;

    @Autowired
    private MutableClock clock;

    @MockBean
    private PricingOracle pricingOracle;

    @MockBean
    private CacheInvalidationPort cacheInvalidation;

    @MockBean
    private NotificationPort notifications;

    private Long hotelId;

    @BeforeEach
    void setUp() {
        clock.setInstant(START);
        hotelId = HOTEL_IDS.incrementAndGet();
        when(pricingOracle.priceFor(anyLong(), anyString(), any()))
                .thenReturn(new PriceQuote(new BigDecimal("150.00"), PricingSource.ORACLE));
    }

    @AfterEach
    void resetTokenPolicy() {
        tokenProperties.setMaxUsage(5);
    }

    @Test
    @DisplayName("create, approve, token check-in and check-out walk the whole lifecycle")
    void fullLifecycle() {
        // given
        provision(2);
        BookingResponse created = stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L));
        assertThat(created.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(created.totalPrice()).isEqualByComparingTo("300.00");
        assertThat(reserved(CHECK_IN)).isEqualTo(1);

        // when
        BookingResponse confirmed = approve(created.id());
        clock.setInstant(Instant.parse("2026-06-03T16:00:00Z"));
        BookingResponse checkedIn = stateMachine.checkIn(created.id(),
                new CheckInRequest(List.of(new RoomAssignment("DELUXE", "301")), confirmed.checkInToken().token()),
                STAFF, "10.0.0.1", "front-desk-1");
        clock.setInstant(Instant.parse("2026-06-04T10:00:00Z"));
        BookingResponse completed = stateMachine.checkOut(created.id(), STAFF);

        // then
        assertThat(checkedIn.checkInMethod()).isEqualTo(CheckInMethod.TOKEN);
        assertThat(checkedIn.rooms()).extracting(BookingResponse.Room::assignedRoomId).containsExactly("301");
        assertThat(completed.status()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(completed.statusHistory()).extracting(BookingResponse.StatusEntry::newStatus)
                .containsExactly(BookingStatus.PENDING, BookingStatus.CONFIRMED,
                        BookingStatus.CHECKED_IN, BookingStatus.COMPLETED);
        assertThat(reserved(CHECK_IN)).isEqualTo(1);
        assertThat(reserved(CHECK_IN.plusDays(1))).isZero();
        assertThat(tokenService.tokensForBooking(created.id(), STAFF))
                .singleElement()
                .satisfies(token -> assertThat(token.getCurrentUsage()).isEqualTo(1));
        verify(notifications).notify(eq(BookingEventType.BOOKING_COMPLETED), any());
    }

    @Test
    @DisplayName("a modification that cannot fit leaves the booking and inventory untouched")
    void modify_rollsBackOnOverlap() {
        // given
        provision(1);
        BookingResponse first = stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L));
        stateMachine.create(request(43L, CHECK_IN.plusDays(3), CHECK_IN.plusDays(5)), customer(43L));

        // when
        assertThatThrownBy(() -> stateMachine.modify(first.id(),
                new ModifyBookingRequest(CHECK_IN.plusDays(2), CHECK_IN.plusDays(4), null, false), customer(42L)))
                .isInstanceOf(InsufficientAvailabilityException.class);

        // then
        BookingResponse unchanged = stateMachine.get(first.id(), customer(42L));
        assertThat(unchanged.checkInDate()).isEqualTo(CHECK_IN);
        assertThat(unchanged.checkOutDate()).isEqualTo(CHECK_OUT);
        assertThat(reserved(CHECK_IN)).isEqualTo(1);
        assertThat(reserved(CHECK_IN.plusDays(1))).isEqualTo(1);
        assertThat(reserved(CHECK_IN.plusDays(2))).isZero();
        assertThat(reserved(CHECK_IN.plusDays(3))).isEqualTo(1);
    }

    @Test
    @DisplayName("a successful modification moves the reservation to the new nights")
    void modify_movesReservation() {
        provision(1);
        BookingResponse booking = stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L));

        BookingResponse moved = stateMachine.modify(booking.id(),
                new ModifyBookingRequest(CHECK_IN.plusDays(5), CHECK_IN.plusDays(8), null, false), customer(42L));

        assertThat(moved.checkInDate()).isEqualTo(CHECK_IN.plusDays(5));
        assertThat(moved.totalPrice()).isEqualByComparingTo("450.00");
        assertThat(reserved(CHECK_IN)).isZero();
        assertThat(reserved(CHECK_IN.plusDays(1))).isZero();
        assertThat(reserved(CHECK_IN.plusDays(5))).isEqualTo(1);
        assertThat(reserved(CHECK_IN.plusDays(7))).isEqualTo(1);
    }

    @Test
    @DisplayName("two guests racing for the last room: exactly one gets it")
    void lastRoomRace() throws Exception {
        // given
        provision(1);
        CountDownLatch startGate = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        List<Future<BookingResponse>> attempts = new ArrayList<>();
        for (long customerId : new long[]{42L, 43L}) {
            Callable<BookingResponse> attempt = () -> {
                startGate.await();
                return stateMachine.create(request(customerId, CHECK_IN, CHECK_OUT), customer(customerId));
            };
            attempts.add(executor.submit(attempt));
        }

        // when
        startGate.countDown();
        int succeeded = 0;
        List<Throwable> failures = new ArrayList<>();
        for (Future<BookingResponse> attempt : attempts) {
            try {
                attempt.get(30, TimeUnit.SECONDS);
                succeeded++;
            } catch (ExecutionException e) {
                failures.add(e.getCause());
            }
        }
        executor.shutdown();

        // then
        assertThat(succeeded).isEqualTo(1);
        assertThat(failures).singleElement().isInstanceOf(BusinessException.class);
        assertThat(reserved(CHECK_IN)).isEqualTo(1);
        assertThat(reserved(CHECK_IN.plusDays(1))).isEqualTo(1);
    }

    @Test
    @DisplayName("a physical room goes to one in-house stay at a time")
    void roomHandedOutOnce() {
        // given
        provision(2);
        BookingResponse first = approve(stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L)).id());
        BookingResponse second = approve(stateMachine.create(request(43L, CHECK_IN, CHECK_OUT), customer(43L)).id());
        clock.setInstant(Instant.parse("2026-06-03T16:00:00Z"));
        stateMachine.checkIn(first.id(), new CheckInRequest(List.of(new RoomAssignment("DELUXE", "301")), null),
                STAFF, null, null);

        // when / then
        assertThatThrownBy(() -> stateMachine.checkIn(second.id(),
                new CheckInRequest(List.of(new RoomAssignment("DELUXE", "301")), null), STAFF, null, null))
                .isInstanceOf(RoomOccupiedException.class)
                .satisfies(e -> assertThat(((RoomOccupiedException) e).getOccupiedByBookingId()).isEqualTo(first.id()));
        BookingResponse untouched = stateMachine.get(second.id(), STAFF);
        assertThat(untouched.status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(untouched.rooms()).extracting(BookingResponse.Room::assignedRoomId).containsOnlyNulls();

        // the room frees up once the first guest leaves
        clock.setInstant(Instant.parse("2026-06-04T10:00:00Z"));
        stateMachine.checkOut(first.id(), STAFF);
        BookingResponse checkedIn = stateMachine.checkIn(second.id(),
                new CheckInRequest(List.of(new RoomAssignment("DELUXE", "301")), null), STAFF, null, null);
        assertThat(checkedIn.rooms()).extracting(BookingResponse.Room::assignedRoomId).containsExactly("301");
    }

    @Test
    @DisplayName("one booking's token cannot check in another booking")
    void tokenOfOtherBooking_rejected() {
        // given
        provision(2);
        BookingResponse bookingA = approve(stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L)).id());
        BookingResponse bookingB = approve(stateMachine.create(request(43L, CHECK_IN, CHECK_OUT), customer(43L)).id());
        clock.setInstant(Instant.parse("2026-06-03T16:00:00Z"));

        // when / then
        assertThatThrownBy(() -> stateMachine.checkIn(bookingB.id(),
                new CheckInRequest(List.of(), bookingA.checkInToken().token()), STAFF, null, null))
                .isInstanceOf(TokenContextMismatchException.class);
        assertThat(stateMachine.get(bookingB.id(), STAFF).status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(tokenService.validate(bookingA.checkInToken().token(),
                new TokenContext(hotelId, bookingA.id())).remainingUses()).isEqualTo(5);
    }

    @Test
    @DisplayName("a single-use token is spent by the check-in")
    void singleUseToken_spent() {
        // given
        tokenProperties.setMaxUsage(1);
        provision(1);
        BookingResponse booking = approve(stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L)).id());
        String token = booking.checkInToken().token();
        clock.setInstant(Instant.parse("2026-06-03T16:00:00Z"));

        // when
        stateMachine.checkIn(booking.id(), new CheckInRequest(null, token), STAFF, null, null);

        // then
        TokenContext context = new TokenContext(hotelId, booking.id());
        assertThat(tokenService.validate(token, context).errorCode()).isEqualTo(ErrorCodes.TOKEN_USAGE_EXCEEDED);
        assertThat(tokenService.tokensForBooking(booking.id(), STAFF))
                .singleElement()
                .satisfies(t -> assertThat(t.getStatus()).isEqualTo(TokenStatus.USED));
        assertThat(tokenService.auditTrail(booking.checkInToken().tokenId(), STAFF).uses())
                .singleElement()
                .satisfies(use -> assertThat(use.usedBy()).isEqualTo(STAFF.actorId()));
        assertThat(tokenService.statistics(hotelId, STAFF).byStatus())
                .containsEntry(TokenStatus.USED, 1L)
                .containsEntry(TokenStatus.ACTIVE, 0L);
    }

    @Test
    @DisplayName("cancelling well ahead refunds in full and frees the rooms")
    void cancel_fullRefund() {
        provision(1);
        BookingResponse booking = approve(stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L)).id());

        BookingResponse cancelled = stateMachine.cancel(booking.id(), new CancelBookingRequest("plans changed", null),
                customer(42L));

        assertThat(cancelled.status()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(cancelled.cancellation().refundPercentage()).isEqualTo(100);
        assertThat(cancelled.cancellation().refundAmount()).isEqualByComparingTo(booking.totalPrice());
        assertThat(reserved(CHECK_IN)).isZero();
        assertThat(tokenService.validate(booking.checkInToken().token(),
                new TokenContext(hotelId, booking.id())).errorCode()).isEqualTo(ErrorCodes.TOKEN_REVOKED);
    }

    @Test
    @DisplayName("cancelling on the day refunds nothing")
    void cancel_lateNoRefund() {
        provision(1);
        BookingResponse booking = approve(stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L)).id());
        clock.setInstant(Instant.parse("2026-06-03T09:00:00Z"));

        BookingResponse cancelled = stateMachine.cancel(booking.id(), new CancelBookingRequest(null, null),
                customer(42L));

        assertThat(cancelled.cancellation().refundPercentage()).isZero();
        assertThat(cancelled.cancellation().cancellationFee()).isEqualByComparingTo(booking.totalPrice());
        assertThat(reserved(CHECK_IN)).isZero();
    }

    @Test
    @DisplayName("a guest who never arrives is marked no-show and the remaining nights are freed")
    void noShow() {
        provision(1);
        BookingResponse booking = approve(stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L)).id());
        clock.setInstant(Instant.parse("2026-06-04T10:00:00Z"));

        BookingResponse noShow = stateMachine.markNoShow(booking.id(), Actor.system(), null);

        assertThat(noShow.status()).isEqualTo(BookingStatus.NO_SHOW);
        assertThat(reserved(CHECK_IN)).isEqualTo(1);
        assertThat(reserved(CHECK_IN.plusDays(1))).isZero();
    }

    @Test
    @DisplayName("an illegal transition changes nothing")
    void invalidTransition_noChange() {
        provision(1);
        BookingResponse booking = stateMachine.create(request(42L, CHECK_IN, CHECK_OUT), customer(42L));

        assertThatThrownBy(() -> stateMachine.checkOut(booking.id(), STAFF))
                .isInstanceOf(InvalidTransitionException.class);

        BookingResponse reloaded = stateMachine.get(booking.id(), STAFF);
        assertThat(reloaded.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(reloaded.statusHistory()).hasSize(1);
        assertThat(reserved(CHECK_IN)).isEqualTo(1);
    }

    private BookingResponse approve(Long bookingId) {
        return stateMachine.validate(bookingId, new ValidateBookingRequest(ValidationDecision.APPROVE, null),
                STAFF, IssueContext.none());
    }

    private void provision(int totalRooms) {
        inventoryLedger.provision(hotelId, "DELUXE",
                DateRange.of(LocalDate.of(2026, 6, 1), LocalDate.of(2026, 6, 20)), totalRooms);
    }

    private int reserved(LocalDate night) {
        return inventoryLedger.queryAuthoritative(hotelId, Set.of("DELUXE"), DateRange.of(night, night.plusDays(1)))
                .cells().get(0).reservedCount();
    }

    private CreateBookingRequest request(Long customerId, LocalDate checkIn, LocalDate checkOut) {
        return new CreateBookingRequest(hotelId, customerId, checkIn, checkOut, Map.of("DELUXE", 1));
    }

    private static Actor customer(Long customerId) {
        return Actor.of(customerId, ActorRole.CUSTOMER);
    }
}
