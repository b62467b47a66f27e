package com.hkcraft.booking.integration;

import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.CraftEvent;
import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.domain.model.Registration.RegistrationStatus;
import com.hkcraft.booking.exception.InvalidRatingException;
import com.hkcraft.booking.exception.InvalidTransitionException;
import com.hkcraft.booking.infrastructure.cart.CartStore;
import com.hkcraft.booking.infrastructure.messaging.Notifier;
import com.hkcraft.booking.infrastructure.payment.PaymentGateway;
import com.hkcraft.booking.repository.CraftEventRepository;
import com.hkcraft.booking.repository.RegistrationRepository;
import com.hkcraft.booking.service.EventBookingService;
import com.hkcraft.booking.service.RegistrationCancellation;
import com.hkcraft.booking.service.RegistrationService;
import com.hkcraft.booking.service.WaitlistEntry;
import com.hkcraft.booking.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Registration, waitlist and feedback flows against H2.
 *
 * @author Craft Booking Team
 */
@SpringBootTest
@DisplayName("Event Registration Integration Tests")
class EventRegistrationIntegrationTest {

    @Autowired
    private EventBookingService bookingService;

    @Autowired
    private RegistrationService registrationService;

    @Autowired
    private CraftEventRepository eventRepository;

    @Autowired
    private RegistrationRepository registrationRepository;

    @MockBean
    private CartStore cartStore;

    @MockBean
    private Notifier notifier;

    @MockBean
    private PaymentGateway paymentGateway;

    @BeforeEach
    void setUp() {
        registrationRepository.deleteAll();
        eventRepository.deleteAll();
    }

    private long count(String eventId, RegistrationStatus status) {
        return registrationRepository.countByEventIdAndStatus(eventId, status);
    }

    // ========================================
    // Seat Allocation Tests
    // ========================================

    @Test
    @DisplayName("register - Seats fill in arrival order and the rest wait")
    void register_OverCapacity_WaitlistsExtra() {
        // Given
        CraftEvent event = eventRepository.save(TestDataBuilder.openEvent(2).build());

        // When
        List<Registration> registrations = new ArrayList<>();
        for (int i = 1; i <= 5; i++) {
            registrations.add(bookingService.register(event.getEventId(), "user-" + i, null, null));
        }

        // Then
        assertThat(registrations).extracting(Registration::getStatus).containsExactly(
                RegistrationStatus.CONFIRMED, RegistrationStatus.CONFIRMED,
                RegistrationStatus.WAITLISTED, RegistrationStatus.WAITLISTED, RegistrationStatus.WAITLISTED);

        List<WaitlistEntry> waitlist = registrationService.getWaitlist(event.getEventId());
        assertThat(waitlist).extracting(entry -> entry.getRegistration().getUserId())
                .containsExactly("user-3", "user-4", "user-5");
        assertThat(waitlist).extracting(WaitlistEntry::getPosition).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("register - Concurrent registrations never exceed the cap")
    void register_Concurrent_RespectsCap() throws Exception {
        // Given
        CraftEvent event = eventRepository.save(TestDataBuilder.openEvent(3).build());
        int threads = 10;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Registration>> results = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            String userId = "racer-" + i;
            results.add(pool.submit(() -> {
                start.await();
                return bookingService.register(event.getEventId(), userId, null, null);
            }));
        }
        start.countDown();
        for (Future<Registration> result : results) {
            result.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertThat(count(event.getEventId(), RegistrationStatus.CONFIRMED)).isEqualTo(3);
        assertThat(count(event.getEventId(), RegistrationStatus.WAITLISTED)).isEqualTo(7);
    }

    // ========================================
    // Cancellation Tests
    // ========================================

    @Test
    @DisplayName("cancel - Confirmed cancellation promotes the oldest waitlisted user")
    void cancel_Confirmed_PromotesOldest() {
        // Given
        CraftEvent event = eventRepository.save(TestDataBuilder.openEvent(1).build());
        bookingService.register(event.getEventId(), "user-1", null, null);
        bookingService.register(event.getEventId(), "user-2", null, null);
        bookingService.register(event.getEventId(), "user-3", null, null);

        // When
        RegistrationCancellation outcome = bookingService.cancel(event.getEventId(), "user-1", Actor.user("user-1"));

        // Then
        assertThat(outcome.getPreviousStatus()).isEqualTo(RegistrationStatus.CONFIRMED);
        assertThat(outcome.getPromoted()).isPresent();
        assertThat(outcome.getPromoted().get().getUserId()).isEqualTo("user-2");
        assertThat(registrationRepository.findByEventIdAndUserId(event.getEventId(), "user-2").orElseThrow()
                .getStatus()).isEqualTo(RegistrationStatus.CONFIRMED);
        assertThat(count(event.getEventId(), RegistrationStatus.CONFIRMED)).isEqualTo(1);
        assertThat(count(event.getEventId(), RegistrationStatus.WAITLISTED)).isEqualTo(1);
    }

    @Test
    @DisplayName("cancel - Leaving the waitlist promotes nobody")
    void cancel_Waitlisted_NoPromotion() {
        // Given
        CraftEvent event = eventRepository.save(TestDataBuilder.openEvent(1).build());
        bookingService.register(event.getEventId(), "user-1", null, null);
        bookingService.register(event.getEventId(), "user-2", null, null);
        bookingService.register(event.getEventId(), "user-3", null, null);

        // When
        RegistrationCancellation outcome = bookingService.cancel(event.getEventId(), "user-2", Actor.user("user-2"));

        // Then
        assertThat(outcome.getPromoted()).isEmpty();
        assertThat(count(event.getEventId(), RegistrationStatus.CONFIRMED)).isEqualTo(1);
        assertThat(registrationService.getWaitlist(event.getEventId()))
                .extracting(entry -> entry.getRegistration().getUserId())
                .containsExactly("user-3");
    }

    // ========================================
    // Feedback Tests
    // ========================================

    @Test
    @DisplayName("submitFeedback - Out of range rejected, valid rating accepted once")
    void submitFeedback_AfterAttendance_AcceptedOnce() {
        // Given
        CraftEvent event = eventRepository.save(TestDataBuilder.pastEvent().build());
        registrationRepository.save(TestDataBuilder
                .registration(event.getEventId(), "user-1", RegistrationStatus.CONFIRMED)
                .build());
        Actor organizer = new Actor(TestDataBuilder.ORGANIZER_ID, Actor.Role.ORGANIZER);
        bookingService.markAttendance(event.getEventId(), "user-1", true, organizer);
        Actor attendee = Actor.user("user-1");

        // When / Then
        assertThatThrownBy(() -> bookingService.submitFeedback(event.getEventId(), attendee, "Too long", 6))
                .isInstanceOf(InvalidRatingException.class);

        Registration rated = bookingService.submitFeedback(event.getEventId(), attendee, "Lovely tutor", 5);
        assertThat(rated.getRating()).isEqualTo(5);

        assertThatThrownBy(() -> bookingService.submitFeedback(event.getEventId(), attendee, "Again", 4))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(registrationRepository.findByEventIdAndUserId(event.getEventId(), "user-1").orElseThrow()
                .getRating()).isEqualTo(5);
    }

    @Test
    @DisplayName("submitFeedback - Concurrent submissions keep only the first rating")
    void submitFeedback_Concurrent_AcceptedOnce() throws Exception {
        // Given
        CraftEvent event = eventRepository.save(TestDataBuilder.pastEvent().build());
        registrationRepository.save(TestDataBuilder
                .registration(event.getEventId(), "user-1", RegistrationStatus.ATTENDED)
                .build());
        Actor attendee = Actor.user("user-1");
        int threads = 5;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> results = new ArrayList<>();

        // When
        for (int i = 0; i < threads; i++) {
            int rating = i + 1;
            results.add(pool.submit(() -> {
                start.await();
                try {
                    bookingService.submitFeedback(event.getEventId(), attendee, "Rating " + rating, rating);
                    return rating;
                } catch (InvalidTransitionException e) {
                    return 0;
                }
            }));
        }
        start.countDown();

        List<Integer> accepted = new ArrayList<>();
        for (Future<Integer> result : results) {
            int rating = result.get(30, TimeUnit.SECONDS);
            if (rating > 0) {
                accepted.add(rating);
            }
        }
        pool.shutdown();

        // Then
        assertThat(accepted).hasSize(1);
        Registration stored = registrationRepository
                .findByEventIdAndUserId(event.getEventId(), "user-1").orElseThrow();
        assertThat(stored.getRating()).isEqualTo(accepted.get(0));
        assertThat(stored.getFeedback()).isEqualTo("Rating " + accepted.get(0));
    }
}
