package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.CraftEvent;
import com.hkcraft.booking.domain.model.PaymentMethod;
import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.exception.PaymentDeclinedException;
import com.hkcraft.booking.exception.ResourceAccessDeniedException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.messaging.Notifier;
import com.hkcraft.booking.infrastructure.messaging.events.Notification;
import com.hkcraft.booking.infrastructure.messaging.events.NotificationType;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import com.hkcraft.booking.infrastructure.payment.PaymentGateway;
import com.hkcraft.booking.infrastructure.payment.PaymentResult;
import com.hkcraft.booking.infrastructure.tx.TransactionRetryExecutor;
import com.hkcraft.booking.repository.CraftEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Booking flow for events and courses.
 *
 * Each state change runs through {@link TransactionRetryExecutor} so lock conflicts
 * are retried with a fresh transaction. Notifications and fee charges happen only
 * after the transaction has committed, so nobody is told about a seat that was
 * rolled back.
 *
 * Flow for a paid event:
 * 1. Register (CONFIRMED or WAITLISTED) and commit
 * 2. Notify organizer and user
 * 3. If CONFIRMED, charge the registration fee
 * 4. On decline, cancel the registration (promoting the next user) and fail
 *
 * @author Craft Booking Team
 */
@Service
public class EventBookingService {

    private static final Logger logger = LoggerFactory.getLogger(EventBookingService.class);

    private final RegistrationService registrationService;
    private final CraftEventRepository eventRepository;
    private final TransactionRetryExecutor txExecutor;
    private final PaymentGateway paymentGateway;
    private final Notifier notifier;
    private final BookingMetricsService metricsService;

    public EventBookingService(
            RegistrationService registrationService,
            CraftEventRepository eventRepository,
            TransactionRetryExecutor txExecutor,
            PaymentGateway paymentGateway,
            Notifier notifier,
            BookingMetricsService metricsService
    ) {
        this.registrationService = registrationService;
        this.eventRepository = eventRepository;
        this.txExecutor = txExecutor;
        this.paymentGateway = paymentGateway;
        this.notifier = notifier;
        this.metricsService = metricsService;
    }

    /**
     * Register a user and send the resulting notifications.
     *
     * @param paymentMethod required when the event charges a fee
     * @return the committed registration (CANCELLED never, the fee failure path throws)
     * @throws PaymentDeclinedException if the fee could not be charged
     */
    public Registration register(String eventId, String userId, String notes, PaymentMethod paymentMethod) {
        CraftEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVENT_CAPACITY, eventId));
        if (event.requiresFee() && paymentMethod == null) {
            throw new ValidationFailedException("Payment method is required for paid events",
                    Map.of("paymentMethod", "is required"));
        }

        Registration registration = txExecutor.execute("event.register",
                () -> registrationService.register(eventId, userId, notes));

        safeNotify(event.getOrganizerId(), Notification.of(
                        NotificationType.REGISTRATION_RECEIVED,
                        "New registration",
                        "A participant registered for " + event.getTitle())
                .with("eventId", eventId)
                .with("registrationId", registration.getRegistrationId())
                .with("status", registration.getStatus().name()));

        if (registration.isConfirmed() && event.requiresFee()) {
            chargeFee(event, registration, paymentMethod);
        }

        if (registration.isConfirmed()) {
            safeNotify(userId, Notification.of(
                            NotificationType.REGISTRATION_CONFIRMED,
                            "Registration confirmed",
                            "Your place at " + event.getTitle() + " is confirmed")
                    .with("eventId", eventId)
                    .with("registrationId", registration.getRegistrationId()));
        } else {
            int position = waitlistPosition(eventId, registration);
            safeNotify(userId, Notification.of(
                            NotificationType.REGISTRATION_WAITLISTED,
                            "Added to waitlist",
                            event.getTitle() + " is full, you are number " + position + " on the waitlist")
                    .with("eventId", eventId)
                    .with("registrationId", registration.getRegistrationId())
                    .with("position", position));
        }

        return registration;
    }

    /**
     * Cancel a registration and tell whoever was promoted into the freed seat.
     *
     * @param actor the registered user, or an admin
     */
    public RegistrationCancellation cancel(String eventId, String userId, Actor actor) {
        if (!actor.canActFor(userId)) {
            throw new ResourceAccessDeniedException(actor.getUserId(), "Registration", eventId + "/" + userId);
        }

        RegistrationCancellation outcome = txExecutor.execute("event.cancel",
                () -> registrationService.cancel(eventId, userId));

        if (outcome.isChanged()) {
            afterCancellation(eventId, outcome);
        }
        return outcome;
    }

    public Registration markAttendance(String eventId, String userId, boolean attended, Actor actor) {
        return txExecutor.execute("event.attendance",
                () -> registrationService.markAttendance(eventId, userId, attended, actor));
    }

    /**
     * Submit feedback on behalf of the acting user.
     */
    public Registration submitFeedback(String eventId, Actor actor, String feedback, Integer rating) {
        return txExecutor.execute("event.feedback",
                () -> registrationService.submitFeedback(eventId, actor.getUserId(), feedback, rating));
    }

    public EventStats getEventStats(String eventId, Actor actor) {
        return txExecutor.execute("event.stats", () -> registrationService.getEventStats(eventId, actor));
    }

    private void chargeFee(CraftEvent event, Registration registration, PaymentMethod paymentMethod) {
        String reference = "REG-" + registration.getRegistrationId();
        PaymentResult result;
        try {
            result = paymentGateway.charge(event.getRegistrationFee(), paymentMethod, reference);
        } catch (RuntimeException e) {
            logger.error("Payment gateway error for registration {}", registration.getRegistrationId(), e);
            metricsService.recordError("PAYMENT_GATEWAY_ERROR", "event.register");
            result = PaymentResult.declined("GATEWAY_ERROR", e.getMessage());
        }

        if (result.isSuccess()) {
            logger.info("Charged fee {} for registration {}, transaction {}",
                    event.getRegistrationFee(), registration.getRegistrationId(), result.getTransactionId());
            return;
        }

        logger.warn("Fee declined for registration {} ({}: {}), cancelling",
                registration.getRegistrationId(), result.getDeclineCode(), result.getDeclineReason());
        metricsService.recordPaymentDeclined("event.register");

        RegistrationCancellation outcome = txExecutor.execute("event.cancel",
                () -> registrationService.cancel(event.getEventId(), registration.getUserId()));
        if (outcome.isChanged()) {
            afterCancellation(event.getEventId(), outcome);
        }

        throw new PaymentDeclinedException(reference, result.getDeclineCode(), result.getDeclineReason());
    }

    private void afterCancellation(String eventId, RegistrationCancellation outcome) {
        Registration cancelled = outcome.getRegistration();
        safeNotify(cancelled.getUserId(), Notification.of(
                        NotificationType.REGISTRATION_CANCELLED,
                        "Registration cancelled",
                        "Your registration has been cancelled")
                .with("eventId", eventId)
                .with("registrationId", cancelled.getRegistrationId()));

        outcome.getPromoted().ifPresent(promoted -> {
            CraftEvent event = eventRepository.findById(eventId).orElse(null);
            String title = event == null ? "the event" : event.getTitle();
            Notification notification = Notification.of(
                            NotificationType.REGISTRATION_PROMOTED,
                            "A place opened up",
                            "You have been moved from the waitlist to a confirmed place at " + title)
                    .with("eventId", eventId)
                    .with("registrationId", promoted.getRegistrationId());
            if (event != null && event.requiresFee()) {
                notification.with("feeDue", event.getRegistrationFee());
            }
            safeNotify(promoted.getUserId(), notification);
        });
    }

    private int waitlistPosition(String eventId, Registration registration) {
        List<WaitlistEntry> waitlist = registrationService.getWaitlist(eventId);
        for (WaitlistEntry entry : waitlist) {
            if (Objects.equals(entry.getRegistration().getRegistrationId(), registration.getRegistrationId())) {
                return entry.getPosition();
            }
        }
        return waitlist.size();
    }

    private void safeNotify(String userId, Notification notification) {
        try {
            notifier.notify(userId, notification);
        } catch (RuntimeException e) {
            logger.error("Notification {} for user {} failed", notification.getType(), userId, e);
            metricsService.recordNotificationFailure(notification.getType().name());
        }
    }
}
