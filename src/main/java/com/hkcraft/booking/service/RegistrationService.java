package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.CraftEvent;
import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.domain.model.Registration.RegistrationStatus;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.exception.AlreadyRegisteredException;
import com.hkcraft.booking.exception.InvalidRatingException;
import com.hkcraft.booking.exception.InvalidTransitionException;
import com.hkcraft.booking.exception.RegistrationNotOpenException;
import com.hkcraft.booking.exception.ResourceAccessDeniedException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import com.hkcraft.booking.repository.CraftEventRepository;
import com.hkcraft.booking.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Registration state machine for events and courses.
 *
 * Registering, cancelling and marking attendance all lock the event row first.
 * The CONFIRMED count is therefore read and acted on by one transaction at a time
 * per event, which keeps confirmed registrations within the seat cap and makes
 * the promote-oldest step see a consistent waitlist.
 *
 * This service only changes state. It sends no notifications; the caller acts on
 * the returned outcome once the transaction has committed.
 *
 * @author Craft Booking Team
 */
@Service
public class RegistrationService {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationService.class);

    private static final String REGISTRATION = "Registration";

    private final CraftEventRepository eventRepository;
    private final RegistrationRepository registrationRepository;
    private final BookingMetricsService metricsService;
    private final boolean allowReregistration;

    public RegistrationService(
            CraftEventRepository eventRepository,
            RegistrationRepository registrationRepository,
            BookingMetricsService metricsService,
            @Value("${craft.registration.allow-reregistration:false}") boolean allowReregistration
    ) {
        this.eventRepository = eventRepository;
        this.registrationRepository = registrationRepository;
        this.metricsService = metricsService;
        this.allowReregistration = allowReregistration;
    }

    /**
     * Register a user for an event.
     *
     * The registration is CONFIRMED while confirmed registrations are below the cap
     * (or the event has none) and WAITLISTED otherwise. An existing registration for
     * the same user is rejected, except that a CANCELLED one is reused at the back of
     * the queue when re-registration is enabled.
     *
     * @param eventId event to join
     * @param userId  registering user
     * @param notes   optional notes for the organizer
     * @return the saved registration
     * @throws ResourceNotFoundException    if the event does not exist
     * @throws RegistrationNotOpenException if the event is not open for registration
     * @throws AlreadyRegisteredException   if the user already has a registration
     */
    @Transactional
    public Registration register(String eventId, String userId, String notes) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationFailedException("User id is required");
        }

        CraftEvent event = lockEvent(eventId);

        if (!event.isRegistrationOpen()) {
            logger.warn("Registration for event {} rejected, status: {}", eventId, event.getStatus());
            throw new RegistrationNotOpenException(eventId, event.getStatus().name());
        }

        Optional<Registration> existing = registrationRepository.findByEventIdAndUserId(eventId, userId);
        if (existing.isPresent() && !canReuse(existing.get())) {
            logger.warn("User {} already registered for event {} with status {}",
                    userId, eventId, existing.get().getStatus());
            throw new AlreadyRegisteredException(eventId, userId, existing.get().getStatus().name());
        }

        long confirmed = registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.CONFIRMED);
        RegistrationStatus status = event.hasSeatFor(confirmed)
                ? RegistrationStatus.CONFIRMED
                : RegistrationStatus.WAITLISTED;

        Registration registration;
        if (existing.isPresent()) {
            registration = existing.get();
            registration.reactivate(status, notes);
            logger.info("Reactivated cancelled registration {} for user {} on event {}",
                    registration.getRegistrationId(), userId, eventId);
        } else {
            registration = Registration.builder()
                    .eventId(eventId)
                    .userId(userId)
                    .status(status)
                    .notes(notes)
                    .registeredAt(Instant.now())
                    .build();
        }

        registration = registrationRepository.save(registration);
        metricsService.recordRegistration(status.name());

        logger.info("Registered user {} for event {} as {} ({} confirmed before, cap {})",
                userId, eventId, status, confirmed,
                event.hasCapacityLimit() ? event.getMaxParticipants() : "none");
        return registration;
    }

    /**
     * Cancel a registration. Cancelling a CONFIRMED registration promotes the oldest
     * WAITLISTED one (by registration time, then id) in the same transaction.
     * Cancelling an already cancelled registration changes nothing.
     *
     * @param eventId event
     * @param userId  user whose registration is cancelled
     * @return the cancelled registration and the promoted one, if any
     * @throws ResourceNotFoundException  if no registration exists
     * @throws InvalidTransitionException if the registration is ATTENDED or NO_SHOW
     */
    @Transactional
    public RegistrationCancellation cancel(String eventId, String userId) {
        lockEvent(eventId);

        Registration registration = findRegistration(eventId, userId);
        RegistrationStatus previous = registration.getStatus();

        if (previous == RegistrationStatus.CANCELLED) {
            logger.info("Registration {} already cancelled", registration.getRegistrationId());
            return new RegistrationCancellation(registration, previous, null);
        }

        if (previous != RegistrationStatus.CONFIRMED && previous != RegistrationStatus.WAITLISTED) {
            throw new InvalidTransitionException(REGISTRATION, String.valueOf(registration.getRegistrationId()),
                    previous.name(), RegistrationStatus.CANCELLED.name());
        }

        registration.cancel();
        registration = registrationRepository.saveAndFlush(registration);

        Registration promoted = null;
        if (previous == RegistrationStatus.CONFIRMED) {
            promoted = registrationRepository
                    .findFirstByEventIdAndStatusOrderByRegisteredAtAscRegistrationIdAsc(
                            eventId, RegistrationStatus.WAITLISTED)
                    .map(next -> {
                        next.promote();
                        return registrationRepository.save(next);
                    })
                    .orElse(null);
        }

        metricsService.recordRegistrationCancelled(promoted != null);
        if (promoted != null) {
            logger.info("Cancelled registration {} for event {}, promoted user {}",
                    registration.getRegistrationId(), eventId, promoted.getUserId());
        } else {
            logger.info("Cancelled {} registration {} for event {}",
                    previous, registration.getRegistrationId(), eventId);
        }

        return new RegistrationCancellation(registration, previous, promoted);
    }

    /**
     * Record attendance after the event has ended.
     *
     * @param attended true for ATTENDED, false for NO_SHOW
     * @param actor    the event's organizer or an admin
     */
    @Transactional
    public Registration markAttendance(String eventId, String userId, boolean attended, Actor actor) {
        CraftEvent event = lockEvent(eventId);
        verifyOrganizer(event, actor);

        Registration registration = findRegistration(eventId, userId);
        RegistrationStatus target = attended ? RegistrationStatus.ATTENDED : RegistrationStatus.NO_SHOW;
        Instant now = Instant.now();

        if (!event.hasEnded(now)) {
            throw new InvalidTransitionException(REGISTRATION, String.valueOf(registration.getRegistrationId()),
                    registration.getStatus().name(), target.name(), "event has not ended yet");
        }
        if (!registration.isConfirmed()) {
            throw new InvalidTransitionException(REGISTRATION, String.valueOf(registration.getRegistrationId()),
                    registration.getStatus().name(), target.name());
        }

        if (attended) {
            registration.markAttended(now);
        } else {
            registration.markNoShow();
        }

        logger.info("Marked user {} as {} for event {} by {}", userId, target, eventId, actor);
        return registrationRepository.save(registration);
    }

    /**
     * Store feedback for an attended registration. Accepted once.
     *
     * @param rating 1 to 5
     * @throws InvalidRatingException     if the rating is missing or out of range
     * @throws InvalidTransitionException if the user did not attend or already left feedback
     */
    @Transactional
    public Registration submitFeedback(String eventId, String userId, String feedback, Integer rating) {
        if (rating == null
                || rating < InvalidRatingException.MIN_RATING
                || rating > InvalidRatingException.MAX_RATING) {
            throw new InvalidRatingException(rating);
        }

        // Locked so two submissions cannot both see an empty feedback slot
        Registration registration = registrationRepository.findByEventIdAndUserIdWithLock(eventId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(REGISTRATION, eventId + "/" + userId));

        if (registration.getStatus() != RegistrationStatus.ATTENDED) {
            throw new InvalidTransitionException(REGISTRATION, String.valueOf(registration.getRegistrationId()),
                    registration.getStatus().name(), "FEEDBACK", "only attended registrations accept feedback");
        }
        if (registration.hasFeedback()) {
            throw new InvalidTransitionException(REGISTRATION, String.valueOf(registration.getRegistrationId()),
                    "FEEDBACK_SUBMITTED", "FEEDBACK", "feedback was already submitted");
        }

        registration.recordFeedback(feedback, rating);
        logger.info("Feedback with rating {} recorded for event {} by user {}", rating, eventId, userId);
        return registrationRepository.save(registration);
    }

    /**
     * Registration and feedback summary for the organizer.
     */
    @Transactional(readOnly = true)
    public EventStats getEventStats(String eventId, Actor actor) {
        CraftEvent event = findEvent(eventId);
        verifyOrganizer(event, actor);

        long confirmed = registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.CONFIRMED);

        return EventStats.builder()
                .eventId(eventId)
                .total(registrationRepository.countByEventId(eventId))
                .confirmed(confirmed)
                .waitlisted(registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.WAITLISTED))
                .cancelled(registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.CANCELLED))
                .attended(registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.ATTENDED))
                .noShow(registrationRepository.countByEventIdAndStatus(eventId, RegistrationStatus.NO_SHOW))
                .averageRating(registrationRepository.averageRating(eventId))
                .feedbackCount(registrationRepository.countFeedback(eventId))
                .remainingSeats(remainingSeats(event, confirmed))
                .build();
    }

    @Transactional(readOnly = true)
    public List<Registration> getUserRegistrations(String userId) {
        return registrationRepository.findByUserIdOrderByRegisteredAtDesc(userId);
    }

    @Transactional(readOnly = true)
    public List<Registration> getRegistrations(String eventId, Actor actor) {
        CraftEvent event = findEvent(eventId);
        verifyOrganizer(event, actor);
        return registrationRepository.findByEventIdOrderByRegisteredAtAscRegistrationIdAsc(eventId);
    }

    /**
     * Waitlisted registrations in the order they would be promoted.
     */
    @Transactional(readOnly = true)
    public List<WaitlistEntry> getWaitlist(String eventId) {
        findEvent(eventId);
        List<Registration> waiting = registrationRepository
                .findByEventIdAndStatusOrderByRegisteredAtAscRegistrationIdAsc(eventId, RegistrationStatus.WAITLISTED);

        List<WaitlistEntry> entries = new ArrayList<>(waiting.size());
        for (int i = 0; i < waiting.size(); i++) {
            entries.add(new WaitlistEntry(i + 1, waiting.get(i)));
        }
        return entries;
    }

    /**
     * Seats left given the CONFIRMED count, or null when the event is uncapped.
     */
    static Integer remainingSeats(CraftEvent event, long confirmed) {
        if (!event.hasCapacityLimit()) {
            return null;
        }
        return (int) Math.max(0, event.getMaxParticipants() - confirmed);
    }

    private boolean canReuse(Registration existing) {
        return allowReregistration && existing.isCancelled();
    }

    private CraftEvent lockEvent(String eventId) {
        return eventRepository.findByIdWithLock(eventId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVENT_CAPACITY, eventId));
    }

    private CraftEvent findEvent(String eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVENT_CAPACITY, eventId));
    }

    private Registration findRegistration(String eventId, String userId) {
        return registrationRepository.findByEventIdAndUserId(eventId, userId)
                .orElseThrow(() -> new ResourceNotFoundException(REGISTRATION, eventId + "/" + userId));
    }

    private static void verifyOrganizer(CraftEvent event, Actor actor) {
        if (!event.isOrganizedBy(actor.getUserId()) && !actor.isPrivileged()) {
            throw new ResourceAccessDeniedException(actor.getUserId(), "Event", event.getEventId());
        }
    }
}
