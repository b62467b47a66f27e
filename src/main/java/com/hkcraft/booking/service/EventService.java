package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.CraftEvent;
import com.hkcraft.booking.domain.model.CraftEvent.EventKind;
import com.hkcraft.booking.domain.model.CraftEvent.EventStatus;
import com.hkcraft.booking.domain.model.Registration.RegistrationStatus;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.exception.InvalidTransitionException;
import com.hkcraft.booking.exception.ResourceAccessDeniedException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.repository.CraftEventRepository;
import com.hkcraft.booking.repository.RegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Event and course lifecycle: create, open and close registration, cancel.
 *
 * @author Craft Booking Team
 */
@Service
public class EventService {

    private static final Logger logger = LoggerFactory.getLogger(EventService.class);

    private final CraftEventRepository eventRepository;
    private final RegistrationRepository registrationRepository;

    public EventService(CraftEventRepository eventRepository, RegistrationRepository registrationRepository) {
        this.eventRepository = eventRepository;
        this.registrationRepository = registrationRepository;
    }

    /**
     * Create an event in DRAFT, organized by the actor.
     *
     * @param maxParticipants seat cap, null for unlimited
     * @param registrationFee fee charged on confirmation, null or zero for free events
     */
    @Transactional
    public CraftEvent createEvent(Actor actor, String title, EventKind kind, Instant startsAt, Instant endsAt,
                                  Integer maxParticipants, BigDecimal registrationFee) {
        if (actor.getRole() == Actor.Role.USER) {
            throw new ResourceAccessDeniedException(actor.getUserId(), "Event", "new");
        }

        Map<String, String> errors = new LinkedHashMap<>();
        if (title == null || title.isBlank()) {
            errors.put("title", "must not be blank");
        }
        if (kind == null) {
            errors.put("kind", "is required");
        }
        if (startsAt == null || endsAt == null) {
            errors.put("schedule", "start and end are required");
        } else if (!endsAt.isAfter(startsAt)) {
            errors.put("endsAt", "must be after startsAt");
        }
        if (maxParticipants != null && maxParticipants <= 0) {
            errors.put("maxParticipants", "must be greater than 0");
        }
        if (registrationFee != null && registrationFee.signum() < 0) {
            errors.put("registrationFee", "must not be negative");
        }
        if (!errors.isEmpty()) {
            throw new ValidationFailedException("Invalid event", errors);
        }

        CraftEvent event = eventRepository.save(CraftEvent.builder()
                .organizerId(actor.getUserId())
                .title(title)
                .kind(kind)
                .status(EventStatus.DRAFT)
                .startsAt(startsAt)
                .endsAt(endsAt)
                .maxParticipants(maxParticipants)
                .registrationFee(registrationFee == null ? BigDecimal.ZERO : registrationFee)
                .build());

        logger.info("Created {} event {} '{}' for organizer {}", kind, event.getEventId(), title, actor.getUserId());
        return withRemainingSeats(event);
    }

    /**
     * Open registration. Allowed from DRAFT or PUBLISHED.
     */
    @Transactional
    public CraftEvent publishEvent(String eventId, Actor actor) {
        return transition(eventId, actor, EventStatus.REGISTRATION_OPEN,
                List.of(EventStatus.DRAFT, EventStatus.PUBLISHED));
    }

    @Transactional
    public CraftEvent closeRegistration(String eventId, Actor actor) {
        return transition(eventId, actor, EventStatus.REGISTRATION_CLOSED,
                List.of(EventStatus.REGISTRATION_OPEN));
    }

    /**
     * Cancel an event that has not completed. Existing registrations are left as they are.
     */
    @Transactional
    public CraftEvent cancelEvent(String eventId, Actor actor) {
        CraftEvent event = lockEvent(eventId);
        verifyOrganizer(event, actor);

        if (event.getStatus().isTerminal()) {
            throw new InvalidTransitionException("Event", eventId,
                    event.getStatus().name(), EventStatus.CANCELLED.name());
        }

        EventStatus previous = event.getStatus();
        event.setStatus(EventStatus.CANCELLED);
        event = eventRepository.save(event);

        logger.info("Event {} cancelled by {} (was {})", eventId, actor, previous);
        return withRemainingSeats(event);
    }

    @Transactional(readOnly = true)
    public CraftEvent getEvent(String eventId) {
        CraftEvent event = eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVENT_CAPACITY, eventId));
        return withRemainingSeats(event);
    }

    @Transactional(readOnly = true)
    public List<CraftEvent> getEventsByOrganizer(String organizerId) {
        List<CraftEvent> events = eventRepository.findByOrganizerIdOrderByStartsAtAsc(organizerId);
        events.forEach(this::withRemainingSeats);
        return events;
    }

    private CraftEvent transition(String eventId, Actor actor, EventStatus target, List<EventStatus> allowedFrom) {
        CraftEvent event = lockEvent(eventId);
        verifyOrganizer(event, actor);

        EventStatus current = event.getStatus();
        if (!allowedFrom.contains(current)) {
            throw new InvalidTransitionException("Event", eventId, current.name(), target.name());
        }

        event.setStatus(target);
        event = eventRepository.save(event);

        logger.info("Event {} moved from {} to {} by {}", eventId, current, target, actor);
        return withRemainingSeats(event);
    }

    private CraftEvent withRemainingSeats(CraftEvent event) {
        if (event.hasCapacityLimit()) {
            long confirmed = event.getEventId() == null
                    ? 0
                    : registrationRepository.countByEventIdAndStatus(event.getEventId(), RegistrationStatus.CONFIRMED);
            event.setRemainingSeats(RegistrationService.remainingSeats(event, confirmed));
        }
        return event;
    }

    private CraftEvent lockEvent(String eventId) {
        return eventRepository.findByIdWithLock(eventId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.EVENT_CAPACITY, eventId));
    }

    private static void verifyOrganizer(CraftEvent event, Actor actor) {
        if (!event.isOrganizedBy(actor.getUserId()) && !actor.isPrivileged()) {
            throw new ResourceAccessDeniedException(actor.getUserId(), "Event", event.getEventId());
        }
    }
}
