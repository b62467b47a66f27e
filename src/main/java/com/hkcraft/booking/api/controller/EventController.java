package com.hkcraft.booking.api.controller;

import com.hkcraft.booking.api.dto.AttendanceRequest;
import com.hkcraft.booking.api.dto.CancellationResponse;
import com.hkcraft.booking.api.dto.CreateEventRequest;
import com.hkcraft.booking.api.dto.EventResponse;
import com.hkcraft.booking.api.dto.FeedbackRequest;
import com.hkcraft.booking.api.dto.RegistrationRequest;
import com.hkcraft.booking.api.dto.RegistrationResponse;
import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.CraftEvent;
import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.security.SecurityUtils;
import com.hkcraft.booking.service.EventBookingService;
import com.hkcraft.booking.service.EventService;
import com.hkcraft.booking.service.EventStats;
import com.hkcraft.booking.service.RegistrationCancellation;
import com.hkcraft.booking.service.RegistrationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for events, courses and their registrations.
 *
 * Event details and the waitlist are public. Registering and cancelling act for
 * the caller; lifecycle changes, attendance and stats are for the organizer or an admin.
 *
 * @author Craft Booking Team
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final EventService eventService;
    private final EventBookingService bookingService;
    private final RegistrationService registrationService;

    public EventController(
            EventService eventService,
            EventBookingService bookingService,
            RegistrationService registrationService
    ) {
        this.eventService = eventService;
        this.bookingService = bookingService;
        this.registrationService = registrationService;
    }

    @PostMapping
    @PreAuthorize("hasAnyRole('ORGANIZER', 'CRAFTSMAN', 'ADMIN')")
    public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody CreateEventRequest request) {
        CraftEvent event = eventService.createEvent(SecurityUtils.currentActor(),
                request.getTitle(), request.getKind(), request.getStartsAt(), request.getEndsAt(),
                request.getMaxParticipants(), request.getRegistrationFee());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.fromEntity(event));
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(eventService.getEvent(eventId)));
    }

    @GetMapping("/organizer/{organizerId}")
    public ResponseEntity<List<EventResponse>> getEventsByOrganizer(@PathVariable String organizerId) {
        List<EventResponse> events = eventService.getEventsByOrganizer(organizerId)
                .stream()
                .map(EventResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(events);
    }

    @PostMapping("/{eventId}/publish")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EventResponse> publish(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(
                eventService.publishEvent(eventId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{eventId}/close")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EventResponse> closeRegistration(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(
                eventService.closeRegistration(eventId, SecurityUtils.currentActor())));
    }

    @PostMapping("/{eventId}/cancel")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EventResponse> cancelEvent(@PathVariable String eventId) {
        return ResponseEntity.ok(EventResponse.fromEntity(
                eventService.cancelEvent(eventId, SecurityUtils.currentActor())));
    }

    /**
     * Register the caller. Returns CONFIRMED or WAITLISTED.
     */
    @PostMapping("/{eventId}/registrations")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationResponse> register(
            @PathVariable String eventId,
            @Valid @RequestBody(required = false) RegistrationRequest request
    ) {
        String userId = SecurityUtils.getCurrentUserId();
        RegistrationRequest body = request == null ? new RegistrationRequest() : request;

        Registration registration = bookingService.register(eventId, userId, body.getNotes(), body.getPaymentMethod());
        logger.info("User {} registered for event {} as {}", userId, eventId, registration.getStatus());
        return ResponseEntity.status(HttpStatus.CREATED).body(RegistrationResponse.fromEntity(registration));
    }

    /**
     * Cancel a registration. Users cancel their own; admins may pass another user's id.
     */
    @DeleteMapping("/{eventId}/registrations")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<CancellationResponse> cancelRegistration(
            @PathVariable String eventId,
            @RequestParam(required = false) String userId
    ) {
        Actor actor = SecurityUtils.currentActor();
        String target = userId == null ? actor.getUserId() : userId;
        RegistrationCancellation outcome = bookingService.cancel(eventId, target, actor);
        return ResponseEntity.ok(CancellationResponse.fromOutcome(outcome));
    }

    @GetMapping("/{eventId}/registrations")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<RegistrationResponse>> getRegistrations(@PathVariable String eventId) {
        List<RegistrationResponse> registrations = registrationService
                .getRegistrations(eventId, SecurityUtils.currentActor())
                .stream()
                .map(RegistrationResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(registrations);
    }

    /**
     * The caller's own registrations, newest first.
     */
    @GetMapping("/registrations/me")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<List<RegistrationResponse>> getMyRegistrations() {
        List<RegistrationResponse> registrations = registrationService
                .getUserRegistrations(SecurityUtils.getCurrentUserId())
                .stream()
                .map(RegistrationResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(registrations);
    }

    @GetMapping("/{eventId}/waitlist")
    public ResponseEntity<List<RegistrationResponse>> getWaitlist(@PathVariable String eventId) {
        List<RegistrationResponse> waitlist = registrationService.getWaitlist(eventId)
                .stream()
                .map(RegistrationResponse::fromWaitlistEntry)
                .collect(Collectors.toList());
        return ResponseEntity.ok(waitlist);
    }

    @PostMapping("/{eventId}/attendance")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationResponse> markAttendance(
            @PathVariable String eventId,
            @Valid @RequestBody AttendanceRequest request
    ) {
        Registration registration = bookingService.markAttendance(eventId, request.getUserId(),
                request.getAttended(), SecurityUtils.currentActor());
        return ResponseEntity.ok(RegistrationResponse.fromEntity(registration));
    }

    @PostMapping("/{eventId}/feedback")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<RegistrationResponse> submitFeedback(
            @PathVariable String eventId,
            @Valid @RequestBody FeedbackRequest request
    ) {
        Registration registration = bookingService.submitFeedback(eventId, SecurityUtils.currentActor(),
                request.getFeedback(), request.getRating());
        return ResponseEntity.ok(RegistrationResponse.fromEntity(registration));
    }

    @GetMapping("/{eventId}/stats")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EventStats> getStats(@PathVariable String eventId) {
        return ResponseEntity.ok(bookingService.getEventStats(eventId, SecurityUtils.currentActor()));
    }
}
