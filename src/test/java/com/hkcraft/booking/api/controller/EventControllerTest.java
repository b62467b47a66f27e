package com.hkcraft.booking.api.controller;

import com.hkcraft.booking.api.exception.GlobalExceptionHandler;
import com.hkcraft.booking.config.SecurityConfig;
import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.CraftEvent;
import com.hkcraft.booking.domain.model.PaymentMethod;
import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.domain.model.Registration.RegistrationStatus;
import com.hkcraft.booking.exception.AlreadyRegisteredException;
import com.hkcraft.booking.exception.InvalidRatingException;
import com.hkcraft.booking.exception.RegistrationNotOpenException;
import com.hkcraft.booking.service.EventBookingService;
import com.hkcraft.booking.service.EventService;
import com.hkcraft.booking.service.RegistrationCancellation;
import com.hkcraft.booking.service.RegistrationService;
import com.hkcraft.booking.service.WaitlistEntry;
import com.hkcraft.booking.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for EventController using MockMvc.
 *
 * @author Craft Booking Team
 */
@WebMvcTest(EventController.class)
@ContextConfiguration(classes = {EventController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("EventController Tests")
class EventControllerTest {

    private static final String USER_HEADER = "X-User-Id";
    private static final String ROLE_HEADER = "X-User-Role";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private EventService eventService;

    @MockBean
    private EventBookingService bookingService;

    @MockBean
    private RegistrationService registrationService;

    // ========================================
    // POST /api/v1/events Tests
    // ========================================

    @Test
    @DisplayName("POST /events - Organizer creates a course")
    void createEvent_Organizer_Returns201() throws Exception {
        CraftEvent event = TestDataBuilder.openEvent(12).eventId("e-1")
                .kind(CraftEvent.EventKind.COURSE)
                .status(CraftEvent.EventStatus.DRAFT)
                .build();
        event.setRemainingSeats(12);
        when(eventService.createEvent(any(Actor.class), eq("Lantern Making"), eq(CraftEvent.EventKind.COURSE),
                any(), any(), eq(12), any())).thenReturn(event);

        mockMvc.perform(post("/api/v1/events")
                        .header(USER_HEADER, TestDataBuilder.ORGANIZER_ID)
                        .header(ROLE_HEADER, "ORGANIZER")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "title": "Lantern Making",
                                    "kind": "COURSE",
                                    "startsAt": "2030-03-01T02:00:00Z",
                                    "endsAt": "2030-03-01T05:00:00Z",
                                    "maxParticipants": 12,
                                    "registrationFee": 280.00
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.eventId").value("e-1"))
                .andExpect(jsonPath("$.kind").value("COURSE"))
                .andExpect(jsonPath("$.remainingSeats").value(12));
    }

    @Test
    @DisplayName("POST /events - Plain user returns 403")
    void createEvent_User_Returns403() throws Exception {
        mockMvc.perform(post("/api/v1/events")
                        .header(USER_HEADER, "u-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                    "title": "Lantern Making",
                                    "kind": "WORKSHOP",
                                    "startsAt": "2030-03-01T02:00:00Z",
                                    "endsAt": "2030-03-01T05:00:00Z"
                                }
                                """))
                .andExpect(status().isForbidden());

        verifyNoInteractions(eventService);
    }

    // ========================================
    // Registration Tests
    // ========================================

    @Test
    @DisplayName("POST /{eventId}/registrations - Confirmed registration returns 201")
    void register_Confirmed_Returns201() throws Exception {
        Registration registration = TestDataBuilder.registration("e-1", "u-1", RegistrationStatus.CONFIRMED)
                .registrationId(1L).build();
        when(bookingService.register("e-1", "u-1", null, null)).thenReturn(registration);

        mockMvc.perform(post("/api/v1/events/e-1/registrations").header(USER_HEADER, "u-1"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("CONFIRMED"))
                .andExpect(jsonPath("$.registrationId").value(1));
    }

    @Test
    @DisplayName("POST /{eventId}/registrations - Paid event passes payment method")
    void register_WithPayment_PassesMethod() throws Exception {
        Registration registration = TestDataBuilder.registration("e-1", "u-1", RegistrationStatus.WAITLISTED)
                .registrationId(4L).build();
        when(bookingService.register("e-1", "u-1", "vegetarian", PaymentMethod.ALIPAY_HK)).thenReturn(registration);

        mockMvc.perform(post("/api/v1/events/e-1/registrations")
                        .header(USER_HEADER, "u-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"notes\": \"vegetarian\", \"paymentMethod\": \"ALIPAY_HK\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("WAITLISTED"));
    }

    @Test
    @DisplayName("POST /{eventId}/registrations - Duplicate returns 409")
    void register_Duplicate_Returns409() throws Exception {
        when(bookingService.register(anyString(), anyString(), any(), any()))
                .thenThrow(new AlreadyRegisteredException("e-1", "u-1", "CONFIRMED"));

        mockMvc.perform(post("/api/v1/events/e-1/registrations").header(USER_HEADER, "u-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Already Registered"));
    }

    @Test
    @DisplayName("POST /{eventId}/registrations - Closed event returns 409")
    void register_Closed_Returns409() throws Exception {
        when(bookingService.register(anyString(), anyString(), any(), any()))
                .thenThrow(new RegistrationNotOpenException("e-1", "REGISTRATION_CLOSED"));

        mockMvc.perform(post("/api/v1/events/e-1/registrations").header(USER_HEADER, "u-1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.details.eventStatus").value("REGISTRATION_CLOSED"));
    }

    @Test
    @DisplayName("DELETE /{eventId}/registrations - Returns promoted registration")
    void cancelRegistration_WithPromotion_Returns200() throws Exception {
        Registration cancelled = TestDataBuilder.registration("e-1", "u-1", RegistrationStatus.CANCELLED)
                .registrationId(1L).build();
        Registration promoted = TestDataBuilder.registration("e-1", "u-3", RegistrationStatus.CONFIRMED)
                .registrationId(3L).build();
        when(bookingService.cancel("e-1", "u-1", Actor.user("u-1"))).thenReturn(
                new RegistrationCancellation(cancelled, RegistrationStatus.CONFIRMED, promoted));

        mockMvc.perform(delete("/api/v1/events/e-1/registrations").header(USER_HEADER, "u-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previousStatus").value("CONFIRMED"))
                .andExpect(jsonPath("$.registration.status").value("CANCELLED"))
                .andExpect(jsonPath("$.promoted.userId").value("u-3"));
    }

    @Test
    @DisplayName("GET /{eventId}/waitlist - Public list with positions")
    void getWaitlist_Public_Returns200() throws Exception {
        Registration waiting = TestDataBuilder.registration("e-1", "u-3", RegistrationStatus.WAITLISTED)
                .registrationId(3L).build();
        when(registrationService.getWaitlist("e-1")).thenReturn(List.of(new WaitlistEntry(1, waiting)));

        mockMvc.perform(get("/api/v1/events/e-1/waitlist"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].waitlistPosition").value(1));
    }

    @Test
    @DisplayName("POST /{eventId}/feedback - Out of range rating returns 400")
    void submitFeedback_BadRating_Returns400() throws Exception {
        when(bookingService.submitFeedback(eq("e-1"), any(Actor.class), any(), eq(6)))
                .thenThrow(new InvalidRatingException(6));

        mockMvc.perform(post("/api/v1/events/e-1/feedback")
                        .header(USER_HEADER, "u-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"feedback\": \"great\", \"rating\": 6}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid Rating"))
                .andExpect(jsonPath("$.details.max").value(5));
    }
}
