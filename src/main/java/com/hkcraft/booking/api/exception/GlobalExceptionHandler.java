package com.hkcraft.booking.api.exception;

import com.hkcraft.booking.api.dto.ErrorResponse;
import com.hkcraft.booking.exception.AlreadyRegisteredException;
import com.hkcraft.booking.exception.InsufficientCapacityException;
import com.hkcraft.booking.exception.InvalidRatingException;
import com.hkcraft.booking.exception.InvalidTransitionException;
import com.hkcraft.booking.exception.OrderNotCancellableException;
import com.hkcraft.booking.exception.PaymentDeclinedException;
import com.hkcraft.booking.exception.RegistrationNotOpenException;
import com.hkcraft.booking.exception.ResourceAccessDeniedException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ResourceUnavailableException;
import com.hkcraft.booking.exception.TransientConflictException;
import com.hkcraft.booking.exception.ValidationFailedException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps booking errors to HTTP responses.
 *
 * 400 validation and rating errors, 402 declined payments, 403 access,
 * 404 missing resources, 409 capacity and state conflicts, 503 exhausted retries.
 *
 * @author Craft Booking Team
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationFailedException.class)
    public ResponseEntity<ErrorResponse> handleValidationFailed(
            ValidationFailedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Validation failed: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                ex.getMessage(), request.getRequestURI());
        if (!ex.getFieldErrors().isEmpty()) {
            error.addDetail("fieldErrors", ex.getFieldErrors());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    /**
     * Handle validation errors from @Valid request bodies.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequestBody(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        logger.warn("Request validation failed: {} field errors", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> fieldErrors = new LinkedHashMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage());
        }

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request validation failed. Please check the field errors.", request.getRequestURI());
        error.addDetail("fieldErrors", fieldErrors);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Validation Failed",
                "Request body is malformed", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InvalidRatingException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRating(
            InvalidRatingException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid rating: {}", ex.getRating());

        ErrorResponse error = new ErrorResponse(HttpStatus.BAD_REQUEST, "Invalid Rating",
                ex.getMessage(), request.getRequestURI())
                .addDetail("rating", ex.getRating())
                .addDetail("min", InvalidRatingException.MIN_RATING)
                .addDetail("max", InvalidRatingException.MAX_RATING);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(
            ResourceNotFoundException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource not found: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.NOT_FOUND, "Not Found",
                ex.getMessage(), request.getRequestURI())
                .addDetail("resourceType", ex.getResourceType())
                .addDetail("resourceId", ex.getResourceId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(ResourceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(
            ResourceUnavailableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Resource unavailable: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Resource Unavailable",
                ex.getMessage(), request.getRequestURI())
                .addDetail("resourceType", ex.getResourceType().name())
                .addDetail("resourceId", ex.getResourceId())
                .addDetail("status", ex.getCurrentStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    /**
     * Returns 409 CONFLICT when stock or seats are short.
     */
    @ExceptionHandler(InsufficientCapacityException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientCapacity(
            InsufficientCapacityException ex,
            HttpServletRequest request
    ) {
        logger.warn("Insufficient capacity: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Insufficient Capacity",
                ex.getMessage(), request.getRequestURI())
                .addDetail("resourceType", ex.getResourceType().name())
                .addDetail("resourceId", ex.getResourceId())
                .addDetail("requestedQuantity", ex.getRequestedQuantity())
                .addDetail("availableQuantity", ex.getAvailableQuantity());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(AlreadyRegisteredException.class)
    public ResponseEntity<ErrorResponse> handleAlreadyRegistered(
            AlreadyRegisteredException ex,
            HttpServletRequest request
    ) {
        logger.warn("Already registered: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Already Registered",
                ex.getMessage(), request.getRequestURI())
                .addDetail("eventId", ex.getEventId())
                .addDetail("userId", ex.getUserId())
                .addDetail("registrationStatus", ex.getExistingStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(RegistrationNotOpenException.class)
    public ResponseEntity<ErrorResponse> handleRegistrationNotOpen(
            RegistrationNotOpenException ex,
            HttpServletRequest request
    ) {
        logger.warn("Registration not open: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Registration Not Open",
                ex.getMessage(), request.getRequestURI())
                .addDetail("eventId", ex.getEventId())
                .addDetail("eventStatus", ex.getEventStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ErrorResponse> handleInvalidTransition(
            InvalidTransitionException ex,
            HttpServletRequest request
    ) {
        logger.warn("Invalid transition: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Invalid Transition",
                ex.getMessage(), request.getRequestURI())
                .addDetail("resourceType", ex.getEntityType())
                .addDetail("resourceId", ex.getEntityId())
                .addDetail("from", ex.getFromState())
                .addDetail("to", ex.getToState());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(OrderNotCancellableException.class)
    public ResponseEntity<ErrorResponse> handleOrderNotCancellable(
            OrderNotCancellableException ex,
            HttpServletRequest request
    ) {
        logger.warn("Order not cancellable: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.CONFLICT, "Order Not Cancellable",
                ex.getMessage(), request.getRequestURI())
                .addDetail("orderId", ex.getOrderId())
                .addDetail("orderStatus", ex.getOrderStatus());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(ResourceAccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleResourceAccessDenied(
            ResourceAccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.FORBIDDEN, "Access Denied",
                ex.getMessage(), request.getRequestURI())
                .addDetail("resourceType", ex.getResourceType())
                .addDetail("resourceId", ex.getResourceId());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    /**
     * Spring Security denials from @PreAuthorize.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDenied(
            AccessDeniedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Access denied: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.FORBIDDEN, "Access Denied",
                ex.getMessage(), request.getRequestURI());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler(PaymentDeclinedException.class)
    public ResponseEntity<ErrorResponse> handlePaymentDeclined(
            PaymentDeclinedException ex,
            HttpServletRequest request
    ) {
        logger.warn("Payment declined: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.PAYMENT_REQUIRED, "Payment Declined",
                ex.getMessage(), request.getRequestURI())
                .addDetail("reference", ex.getReference())
                .addDetail("declineCode", ex.getDeclineCode());
        return ResponseEntity.status(HttpStatus.PAYMENT_REQUIRED).body(error);
    }

    /**
     * Returns 503 when lock conflicts outlasted the retry budget. Safe for the client to retry.
     */
    @ExceptionHandler(TransientConflictException.class)
    public ResponseEntity<ErrorResponse> handleTransientConflict(
            TransientConflictException ex,
            HttpServletRequest request
    ) {
        logger.error("Transient conflict: {}", ex.getMessage());

        ErrorResponse error = new ErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, "Transient Conflict",
                "The request conflicted with concurrent updates. Please retry.", request.getRequestURI())
                .addDetail("operation", ex.getOperation())
                .addDetail("attempts", ex.getAttempts());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    /**
     * Handle all other uncaught exceptions.
     * Returns 500 INTERNAL SERVER ERROR.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unexpected error: ", ex);

        ErrorResponse error = new ErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please try again later.", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
