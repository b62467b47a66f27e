package com.hkcraft.booking.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer metrics for the booking engine.
 * Backed by CloudWatch when enabled, otherwise by the actuator registry.
 *
 * Key Metrics:
 * - Stock reservation outcomes and releases
 * - Order creation, cancellation and payment declines
 * - Registration outcomes and waitlist promotions
 * - Transaction retries and exhausted retry budgets
 * - Notification delivery failures
 *
 * @author Craft Booking Team
 */
@Service
public class BookingMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(BookingMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "craftbooking.";
    private static final String STOCK_PREFIX = METRIC_PREFIX + "stock.";
    private static final String ORDER_PREFIX = METRIC_PREFIX + "order.";
    private static final String REGISTRATION_PREFIX = METRIC_PREFIX + "registration.";
    private static final String TX_PREFIX = METRIC_PREFIX + "tx.";

    public BookingMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a successful multi-line stock reservation.
     *
     * @param lineCount number of distinct products reserved
     */
    public void recordReservationSuccess(int lineCount) {
        Counter.builder(STOCK_PREFIX + "reservation.success")
                .description("Successful all-or-nothing stock reservations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded reservation success over {} lines", lineCount);
    }

    /**
     * Record a rejected stock reservation.
     *
     * @param reason e.g. "INSUFFICIENT_CAPACITY", "UNAVAILABLE", "NOT_FOUND"
     */
    public void recordReservationFailure(String reason) {
        Counter.builder(STOCK_PREFIX + "reservation.failure")
                .tag("reason", reason)
                .description("Rejected stock reservations")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded reservation failure, reason: {}", reason);
    }

    public void recordStockRelease(boolean applied) {
        Counter.builder(STOCK_PREFIX + "release")
                .tag("outcome", applied ? "applied" : "duplicate")
                .description("Stock releases by outcome")
                .register(meterRegistry)
                .increment();
    }

    public void recordStockOut(String productId) {
        Counter.builder(STOCK_PREFIX + "out")
                .tag("product_id", productId)
                .description("Products that reached zero stock")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded stock out for product: {}", productId);
    }

    public void recordOrderCreated() {
        Counter.builder(ORDER_PREFIX + "created")
                .description("Orders created")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an order that could not be created.
     *
     * @param reason rejection reason
     */
    public void recordOrderFailure(String reason) {
        Counter.builder(ORDER_PREFIX + "failure")
                .tag("reason", reason)
                .description("Order creation failures")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded order failure, reason: {}", reason);
    }

    public void recordOrderCancelled(String initiator) {
        Counter.builder(ORDER_PREFIX + "cancelled")
                .tag("initiator", initiator)
                .description("Cancelled orders")
                .register(meterRegistry)
                .increment();
    }

    public void recordPaymentDeclined(String flow) {
        Counter.builder(METRIC_PREFIX + "payment.declined")
                .tag("flow", flow)
                .description("Declined payments")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded payment decline in flow: {}", flow);
    }

    /**
     * Record checkout latency from request to paid (or declined) order.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordCheckoutLatency(long durationMs) {
        Timer.builder(ORDER_PREFIX + "checkout.latency")
                .description("Checkout latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a new registration.
     *
     * @param status CONFIRMED or WAITLISTED
     */
    public void recordRegistration(String status) {
        Counter.builder(REGISTRATION_PREFIX + "created")
                .tag("status", status)
                .description("Registrations by initial status")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded registration with status: {}", status);
    }

    public void recordRegistrationCancelled(boolean promoted) {
        Counter.builder(REGISTRATION_PREFIX + "cancelled")
                .tag("promoted", String.valueOf(promoted))
                .description("Registration cancellations and whether a waitlisted user was promoted")
                .register(meterRegistry)
                .increment();
    }

    public void recordTransactionRetry(String operation) {
        Counter.builder(TX_PREFIX + "retry")
                .tag("operation", operation)
                .description("Transaction retries after lock or serialization conflicts")
                .register(meterRegistry)
                .increment();
    }

    public void recordTransactionExhausted(String operation) {
        Counter.builder(TX_PREFIX + "exhausted")
                .tag("operation", operation)
                .description("Transactions that ran out of retries")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded exhausted retries for operation: {}", operation);
    }

    public void recordNotificationFailure(String type) {
        Counter.builder(METRIC_PREFIX + "notification.failure")
                .tag("type", type)
                .description("Notifications that could not be handed off")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}
