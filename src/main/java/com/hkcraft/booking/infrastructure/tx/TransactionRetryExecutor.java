package com.hkcraft.booking.infrastructure.tx;

import com.hkcraft.booking.exception.TransientConflictException;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction and re-runs the whole unit when the
 * database reports a lock or serialization conflict.
 *
 * Each attempt starts a fresh transaction, so capacity checks are re-evaluated
 * against current data rather than trusted from the failed attempt. Business
 * rejections are rethrown immediately. When the budget runs out the last conflict
 * surfaces as {@link TransientConflictException}.
 *
 * Callers must not already be inside a transaction, or the retry would join it.
 *
 * @author Craft Booking Team
 */
@Component
public class TransactionRetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TransactionRetryExecutor.class);

    private final TransactionTemplate transactionTemplate;
    private final RetryRegistry retryRegistry;
    private final BookingMetricsService metricsService;
    private final int maxAttempts;

    public TransactionRetryExecutor(
            PlatformTransactionManager transactionManager,
            BookingMetricsService metricsService,
            @Value("${craft.tx.retry.max-attempts:3}") int maxAttempts,
            @Value("${craft.tx.retry.initial-backoff-ms:50}") long initialBackoffMs,
            @Value("${craft.tx.retry.backoff-multiplier:2.0}") double backoffMultiplier
    ) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.metricsService = metricsService;
        this.maxAttempts = maxAttempts;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoffMs, backoffMultiplier))
                .retryExceptions(TransientDataAccessException.class)
                .build();
        this.retryRegistry = RetryRegistry.of(config);
        this.retryRegistry.getEventPublisher().onEntryAdded(added -> {
            Retry retry = added.getAddedEntry();
            retry.getEventPublisher().onRetry(event -> {
                logger.warn("Retrying {} (attempt {}) after conflict: {}",
                        retry.getName(), event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() == null ? "n/a" : event.getLastThrowable().getMessage());
                metricsService.recordTransactionRetry(retry.getName());
            });
        });
    }

    /**
     * Execute {@code work} in a transaction, retrying on transient conflicts.
     *
     * @param operation name used for logs, metrics and the retry instance
     * @param work      unit of work; must be safe to run again from scratch
     * @return the unit's result
     * @throws TransientConflictException when every attempt hit a conflict
     */
    public <T> T execute(String operation, Supplier<T> work) {
        Retry retry = retryRegistry.retry(operation);
        Supplier<T> transactional = () -> transactionTemplate.execute(status -> work.get());

        try {
            return Retry.decorateSupplier(retry, transactional).get();
        } catch (TransientDataAccessException e) {
            logger.error("Operation {} failed after {} attempts", operation, maxAttempts, e);
            metricsService.recordTransactionExhausted(operation);
            throw new TransientConflictException(operation, maxAttempts, e);
        }
    }

    /**
     * Variant for units without a result.
     */
    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }
}
