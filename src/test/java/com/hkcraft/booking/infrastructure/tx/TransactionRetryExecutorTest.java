package com.hkcraft.booking.infrastructure.tx;

import com.hkcraft.booking.exception.InsufficientCapacityException;
import com.hkcraft.booking.exception.TransientConflictException;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TransactionRetryExecutor.
 *
 * @author Craft Booking Team
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TransactionRetryExecutor Unit Tests")
class TransactionRetryExecutorTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private TransactionRetryExecutor executor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(transactionManager.getTransaction(any(TransactionDefinition.class)))
                .thenAnswer(inv -> new SimpleTransactionStatus());
        executor = new TransactionRetryExecutor(transactionManager,
                new BookingMetricsService(meterRegistry), 3, 1, 1.0);
    }

    @Test
    @DisplayName("execute - ConflictThenSuccess: Should retry in a fresh transaction")
    void execute_ConflictThenSuccess() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        String result = executor.execute("order.create", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("lock timeout");
            }
            return "ok";
        });

        // Then
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        verify(transactionManager, times(3)).getTransaction(any(TransactionDefinition.class));
        verify(transactionManager, times(2)).rollback(any());
        verify(transactionManager, times(1)).commit(any());
        assertThat(meterRegistry.get("craftbooking.tx.retry").tag("operation", "order.create")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("execute - ConflictEveryTime: Should give up with a transient conflict")
    void execute_ConflictEveryTime() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("event.register", () -> {
            calls.incrementAndGet();
            throw new CannotAcquireLockException("lock timeout");
        }))
                .isInstanceOf(TransientConflictException.class)
                .hasCauseInstanceOf(CannotAcquireLockException.class)
                .satisfies(e -> assertThat(((TransientConflictException) e).getAttempts()).isEqualTo(3));

        assertThat(calls).hasValue(3);
        assertThat(meterRegistry.get("craftbooking.tx.exhausted").tag("operation", "event.register")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("execute - BusinessRejection: Should not retry")
    void execute_BusinessRejection() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.execute("order.create", () -> {
            calls.incrementAndGet();
            throw new InsufficientCapacityException(ResourceType.PRODUCT_STOCK, "p-1", 9, 8);
        })).isInstanceOf(InsufficientCapacityException.class);

        assertThat(calls).hasValue(1);
        verify(transactionManager).rollback(any());
        verify(transactionManager, never()).commit(any());
    }

    @Test
    @DisplayName("run - NoResult: Should commit once")
    void run_NoResult() {
        AtomicInteger calls = new AtomicInteger();

        executor.run("order.status", calls::incrementAndGet);

        assertThat(calls).hasValue(1);
        verify(transactionManager).commit(any());
    }
}
