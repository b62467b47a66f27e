package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.ReservationLine;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.domain.model.StockReservation;
import com.hkcraft.booking.exception.InsufficientCapacityException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import com.hkcraft.booking.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReservationService.
 *
 * @author Craft Booking Team
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ReservationService Unit Tests")
class ReservationServiceTest {

    @Mock
    private ResourceLedgerService ledgerService;

    @Mock
    private BookingMetricsService metricsService;

    @InjectMocks
    private ReservationService reservationService;

    // ========================================
    // reserveAll() Tests
    // ========================================

    @Test
    @DisplayName("reserveAll - UnorderedLines: Should lock products in ascending id order")
    void reserveAll_UnorderedLines() {
        // Given
        when(ledgerService.reserve("p-a", 1)).thenReturn(TestDataBuilder.stock("p-a", 4).build());
        when(ledgerService.reserve("p-b", 2)).thenReturn(TestDataBuilder.stock("p-b", 0).build());

        // When
        List<StockReservation> result = reservationService.reserveAll("o-1", List.of(
                new ReservationLine("p-b", 2),
                new ReservationLine("p-a", 1)));

        // Then
        InOrder inOrder = inOrder(ledgerService);
        inOrder.verify(ledgerService).reserve("p-a", 1);
        inOrder.verify(ledgerService).reserve("p-b", 2);

        assertThat(result).extracting(StockReservation::getProductId).containsExactly("p-a", "p-b");
        assertThat(result).allMatch(r -> r.getOwnerOrderId().equals("o-1"));
        assertThat(result.get(1).getRemainingQuantity()).isZero();
        assertThat(result.get(1).isLowStock()).isTrue();
        verify(metricsService).recordReservationSuccess(2);
    }

    @Test
    @DisplayName("reserveAll - DuplicateProduct: Should merge quantities into one reservation")
    void reserveAll_DuplicateProduct() {
        when(ledgerService.reserve("p-a", 5)).thenReturn(TestDataBuilder.stock("p-a", 1).build());

        List<StockReservation> result = reservationService.reserveAll("o-1", List.of(
                new ReservationLine("p-a", 2),
                new ReservationLine("p-a", 3)));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getQuantity()).isEqualTo(5);
        verify(ledgerService, times(1)).reserve(anyString(), anyInt());
    }

    @Test
    @DisplayName("reserveAll - SecondLineShort: Should propagate and stop processing")
    void reserveAll_SecondLineShort() {
        when(ledgerService.reserve("p-a", 1)).thenReturn(TestDataBuilder.stock("p-a", 4).build());
        when(ledgerService.reserve("p-b", 9)).thenThrow(
                new InsufficientCapacityException(ResourceType.PRODUCT_STOCK, "p-b", 9, 8));

        assertThatThrownBy(() -> reservationService.reserveAll("o-1", List.of(
                new ReservationLine("p-a", 1),
                new ReservationLine("p-b", 9),
                new ReservationLine("p-c", 1))))
                .isInstanceOf(InsufficientCapacityException.class);

        verify(ledgerService, never()).reserve(eq("p-c"), anyInt());
        verify(metricsService).recordReservationFailure("INSUFFICIENT_CAPACITY");
        verify(metricsService, never()).recordReservationSuccess(anyInt());
    }

    @Test
    @DisplayName("reserveAll - EmptyLines: Should fail validation")
    void reserveAll_EmptyLines() {
        assertThatThrownBy(() -> reservationService.reserveAll("o-1", Collections.emptyList()))
                .isInstanceOf(ValidationFailedException.class);
        verifyNoInteractions(ledgerService);
    }

    @Test
    @DisplayName("reserveAll - NegativeQuantity: Should fail validation before any reserve")
    void reserveAll_NegativeQuantity() {
        assertThatThrownBy(() -> reservationService.reserveAll("o-1", List.of(
                new ReservationLine("p-a", 1),
                new ReservationLine("p-b", -1))))
                .isInstanceOf(ValidationFailedException.class);
        verifyNoInteractions(ledgerService);
    }

    // ========================================
    // releaseAll() Tests
    // ========================================

    @Test
    @DisplayName("releaseAll - PerProductKeys: Should use order-scoped idempotency keys")
    void releaseAll_PerProductKeys() {
        when(ledgerService.release("p-a", 1, "order:o-1:p-a")).thenReturn(true);
        when(ledgerService.release("p-b", 2, "order:o-1:p-b")).thenReturn(false);

        int restored = reservationService.releaseAll("o-1", List.of(
                new ReservationLine("p-a", 1),
                new ReservationLine("p-b", 2)));

        assertThat(restored).isEqualTo(1);
    }

    @Test
    @DisplayName("releaseKey - Format: Should combine order and product ids")
    void releaseKey_Format() {
        assertThat(ReservationService.releaseKey("o-9", "p-3")).isEqualTo("order:o-9:p-3");
    }
}
