package com.hkcraft.booking.domain.model;

import com.hkcraft.booking.domain.model.ProductStock.StockStatus;
import com.hkcraft.booking.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ProductStock quantity and status rules.
 *
 * @author Craft Booking Team
 */
@DisplayName("ProductStock Unit Tests")
class ProductStockTest {

    // ========================================
    // reserve() Tests
    // ========================================

    @Test
    @DisplayName("reserve - PartialQuantity: Should decrement and stay ACTIVE")
    void reserve_PartialQuantity() {
        ProductStock stock = TestDataBuilder.stock("p-1", 10).build();

        stock.reserve(2);

        assertThat(stock.getQuantity()).isEqualTo(8);
        assertThat(stock.getStatus()).isEqualTo(StockStatus.ACTIVE);
    }

    @Test
    @DisplayName("reserve - LastUnits: Should move to OUT_OF_STOCK")
    void reserve_LastUnits() {
        ProductStock stock = TestDataBuilder.stock("p-1", 3).build();

        stock.reserve(3);

        assertThat(stock.getQuantity()).isZero();
        assertThat(stock.getStatus()).isEqualTo(StockStatus.OUT_OF_STOCK);
        assertThat(stock.canReserve(1)).isFalse();
    }

    @Test
    @DisplayName("reserve - MoreThanAvailable: Should refuse and leave quantity untouched")
    void reserve_MoreThanAvailable() {
        ProductStock stock = TestDataBuilder.stock("p-1", 2).build();

        assertThatThrownBy(() -> stock.reserve(3))
                .isInstanceOf(IllegalStateException.class);
        assertThat(stock.getQuantity()).isEqualTo(2);
    }

    @Test
    @DisplayName("reserve - NonPositive: Should reject zero units")
    void reserve_NonPositive() {
        ProductStock stock = TestDataBuilder.stock("p-1", 2).build();

        assertThatThrownBy(() -> stock.reserve(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ========================================
    // release() / adjustTo() Tests
    // ========================================

    @Test
    @DisplayName("release - FromOutOfStock: Should return to ACTIVE")
    void release_FromOutOfStock() {
        ProductStock stock = TestDataBuilder.stock("p-1", 0).build();

        stock.release(2);

        assertThat(stock.getQuantity()).isEqualTo(2);
        assertThat(stock.getStatus()).isEqualTo(StockStatus.ACTIVE);
    }

    @Test
    @DisplayName("release - Inactive: Should restore units but stay INACTIVE")
    void release_Inactive() {
        ProductStock stock = TestDataBuilder.stock("p-1", 0).status(StockStatus.INACTIVE).build();

        stock.release(4);

        assertThat(stock.getQuantity()).isEqualTo(4);
        assertThat(stock.getStatus()).isEqualTo(StockStatus.INACTIVE);
        assertThat(stock.canReserve(1)).isFalse();
    }

    @Test
    @DisplayName("adjustTo - Negative: Should be rejected")
    void adjustTo_Negative() {
        ProductStock stock = TestDataBuilder.stock("p-1", 5).build();

        assertThatThrownBy(() -> stock.adjustTo(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(stock.getQuantity()).isEqualTo(5);
    }

    @Test
    @DisplayName("adjustTo - Zero: Should move ACTIVE to OUT_OF_STOCK")
    void adjustTo_Zero() {
        ProductStock stock = TestDataBuilder.stock("p-1", 5).build();

        stock.adjustTo(0);

        assertThat(stock.getStatus()).isEqualTo(StockStatus.OUT_OF_STOCK);
    }

    // ========================================
    // setSellable() Tests
    // ========================================

    @Test
    @DisplayName("setSellable - ReenableEmpty: Should land in OUT_OF_STOCK")
    void setSellable_ReenableEmpty() {
        ProductStock stock = TestDataBuilder.stock("p-1", 0).status(StockStatus.INACTIVE).build();

        stock.setSellable(true);

        assertThat(stock.getStatus()).isEqualTo(StockStatus.OUT_OF_STOCK);
        assertThat(stock.isWithdrawn()).isFalse();
    }

    @Test
    @DisplayName("setSellable - Disable: Should be withdrawn regardless of quantity")
    void setSellable_Disable() {
        ProductStock stock = TestDataBuilder.stock("p-1", 4).build();

        stock.setSellable(false);

        assertThat(stock.isWithdrawn()).isTrue();
        assertThat(stock.canReserve(1)).isFalse();
    }

    @Test
    @DisplayName("isLowStock - AtThreshold: Should report low stock")
    void isLowStock_AtThreshold() {
        ProductStock stock = TestDataBuilder.stock("p-1", 3).lowStockThreshold(3).build();

        assertThat(stock.isLowStock()).isTrue();
        stock.release(1);
        assertThat(stock.isLowStock()).isFalse();
    }
}
