package com.hkcraft.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable stock counter for a product. One row per product.
 * This row is the single source of truth for how many units can still be sold;
 * every change goes through a transaction holding a row lock on it.
 *
 * Status rules:
 * - quantity reaching 0 moves ACTIVE to OUT_OF_STOCK
 * - quantity rising above 0 moves OUT_OF_STOCK back to ACTIVE
 * - INACTIVE is only changed explicitly by the owner
 *
 * @author Craft Booking Team
 */
@Entity
@Table(name = "product_stock", indexes = {
    @Index(name = "idx_stock_product_unique", columnList = "product_id", unique = true),
    @Index(name = "idx_stock_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductStock implements CapacityResource {

    @Id
    @Column(name = "stock_id", nullable = false, length = 36)
    private String stockId;

    @Column(name = "product_id", nullable = false, unique = true, length = 36)
    private String productId;

    /**
     * Units currently available for new orders. Never negative.
     */
    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private StockStatus status;

    /**
     * Remaining quantity at or below which the craftsman is alerted.
     */
    @Column(name = "low_stock_threshold", nullable = false)
    @Builder.Default
    private Integer lowStockThreshold = 0;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (stockId == null) {
            stockId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (quantity == null) quantity = 0;
        if (lowStockThreshold == null) lowStockThreshold = 0;
        if (status == null) {
            status = quantity > 0 ? StockStatus.ACTIVE : StockStatus.OUT_OF_STOCK;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    @Override
    public ResourceType getResourceType() {
        return ResourceType.PRODUCT_STOCK;
    }

    @Override
    public String getResourceId() {
        return productId;
    }

    @Override
    public Integer getRemainingCapacity() {
        return quantity;
    }

    public boolean isActive() {
        return status == StockStatus.ACTIVE;
    }

    /**
     * True when the product was taken off sale. OUT_OF_STOCK is not withdrawn: it only
     * mirrors a zero quantity.
     */
    public boolean isWithdrawn() {
        return status == StockStatus.INACTIVE;
    }

    /**
     * Check whether the requested units can be taken right now.
     *
     * @param requested units requested
     * @return true if the row is ACTIVE and holds at least {@code requested} units
     */
    public boolean canReserve(int requested) {
        return isActive() && quantity >= requested;
    }

    /**
     * Take units out of stock. Callers must have checked {@link #canReserve(int)}
     * while holding the row lock.
     *
     * @param units units to take
     */
    public void reserve(int units) {
        if (units <= 0) {
            throw new IllegalArgumentException("Units to reserve must be positive: " + units);
        }
        if (quantity - units < 0) {
            throw new IllegalStateException(String.format(
                    "Stock for product %s would go negative: %d - %d", productId, quantity, units));
        }
        quantity = quantity - units;
        applyQuantityStatus();
    }

    /**
     * Put units back into stock.
     *
     * @param units units to restore
     */
    public void release(int units) {
        if (units <= 0) {
            throw new IllegalArgumentException("Units to release must be positive: " + units);
        }
        quantity = quantity + units;
        applyQuantityStatus();
    }

    /**
     * Overwrite the counter (restock or stock correction).
     *
     * @param newQuantity new absolute quantity, not negative
     */
    public void adjustTo(int newQuantity) {
        if (newQuantity < 0) {
            throw new IllegalArgumentException("Quantity cannot be negative: " + newQuantity);
        }
        quantity = newQuantity;
        applyQuantityStatus();
    }

    /**
     * Explicitly enable or disable sales. Re-enabling an empty row lands in OUT_OF_STOCK.
     *
     * @param active whether the product may be sold
     */
    public void setSellable(boolean active) {
        if (!active) {
            status = StockStatus.INACTIVE;
        } else {
            status = quantity > 0 ? StockStatus.ACTIVE : StockStatus.OUT_OF_STOCK;
        }
    }

    public boolean isLowStock() {
        return quantity <= lowStockThreshold;
    }

    private void applyQuantityStatus() {
        if (status == StockStatus.ACTIVE && quantity == 0) {
            status = StockStatus.OUT_OF_STOCK;
        } else if (status == StockStatus.OUT_OF_STOCK && quantity > 0) {
            status = StockStatus.ACTIVE;
        }
    }

    /**
     * Sales status of a product's stock.
     */
    public enum StockStatus {
        /**
         * Available for new orders.
         */
        ACTIVE,

        /**
         * Withdrawn from sale by its owner.
         */
        INACTIVE,

        /**
         * No units left.
         */
        OUT_OF_STOCK
    }
}
