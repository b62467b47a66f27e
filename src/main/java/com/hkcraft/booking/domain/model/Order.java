package com.hkcraft.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * An order for one or more products.
 * Stock for every line is reserved in the same transaction that inserts the order,
 * so an order row exists only if all of its units were taken from the ledger.
 *
 * @author Craft Booking Team
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_order_user", columnList = "user_id"),
    @Index(name = "idx_order_status", columnList = "status"),
    @Index(name = "idx_order_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {

    @Id
    @Column(name = "order_id", nullable = false, length = 36)
    private String orderId;

    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_status", nullable = false, length = 20)
    private PaymentStatus paymentStatus;

    /**
     * Sum of unit price times quantity over all items.
     */
    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Embedded
    private ShippingAddress shippingAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", length = 30)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_transaction_id", length = 100)
    private String paymentTransactionId;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("productId ASC")
    @Builder.Default
    private List<OrderItem> items = new ArrayList<>();

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "paid_at")
    private Instant paidAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @PrePersist
    protected void onCreate() {
        if (orderId == null) {
            orderId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();

        if (status == null) status = OrderStatus.PENDING;
        if (paymentStatus == null) paymentStatus = PaymentStatus.PENDING;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Attach a line item and keep the back reference in sync.
     */
    public void addItem(OrderItem item) {
        if (items == null) {
            items = new ArrayList<>();
        }
        item.setOrder(this);
        items.add(item);
    }

    /**
     * Recompute the total from the item snapshots.
     *
     * @return the new total
     */
    public BigDecimal recalculateTotal() {
        BigDecimal total = BigDecimal.ZERO;
        for (OrderItem item : items) {
            total = total.add(item.lineTotal());
        }
        this.totalAmount = total;
        return total;
    }

    /**
     * Orders can be cancelled until they are delivered or already cancelled.
     */
    public boolean isCancellable() {
        return status != OrderStatus.DELIVERED && status != OrderStatus.CANCELLED;
    }

    public boolean isOwnedBy(String userId) {
        return this.userId != null && this.userId.equals(userId);
    }

    /**
     * Cancel the order. A completed payment turns into a refund, anything else is marked failed.
     *
     * @param reason cancellation reason
     */
    public void cancel(String reason) {
        this.paymentStatus = paymentStatus == PaymentStatus.COMPLETED
                ? PaymentStatus.REFUNDED
                : PaymentStatus.FAILED;
        this.status = OrderStatus.CANCELLED;
        this.cancellationReason = reason;
        this.cancelledAt = Instant.now();
    }

    /**
     * Record a successful charge.
     *
     * @param transactionId gateway transaction id
     * @param method        method charged
     */
    public void completePayment(String transactionId, PaymentMethod method) {
        this.status = OrderStatus.CONFIRMED;
        this.paymentStatus = PaymentStatus.COMPLETED;
        this.paymentTransactionId = transactionId;
        this.paymentMethod = method;
        this.paidAt = Instant.now();
    }

    /**
     * Order status enum.
     */
    public enum OrderStatus {
        PENDING,
        CONFIRMED,
        PROCESSING,
        SHIPPED,
        DELIVERED,
        CANCELLED;

        /**
         * Forward fulfilment steps: CONFIRMED, PROCESSING, SHIPPED, DELIVERED.
         */
        public boolean canAdvanceTo(OrderStatus next) {
            switch (this) {
                case CONFIRMED:
                    return next == PROCESSING;
                case PROCESSING:
                    return next == SHIPPED;
                case SHIPPED:
                    return next == DELIVERED;
                default:
                    return false;
            }
        }
    }

    /**
     * Payment status enum.
     */
    public enum PaymentStatus {
        PENDING,
        COMPLETED,
        FAILED,
        REFUNDED
    }
}
