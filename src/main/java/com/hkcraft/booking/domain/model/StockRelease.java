package com.hkcraft.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of a stock release that has already been applied.
 * Written in the same transaction as the release so that replaying the
 * same idempotency key never restores units twice.
 *
 * @author Craft Booking Team
 */
@Entity
@Table(name = "stock_releases", indexes = {
    @Index(name = "idx_release_key_unique", columnList = "idempotency_key", unique = true),
    @Index(name = "idx_release_product", columnList = "product_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockRelease {

    @Id
    @Column(name = "release_id", nullable = false, length = 36)
    private String releaseId;

    @Column(name = "idempotency_key", nullable = false, unique = true, length = 200)
    private String idempotencyKey;

    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "released_at", nullable = false, updatable = false)
    private Instant releasedAt;

    @PrePersist
    protected void onCreate() {
        if (releaseId == null) {
            releaseId = UUID.randomUUID().toString();
        }
        releasedAt = Instant.now();
    }
}
