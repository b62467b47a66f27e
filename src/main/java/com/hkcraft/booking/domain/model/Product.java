package com.hkcraft.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A handmade product listed by a craftsman.
 * Sellable units are not kept here; see {@link ProductStock}.
 *
 * @author Craft Booking Team
 */
@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_product_craftsman", columnList = "craftsman_id"),
    @Index(name = "idx_product_category", columnList = "category")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @Column(name = "product_id", nullable = false, length = 36)
    private String productId;

    /**
     * User id of the craftsman who owns the listing.
     */
    @Column(name = "craftsman_id", nullable = false, length = 36)
    private String craftsmanId;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "category", length = 100)
    private String category;

    /**
     * Current list price. Orders copy it into their line items.
     */
    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (productId == null) {
            productId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
