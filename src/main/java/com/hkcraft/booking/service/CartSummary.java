package com.hkcraft.booking.service;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cart priced and checked against current product data. Advisory only.
 *
 * @author Craft Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartSummary {

    private String userId;

    @Builder.Default
    private List<Line> lines = new ArrayList<>();

    private int totalItems;
    private BigDecimal totalAmount;
    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Line {
        private String productId;

        /**
         * Null when the product no longer exists.
         */
        private String productName;
        private BigDecimal unitPrice;
        private int quantity;
        private BigDecimal lineTotal;
        private int availableQuantity;
        private boolean available;
        private String notes;
    }
}
