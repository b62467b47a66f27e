package com.hkcraft.booking.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A user's pre-checkout staging area.
 * Not linked to the stock ledger; quantities shown here are advisory.
 *
 * @author Craft Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Cart {

    private String userId;

    @Builder.Default
    private List<CartItem> items = new ArrayList<>();

    private Instant updatedAt;

    public static Cart empty(String userId) {
        return Cart.builder()
                .userId(userId)
                .items(new ArrayList<>())
                .updatedAt(Instant.now())
                .build();
    }

    public Optional<CartItem> findItem(String productId) {
        return items.stream()
                .filter(item -> item.getProductId().equals(productId))
                .findFirst();
    }

    public boolean removeItem(String productId) {
        return items.removeIf(item -> item.getProductId().equals(productId));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }

    public int totalQuantity() {
        return items.stream().mapToInt(CartItem::getQuantity).sum();
    }

    public void touch() {
        this.updatedAt = Instant.now();
    }

    /**
     * One product line in a cart.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CartItem {
        private String productId;
        private int quantity;
        private String notes;
        private Instant addedAt;
    }
}
