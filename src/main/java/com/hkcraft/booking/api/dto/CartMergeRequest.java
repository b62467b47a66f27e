package com.hkcraft.booking.api.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Guest cart lines to merge into the signed-in user's cart.
 *
 * @author Craft Booking Team
 */
public class CartMergeRequest {

    private List<CartItemRequest> items = new ArrayList<>();

    public CartMergeRequest() {
    }

    // Getters and setters
    public List<CartItemRequest> getItems() {
        return items;
    }

    public void setItems(List<CartItemRequest> items) {
        this.items = items;
    }
}
