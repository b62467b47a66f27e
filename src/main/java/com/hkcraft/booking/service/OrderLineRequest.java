package com.hkcraft.booking.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One requested order line.
 *
 * @author Craft Booking Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderLineRequest {

    private String productId;
    private int quantity;
    private String customizationNotes;

    public OrderLineRequest(String productId, int quantity) {
        this(productId, quantity, null);
    }
}
