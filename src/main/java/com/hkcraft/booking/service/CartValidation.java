package com.hkcraft.booking.service;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of checking a cart against current stock. One error per problem product.
 *
 * @author Craft Booking Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CartValidation {

    private boolean valid;
    private List<String> errors = new ArrayList<>();

    public static CartValidation of(List<String> errors) {
        return new CartValidation(errors.isEmpty(), errors);
    }
}
