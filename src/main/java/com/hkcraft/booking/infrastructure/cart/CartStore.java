package com.hkcraft.booking.infrastructure.cart;

import com.hkcraft.booking.domain.model.Cart;

import java.util.Optional;

/**
 * Key-value storage for carts, one entry per user.
 *
 * @author Craft Booking Team
 */
public interface CartStore {

    Optional<Cart> get(String userId);

    void set(String userId, Cart cart);

    void clear(String userId);
}
