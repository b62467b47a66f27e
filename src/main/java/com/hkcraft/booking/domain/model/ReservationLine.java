package com.hkcraft.booking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A requested claim of {@code quantity} units of one product.
 *
 * @author Craft Booking Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReservationLine {

    private String productId;
    private int quantity;
}
