package com.hkcraft.booking.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A claim applied to the stock ledger on behalf of an order.
 * Only ever produced by a fully successful reservation call.
 *
 * @author Craft Booking Team
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockReservation {

    private String productId;
    private int quantity;
    private String ownerOrderId;

    /**
     * Units left in the ledger right after this claim was applied.
     */
    private int remainingQuantity;

    /**
     * Whether the remaining quantity is at or below the product's alert threshold.
     */
    private boolean lowStock;
}
