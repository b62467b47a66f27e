package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.PaymentMethod;
import com.hkcraft.booking.domain.model.ShippingAddress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to place and pay for an order in one call.
 * Either {@code items} is given or {@code fromCart} is set.
 *
 * @author Craft Booking Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutCommand {

    @Builder.Default
    private List<OrderLineRequest> items = new ArrayList<>();

    private boolean fromCart;

    private ShippingAddress shippingAddress;

    /**
     * Amount the client expects to pay. Must equal the order total exactly.
     */
    private BigDecimal paymentAmount;

    private PaymentMethod paymentMethod;
}
