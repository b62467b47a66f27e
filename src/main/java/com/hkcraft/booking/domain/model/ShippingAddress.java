package com.hkcraft.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Delivery address stored with an order.
 *
 * @author Craft Booking Team
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddress {

    @Column(name = "ship_recipient", length = 100)
    private String recipientName;

    @Column(name = "ship_phone", length = 30)
    private String phone;

    @Column(name = "ship_address_line", length = 255)
    private String addressLine;

    @Column(name = "ship_district", length = 100)
    private String district;

    @Column(name = "ship_city", length = 100)
    private String city;

    @Column(name = "ship_postal_code", length = 20)
    private String postalCode;

    @Column(name = "ship_country", length = 60)
    private String country;
}
