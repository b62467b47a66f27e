package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Registration;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A waitlisted registration with its 1-based position in promotion order.
 *
 * @author Craft Booking Team
 */
@Data
@AllArgsConstructor
public class WaitlistEntry {

    private int position;
    private Registration registration;
}
