package com.hkcraft.booking.infrastructure.payment;

import com.hkcraft.booking.domain.model.PaymentMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SimulatedPaymentGateway.
 *
 * @author Craft Booking Team
 */
@DisplayName("SimulatedPaymentGateway Unit Tests")
class SimulatedPaymentGatewayTest {

    @Test
    @DisplayName("charge - NoLimit: Should approve with a transaction id")
    void charge_NoLimit() {
        SimulatedPaymentGateway gateway = new SimulatedPaymentGateway(0, "");

        PaymentResult result = gateway.charge(new BigDecimal("99999.00"), PaymentMethod.OCTOPUS, "o-1");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTransactionId()).startsWith("SIM-");
    }

    @Test
    @DisplayName("charge - OverLimit: Should decline")
    void charge_OverLimit() {
        SimulatedPaymentGateway gateway = new SimulatedPaymentGateway(0, "500");

        PaymentResult declined = gateway.charge(new BigDecimal("500.01"), PaymentMethod.CREDIT_CARD, "o-1");
        PaymentResult approved = gateway.charge(new BigDecimal("500.00"), PaymentMethod.CREDIT_CARD, "o-2");

        assertThat(declined.isSuccess()).isFalse();
        assertThat(declined.getDeclineCode()).isEqualTo("LIMIT_EXCEEDED");
        assertThat(approved.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("refund - Any: Should succeed for the original transaction")
    void refund_Any() {
        SimulatedPaymentGateway gateway = new SimulatedPaymentGateway(0, null);

        PaymentResult result = gateway.refund("SIM-1234", new BigDecimal("10.00"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTransactionId()).isEqualTo("SIM-1234");
    }
}
