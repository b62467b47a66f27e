package com.hkcraft.booking.infrastructure.payment;

import com.hkcraft.booking.domain.model.PaymentMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Stand-in gateway for development and tests. Never moves money.
 *
 * Configuration:
 * - craft.payment.simulated.delay-ms: artificial latency per call (default 0)
 * - craft.payment.simulated.decline-over: charges above this amount are declined (default: never)
 *
 * @author Craft Booking Team
 */
@Component
public class SimulatedPaymentGateway implements PaymentGateway {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedPaymentGateway.class);

    private final long delayMs;
    private final BigDecimal declineOver;

    public SimulatedPaymentGateway(
            @Value("${craft.payment.simulated.delay-ms:0}") long delayMs,
            @Value("${craft.payment.simulated.decline-over:}") String declineOver
    ) {
        this.delayMs = delayMs;
        this.declineOver = declineOver == null || declineOver.isBlank() ? null : new BigDecimal(declineOver);
    }

    @Override
    public PaymentResult charge(BigDecimal amount, PaymentMethod method, String reference) {
        logger.info("Simulated charge - reference: {}, amount: {}, method: {}", reference, amount, method);
        simulateDelay();

        if (declineOver != null && amount.compareTo(declineOver) > 0) {
            logger.warn("Simulated charge declined - reference: {}, amount {} exceeds limit {}",
                    reference, amount, declineOver);
            return PaymentResult.declined("LIMIT_EXCEEDED", "Amount exceeds simulated card limit");
        }

        String transactionId = "SIM-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
        logger.info("Simulated charge approved - reference: {}, transaction: {}", reference, transactionId);
        return PaymentResult.success(transactionId);
    }

    @Override
    public PaymentResult refund(String transactionId, BigDecimal amount) {
        logger.info("Simulated refund - transaction: {}, amount: {}", transactionId, amount);
        simulateDelay();
        return PaymentResult.success(transactionId);
    }

    private void simulateDelay() {
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
