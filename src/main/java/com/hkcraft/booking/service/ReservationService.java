package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.ProductStock;
import com.hkcraft.booking.domain.model.ReservationLine;
import com.hkcraft.booking.domain.model.StockReservation;
import com.hkcraft.booking.exception.InsufficientCapacityException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ResourceUnavailableException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * All-or-nothing stock reservation for multi-line orders.
 *
 * Lines are merged per product and applied in ascending product id order, so two
 * orders touching the same products always lock rows in the same sequence and
 * cannot deadlock. A failure on any line throws out of the enclosing transaction,
 * which rolls back every decrement already made for the call.
 *
 * @author Craft Booking Team
 */
@Service
public class ReservationService {

    private static final Logger logger = LoggerFactory.getLogger(ReservationService.class);

    private final ResourceLedgerService ledgerService;
    private final BookingMetricsService metricsService;

    public ReservationService(ResourceLedgerService ledgerService, BookingMetricsService metricsService) {
        this.ledgerService = ledgerService;
        this.metricsService = metricsService;
    }

    /**
     * Reserve every line for an order, or none of them.
     *
     * @param ownerOrderId order the units are taken for
     * @param lines        requested lines; the same product may appear more than once
     * @return one reservation per distinct product, in lock order
     * @throws ResourceNotFoundException     if a product has no stock row
     * @throws ResourceUnavailableException  if a product is not ACTIVE
     * @throws InsufficientCapacityException if a product has too few units
     */
    @Transactional
    public List<StockReservation> reserveAll(String ownerOrderId, List<ReservationLine> lines) {
        Map<String, Integer> merged = mergeLines(lines);
        List<StockReservation> reservations = new ArrayList<>(merged.size());

        try {
            for (Map.Entry<String, Integer> line : merged.entrySet()) {
                ProductStock stock = ledgerService.reserve(line.getKey(), line.getValue());
                reservations.add(new StockReservation(
                        line.getKey(),
                        line.getValue(),
                        ownerOrderId,
                        stock.getQuantity(),
                        stock.isLowStock()
                ));
            }
        } catch (ResourceNotFoundException e) {
            metricsService.recordReservationFailure("NOT_FOUND");
            throw e;
        } catch (ResourceUnavailableException e) {
            metricsService.recordReservationFailure("UNAVAILABLE");
            throw e;
        } catch (InsufficientCapacityException e) {
            metricsService.recordReservationFailure("INSUFFICIENT_CAPACITY");
            throw e;
        }

        metricsService.recordReservationSuccess(reservations.size());
        logger.info("Reserved {} product lines for order {}", reservations.size(), ownerOrderId);
        return reservations;
    }

    /**
     * Restore every line of an order. Each product is released under the key
     * {@code order:{orderId}:{productId}}, so repeating the call restores nothing twice.
     *
     * @param ownerOrderId order whose units are returned
     * @param lines        lines to restore
     * @return number of products whose units were actually restored
     */
    @Transactional
    public int releaseAll(String ownerOrderId, List<ReservationLine> lines) {
        Map<String, Integer> merged = mergeLines(lines);
        int restored = 0;

        for (Map.Entry<String, Integer> line : merged.entrySet()) {
            if (ledgerService.release(line.getKey(), line.getValue(), releaseKey(ownerOrderId, line.getKey()))) {
                restored++;
            }
        }

        logger.info("Released {} of {} product lines for order {}", restored, merged.size(), ownerOrderId);
        return restored;
    }

    static String releaseKey(String orderId, String productId) {
        return "order:" + orderId + ":" + productId;
    }

    private static Map<String, Integer> mergeLines(List<ReservationLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new ValidationFailedException("At least one line is required");
        }

        // TreeMap gives the ascending lock order
        Map<String, Integer> merged = new TreeMap<>();
        for (ReservationLine line : lines) {
            if (line.getProductId() == null || line.getProductId().isBlank()) {
                throw new ValidationFailedException("Product id is required on every line");
            }
            if (line.getQuantity() <= 0) {
                throw new ValidationFailedException(
                        "Quantity must be positive for product " + line.getProductId(),
                        Map.of("quantity", "must be greater than 0"));
            }
            merged.merge(line.getProductId(), line.getQuantity(), Integer::sum);
        }
        return merged;
    }
}
