package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.Product;
import com.hkcraft.booking.domain.model.ProductStock;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.domain.model.StockRelease;
import com.hkcraft.booking.exception.InsufficientCapacityException;
import com.hkcraft.booking.exception.ResourceAccessDeniedException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ResourceUnavailableException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import com.hkcraft.booking.repository.ProductRepository;
import com.hkcraft.booking.repository.ProductStockRepository;
import com.hkcraft.booking.repository.StockReleaseRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Authoritative stock counters for products.
 *
 * Every mutation re-reads the {@link ProductStock} row under a pessimistic write lock
 * and applies the change in the caller's transaction, so two concurrent reservations
 * for the same product serialize on the row and can never drive the quantity below zero.
 *
 * Status follows quantity automatically (ACTIVE at zero becomes OUT_OF_STOCK and back),
 * except for INACTIVE which only {@link #setActive} changes.
 *
 * @author Craft Booking Team
 */
@Service
public class ResourceLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(ResourceLedgerService.class);

    private final ProductStockRepository stockRepository;
    private final StockReleaseRepository releaseRepository;
    private final ProductRepository productRepository;
    private final BookingMetricsService metricsService;

    public ResourceLedgerService(
            ProductStockRepository stockRepository,
            StockReleaseRepository releaseRepository,
            ProductRepository productRepository,
            BookingMetricsService metricsService
    ) {
        this.stockRepository = stockRepository;
        this.releaseRepository = releaseRepository;
        this.productRepository = productRepository;
        this.metricsService = metricsService;
    }

    /**
     * Take {@code quantity} units of a product.
     *
     * Checks run in this order: row exists, row is not INACTIVE, enough units remain.
     * A sold-out row fails the quantity check, not the status check.
     *
     * @param productId product to reserve
     * @param quantity  units, must be positive
     * @return the stock row after the decrement
     * @throws ResourceNotFoundException     if the product has no stock row
     * @throws ResourceUnavailableException  if the product is INACTIVE
     * @throws InsufficientCapacityException if fewer than {@code quantity} units remain
     */
    @Transactional
    public ProductStock reserve(String productId, int quantity) {
        requirePositive(quantity);

        ProductStock stock = stockRepository.findByProductIdWithLock(productId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.PRODUCT_STOCK, productId));

        if (stock.isWithdrawn()) {
            logger.warn("Product {} is not available for reservation, status: {}", productId, stock.getStatus());
            throw new ResourceUnavailableException(ResourceType.PRODUCT_STOCK, productId, stock.getStatus().name());
        }

        if (stock.getQuantity() - quantity < 0) {
            logger.warn("Insufficient stock for product {}: requested {}, available {}",
                    productId, quantity, stock.getQuantity());
            throw new InsufficientCapacityException(
                    ResourceType.PRODUCT_STOCK, productId, quantity, stock.getQuantity());
        }

        stock.reserve(quantity);
        stock = stockRepository.save(stock);

        if (stock.getStatus() == ProductStock.StockStatus.OUT_OF_STOCK) {
            logger.info("Product {} is now out of stock", productId);
            metricsService.recordStockOut(productId);
        }

        logger.debug("Reserved {} units of {}, remaining {}", quantity, productId, stock.getQuantity());
        return stock;
    }

    /**
     * Put units back. A key that was already used makes the call a no-op, so retried
     * cancellations or compensations never restore the same units twice.
     *
     * @param productId      product to restore
     * @param quantity       units, must be positive
     * @param idempotencyKey unique key for this release
     * @return true if units were restored, false for a repeated key
     */
    @Transactional
    public boolean release(String productId, int quantity, String idempotencyKey) {
        requirePositive(quantity);
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationFailedException("Release requires an idempotency key");
        }

        // Lock first so two releases with the same key serialize before the key check
        ProductStock stock = stockRepository.findByProductIdWithLock(productId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.PRODUCT_STOCK, productId));

        if (releaseRepository.existsByIdempotencyKey(idempotencyKey)) {
            logger.info("Release {} already applied, skipping", idempotencyKey);
            metricsService.recordStockRelease(false);
            return false;
        }

        stock.release(quantity);
        stockRepository.save(stock);

        releaseRepository.save(StockRelease.builder()
                .idempotencyKey(idempotencyKey)
                .productId(productId)
                .quantity(quantity)
                .build());

        metricsService.recordStockRelease(true);
        logger.info("Released {} units of {} ({}), now {} {}",
                quantity, productId, idempotencyKey, stock.getQuantity(), stock.getStatus());
        return true;
    }

    /**
     * Overwrite the stock level, for restocking or corrections.
     *
     * @param productId   product
     * @param newQuantity new absolute quantity
     * @param actor       the product's craftsman or an admin
     * @return updated row
     */
    @Transactional
    public ProductStock adjustQuantity(String productId, int newQuantity, Actor actor) {
        if (newQuantity < 0) {
            throw new ValidationFailedException("Quantity cannot be negative",
                    Map.of("quantity", "must be zero or greater"));
        }
        verifyOwner(productId, actor);

        ProductStock stock = stockRepository.findByProductIdWithLock(productId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.PRODUCT_STOCK, productId));

        int previous = stock.getQuantity();
        stock.adjustTo(newQuantity);
        stock = stockRepository.save(stock);

        logger.info("Stock for {} adjusted from {} to {} by {}, status {}",
                productId, previous, newQuantity, actor, stock.getStatus());
        return stock;
    }

    /**
     * Withdraw a product from sale or put it back.
     *
     * @param productId product
     * @param active    true to sell again, false for INACTIVE
     * @param actor     the product's craftsman or an admin
     * @return updated row
     */
    @Transactional
    public ProductStock setActive(String productId, boolean active, Actor actor) {
        verifyOwner(productId, actor);

        ProductStock stock = stockRepository.findByProductIdWithLock(productId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.PRODUCT_STOCK, productId));

        stock.setSellable(active);
        stock = stockRepository.save(stock);

        logger.info("Product {} set {} by {}, status {}", productId, active ? "active" : "inactive",
                actor, stock.getStatus());
        return stock;
    }

    /**
     * Current stock row without locking. Advisory only.
     */
    @Transactional(readOnly = true)
    public ProductStock getSnapshot(String productId) {
        return stockRepository.findByProductId(productId)
                .orElseThrow(() -> new ResourceNotFoundException(ResourceType.PRODUCT_STOCK, productId));
    }

    /**
     * Current stock rows for several products, keyed by product id. Missing products are absent.
     */
    @Transactional(readOnly = true)
    public Map<String, ProductStock> getSnapshots(Collection<String> productIds) {
        return stockRepository.findByProductIdIn(productIds).stream()
                .collect(Collectors.toMap(ProductStock::getProductId, Function.identity()));
    }

    /**
     * Create the stock row for a newly listed product.
     *
     * @param productId         product
     * @param initialQuantity   starting units
     * @param lowStockThreshold alert threshold
     * @return created row
     */
    @Transactional
    public ProductStock register(String productId, int initialQuantity, int lowStockThreshold) {
        if (initialQuantity < 0 || lowStockThreshold < 0) {
            throw new ValidationFailedException("Initial quantity and threshold must not be negative");
        }
        if (stockRepository.existsByProductId(productId)) {
            throw new ValidationFailedException("Stock already registered for product " + productId);
        }

        ProductStock stock = stockRepository.save(ProductStock.builder()
                .productId(productId)
                .quantity(initialQuantity)
                .lowStockThreshold(lowStockThreshold)
                .build());

        logger.info("Registered stock for product {}: {} units, status {}",
                productId, initialQuantity, stock.getStatus());
        return stock;
    }

    private void verifyOwner(String productId, Actor actor) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
        if (!actor.canActFor(product.getCraftsmanId())) {
            throw new ResourceAccessDeniedException(actor.getUserId(), "Product", productId);
        }
    }

    private static void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new ValidationFailedException("Quantity must be positive",
                    Map.of("quantity", "must be greater than 0"));
        }
    }
}
