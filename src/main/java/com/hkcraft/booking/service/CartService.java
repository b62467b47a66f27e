package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Cart;
import com.hkcraft.booking.domain.model.Cart.CartItem;
import com.hkcraft.booking.domain.model.Product;
import com.hkcraft.booking.domain.model.ProductStock;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.exception.InsufficientCapacityException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ResourceUnavailableException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.cart.CartStore;
import com.hkcraft.booking.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Shopping carts. Carts are checked against the ledger when they change, but they
 * never hold stock: the order transaction re-validates everything.
 *
 * @author Craft Booking Team
 */
@Service
public class CartService {

    private static final Logger logger = LoggerFactory.getLogger(CartService.class);

    private final CartStore cartStore;
    private final ProductRepository productRepository;
    private final ResourceLedgerService ledgerService;

    public CartService(CartStore cartStore, ProductRepository productRepository,
                       ResourceLedgerService ledgerService) {
        this.cartStore = cartStore;
        this.productRepository = productRepository;
        this.ledgerService = ledgerService;
    }

    public CartSummary getCart(String userId) {
        return summarize(load(userId));
    }

    /**
     * Add units of a product, merging with an existing line.
     *
     * @throws ValidationFailedException     if quantity is not positive
     * @throws ResourceNotFoundException     if the product does not exist
     * @throws ResourceUnavailableException  if the product is withdrawn from sale
     * @throws InsufficientCapacityException if the merged quantity exceeds current stock
     */
    public CartSummary addItem(String userId, String productId, int quantity, String notes) {
        if (productId == null || productId.isBlank()) {
            throw new ValidationFailedException("Product id is required", Map.of("productId", "is required"));
        }
        if (quantity <= 0) {
            throw new ValidationFailedException("Quantity must be positive", Map.of("quantity", "must be greater than 0"));
        }

        Cart cart = load(userId);
        Optional<CartItem> existing = cart.findItem(productId);
        int merged;
        try {
            merged = Math.addExact(existing.map(CartItem::getQuantity).orElse(0), quantity);
        } catch (ArithmeticException e) {
            throw new ValidationFailedException("Quantity is too large", Map.of("quantity", "is too large"));
        }

        checkAvailability(productId, merged);

        if (existing.isPresent()) {
            existing.get().setQuantity(merged);
            if (notes != null) {
                existing.get().setNotes(notes);
            }
        } else {
            cart.getItems().add(CartItem.builder()
                    .productId(productId)
                    .quantity(quantity)
                    .notes(notes)
                    .addedAt(Instant.now())
                    .build());
        }

        save(cart);
        logger.debug("Added {} x {} to cart of {}", quantity, productId, userId);
        return summarize(cart);
    }

    /**
     * Set the quantity of a line. Zero or less removes it.
     */
    public CartSummary updateItem(String userId, String productId, int quantity, String notes) {
        Cart cart = load(userId);
        CartItem item = cart.findItem(productId)
                .orElseThrow(() -> new ResourceNotFoundException("CartItem", productId));

        if (quantity <= 0) {
            cart.removeItem(productId);
        } else {
            checkAvailability(productId, quantity);
            item.setQuantity(quantity);
            if (notes != null) {
                item.setNotes(notes);
            }
        }

        save(cart);
        return summarize(cart);
    }

    public CartSummary removeItem(String userId, String productId) {
        Cart cart = load(userId);
        if (cart.removeItem(productId)) {
            save(cart);
        }
        return summarize(cart);
    }

    public void clear(String userId) {
        cartStore.clear(userId);
        logger.debug("Cleared cart of {}", userId);
    }

    public int itemCount(String userId) {
        return load(userId).totalQuantity();
    }

    /**
     * Check every line against current products and stock.
     */
    public CartValidation validate(String userId) {
        Cart cart = load(userId);
        List<String> productIds = productIds(cart);
        if (productIds.isEmpty()) {
            return CartValidation.of(new ArrayList<>());
        }
        Map<String, Product> products = products(productIds);
        Map<String, ProductStock> stock = ledgerService.getSnapshots(productIds);

        List<String> errors = new ArrayList<>();
        for (CartItem item : cart.getItems()) {
            Product product = products.get(item.getProductId());
            ProductStock line = stock.get(item.getProductId());
            if (product == null || line == null) {
                errors.add("Product " + item.getProductId() + " is no longer available");
            } else if (line.isWithdrawn()) {
                errors.add(product.getName() + " is not available (" + line.getStatus() + ")");
            } else if (line.getQuantity() < item.getQuantity()) {
                errors.add("Only " + line.getQuantity() + " units of " + product.getName() + " available");
            }
        }
        return CartValidation.of(errors);
    }

    /**
     * Merge a guest cart into the user's cart. Lines that would not pass
     * {@link #addItem} are skipped.
     */
    public CartSummary mergeCart(String userId, List<CartItem> guestItems) {
        if (guestItems != null) {
            for (CartItem item : guestItems) {
                try {
                    addItem(userId, item.getProductId(), item.getQuantity(), item.getNotes());
                } catch (ValidationFailedException | ResourceNotFoundException
                         | ResourceUnavailableException | InsufficientCapacityException e) {
                    logger.warn("Skipping guest cart line {} for user {}: {}",
                            item.getProductId(), userId, e.getMessage());
                }
            }
        }
        return getCart(userId);
    }

    private void checkAvailability(String productId, int requested) {
        if (!productRepository.existsById(productId)) {
            throw new ResourceNotFoundException("Product", productId);
        }
        ProductStock stock = ledgerService.getSnapshot(productId);
        if (stock.isWithdrawn()) {
            throw new ResourceUnavailableException(ResourceType.PRODUCT_STOCK, productId, stock.getStatus().name());
        }
        if (requested > stock.getQuantity()) {
            throw new InsufficientCapacityException(ResourceType.PRODUCT_STOCK, productId, requested, stock.getQuantity());
        }
    }

    private CartSummary summarize(Cart cart) {
        List<String> productIds = productIds(cart);
        Map<String, Product> products = products(productIds);
        Map<String, ProductStock> stock = productIds.isEmpty() ? Map.of() : ledgerService.getSnapshots(productIds);

        List<CartSummary.Line> lines = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;

        for (CartItem item : cart.getItems()) {
            Product product = products.get(item.getProductId());
            ProductStock line = stock.get(item.getProductId());

            BigDecimal price = product == null ? BigDecimal.ZERO : product.getPrice();
            BigDecimal lineTotal = price.multiply(BigDecimal.valueOf(item.getQuantity()));
            int available = line == null ? 0 : line.getQuantity();

            lines.add(CartSummary.Line.builder()
                    .productId(item.getProductId())
                    .productName(product == null ? null : product.getName())
                    .unitPrice(price)
                    .quantity(item.getQuantity())
                    .lineTotal(lineTotal)
                    .availableQuantity(available)
                    .available(product != null && line != null && line.isActive() && available >= item.getQuantity())
                    .notes(item.getNotes())
                    .build());
            total = total.add(lineTotal);
        }

        return CartSummary.builder()
                .userId(cart.getUserId())
                .lines(lines)
                .totalItems(cart.totalQuantity())
                .totalAmount(total)
                .updatedAt(cart.getUpdatedAt())
                .build();
    }

    private Cart load(String userId) {
        return cartStore.get(userId).orElseGet(() -> Cart.empty(userId));
    }

    private void save(Cart cart) {
        cart.touch();
        cartStore.set(cart.getUserId(), cart);
    }

    private static List<String> productIds(Cart cart) {
        return cart.getItems().stream().map(CartItem::getProductId).collect(Collectors.toList());
    }

    private Map<String, Product> products(List<String> productIds) {
        if (productIds.isEmpty()) {
            return Map.of();
        }
        return productRepository.findByProductIdIn(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, p -> p));
    }
}
