package com.hkcraft.booking.service;

import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.Cart;
import com.hkcraft.booking.domain.model.Order;
import com.hkcraft.booking.domain.model.Order.OrderStatus;
import com.hkcraft.booking.domain.model.Order.PaymentStatus;
import com.hkcraft.booking.domain.model.OrderItem;
import com.hkcraft.booking.domain.model.PaymentMethod;
import com.hkcraft.booking.domain.model.Product;
import com.hkcraft.booking.domain.model.ReservationLine;
import com.hkcraft.booking.domain.model.ShippingAddress;
import com.hkcraft.booking.domain.model.StockReservation;
import com.hkcraft.booking.exception.InvalidTransitionException;
import com.hkcraft.booking.exception.OrderNotCancellableException;
import com.hkcraft.booking.exception.PaymentDeclinedException;
import com.hkcraft.booking.exception.ResourceAccessDeniedException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.exception.ValidationFailedException;
import com.hkcraft.booking.infrastructure.cart.CartStore;
import com.hkcraft.booking.infrastructure.messaging.Notifier;
import com.hkcraft.booking.infrastructure.messaging.events.Notification;
import com.hkcraft.booking.infrastructure.messaging.events.NotificationType;
import com.hkcraft.booking.infrastructure.metrics.BookingMetricsService;
import com.hkcraft.booking.infrastructure.payment.PaymentGateway;
import com.hkcraft.booking.infrastructure.payment.PaymentResult;
import com.hkcraft.booking.infrastructure.tx.TransactionRetryExecutor;
import com.hkcraft.booking.repository.OrderRepository;
import com.hkcraft.booking.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Order orchestration: stock reservation, persistence, payment and cancellation.
 *
 * Purchase flow:
 * 1. Validate the request and quote the total from current prices
 * 2. In one transaction: reserve every line, snapshot prices, insert the order (PENDING)
 * 3. After commit: clear the cart, notify the buyer, alert craftsmen about low stock
 * 4. Charge the payment gateway; a decline cancels the order and restores stock
 *
 * Transactions are run through {@link TransactionRetryExecutor}; this class itself
 * is not transactional so the retry always starts a fresh transaction.
 *
 * @author Craft Booking Team
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private static final String ORDER = "Order";

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final ReservationService reservationService;
    private final CartStore cartStore;
    private final PaymentGateway paymentGateway;
    private final Notifier notifier;
    private final TransactionRetryExecutor txExecutor;
    private final BookingMetricsService metricsService;

    public OrderService(
            OrderRepository orderRepository,
            ProductRepository productRepository,
            ReservationService reservationService,
            CartStore cartStore,
            PaymentGateway paymentGateway,
            Notifier notifier,
            TransactionRetryExecutor txExecutor,
            BookingMetricsService metricsService
    ) {
        this.orderRepository = orderRepository;
        this.productRepository = productRepository;
        this.reservationService = reservationService;
        this.cartStore = cartStore;
        this.paymentGateway = paymentGateway;
        this.notifier = notifier;
        this.txExecutor = txExecutor;
        this.metricsService = metricsService;
    }

    /**
     * Create a PENDING order, reserving stock for every line.
     *
     * @param userId          buyer
     * @param items           requested lines
     * @param shippingAddress delivery address
     * @return the committed order
     */
    public Order createOrder(String userId, List<OrderLineRequest> items, ShippingAddress shippingAddress) {
        validateOrderRequest(items, shippingAddress);
        return placeOrder(userId, items, shippingAddress, null, false);
    }

    /**
     * Create a PENDING order from the user's stored cart. The cart is cleared once the order commits.
     */
    public Order createOrderFromCart(String userId, ShippingAddress shippingAddress) {
        List<OrderLineRequest> items = cartLines(userId);
        validateOrderRequest(items, shippingAddress);
        return placeOrder(userId, items, shippingAddress, null, true);
    }

    /**
     * Place and pay for an order in one call.
     *
     * The payment amount is compared with a quote from current prices before any stock
     * is touched, and compared again inside the order transaction.
     *
     * @return the paid (CONFIRMED) order
     * @throws ValidationFailedException if the amount does not match the total
     * @throws PaymentDeclinedException  if the charge fails; the order is cancelled and stock restored
     */
    public Order checkout(String userId, CheckoutCommand command) {
        long startTime = System.currentTimeMillis();

        if (command.getPaymentMethod() == null) {
            throw new ValidationFailedException("Payment method is required", Map.of("paymentMethod", "is required"));
        }
        if (command.getPaymentAmount() == null) {
            throw new ValidationFailedException("Payment amount is required", Map.of("paymentAmount", "is required"));
        }

        List<OrderLineRequest> items = command.isFromCart() ? cartLines(userId) : command.getItems();
        validateOrderRequest(items, command.getShippingAddress());

        BigDecimal quoted = quote(items);
        verifyAmount(command.getPaymentAmount(), quoted);

        try {
            Order order = placeOrder(userId, items, command.getShippingAddress(),
                    command.getPaymentAmount(), command.isFromCart());
            return chargeOrder(order, command.getPaymentAmount(), command.getPaymentMethod(), "checkout");
        } finally {
            metricsService.recordCheckoutLatency(System.currentTimeMillis() - startTime);
        }
    }

    /**
     * Pay for an existing PENDING order.
     *
     * @param actor the buyer, or an admin
     */
    public Order payOrder(String orderId, Actor actor, BigDecimal amount, PaymentMethod method) {
        Order order = getOrder(orderId, actor);

        if (order.getStatus() != OrderStatus.PENDING || order.getPaymentStatus() != PaymentStatus.PENDING) {
            throw new InvalidTransitionException(ORDER, orderId, order.getStatus().name(), OrderStatus.CONFIRMED.name(),
                    "only pending orders can be paid");
        }
        if (method == null) {
            throw new ValidationFailedException("Payment method is required", Map.of("paymentMethod", "is required"));
        }
        verifyAmount(amount, order.getTotalAmount());

        return chargeOrder(order, amount, method, "pay");
    }

    /**
     * Cancel an order and return its stock to the ledger. A paid order is refunded after commit.
     *
     * @param actor the buyer, an admin, or {@link Actor#SYSTEM} for compensation
     * @throws OrderNotCancellableException if the order is DELIVERED or already CANCELLED
     */
    public Order cancelOrder(String orderId, Actor actor, String reason) {
        Order cancelled = txExecutor.execute("order.cancel", () -> {
            Order order = orderRepository.findByIdWithLock(orderId)
                    .orElseThrow(() -> new ResourceNotFoundException(ORDER, orderId));

            if (!actor.canActFor(order.getUserId())) {
                throw new ResourceAccessDeniedException(actor.getUserId(), ORDER, orderId);
            }
            if (!order.isCancellable()) {
                logger.warn("Order {} cannot be cancelled in status {}", orderId, order.getStatus());
                throw new OrderNotCancellableException(orderId, order.getStatus().name());
            }

            reservationService.releaseAll(orderId, toReservationLines(order.getItems()));
            order.cancel(reason);
            return orderRepository.save(order);
        });

        metricsService.recordOrderCancelled(actor.getRole().name());
        logger.info("Cancelled order {} by {}, payment status {}", orderId, actor, cancelled.getPaymentStatus());

        if (cancelled.getPaymentStatus() == PaymentStatus.REFUNDED && cancelled.getPaymentTransactionId() != null) {
            refund(cancelled);
        }

        safeNotify(cancelled.getUserId(), Notification.of(
                        NotificationType.ORDER_CANCELLED,
                        "Order cancelled",
                        "Your order " + orderId + " has been cancelled")
                .with("orderId", orderId)
                .with("reason", reason)
                .with("paymentStatus", cancelled.getPaymentStatus().name()));

        return cancelled;
    }

    /**
     * Move an order along fulfilment: CONFIRMED, PROCESSING, SHIPPED, DELIVERED.
     *
     * @param actor must be an admin
     */
    public Order updateStatus(String orderId, OrderStatus newStatus, Actor actor) {
        if (!actor.isPrivileged()) {
            throw new ResourceAccessDeniedException(actor.getUserId(), ORDER, orderId);
        }

        return txExecutor.execute("order.status", () -> {
            Order order = orderRepository.findByIdWithLock(orderId)
                    .orElseThrow(() -> new ResourceNotFoundException(ORDER, orderId));

            if (newStatus == null || !order.getStatus().canAdvanceTo(newStatus)) {
                throw new InvalidTransitionException(ORDER, orderId, order.getStatus().name(),
                        newStatus == null ? "null" : newStatus.name());
            }

            logger.info("Order {} moved from {} to {} by {}", orderId, order.getStatus(), newStatus, actor);
            order.setStatus(newStatus);
            return orderRepository.save(order);
        });
    }

    public Order getOrder(String orderId, Actor actor) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException(ORDER, orderId));
        if (!actor.canActFor(order.getUserId())) {
            throw new ResourceAccessDeniedException(actor.getUserId(), ORDER, orderId);
        }
        return order;
    }

    public List<Order> getOrdersForUser(String userId, Actor actor) {
        if (!actor.canActFor(userId)) {
            throw new ResourceAccessDeniedException(actor.getUserId(), "Orders", userId);
        }
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }

    /**
     * Total for the given lines at current prices. Read-only, takes no locks.
     */
    public BigDecimal quote(List<OrderLineRequest> items) {
        Map<String, Product> products = loadProducts(items);
        BigDecimal total = BigDecimal.ZERO;
        for (OrderLineRequest item : items) {
            Product product = products.get(item.getProductId());
            total = total.add(product.getPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }
        return total;
    }

    private Order placeOrder(String userId, List<OrderLineRequest> items, ShippingAddress shippingAddress,
                             BigDecimal expectedAmount, boolean fromCart) {
        String orderId = UUID.randomUUID().toString();
        Map<String, String> craftsmen = new HashMap<>();
        List<StockReservation> reservations = new ArrayList<>();

        Order order;
        try {
            order = txExecutor.execute("order.create", () -> {
                Map<String, Product> products = loadProducts(items);

                List<StockReservation> reserved = reservationService.reserveAll(orderId, toLines(items));

                Order created = Order.builder()
                        .orderId(orderId)
                        .userId(userId)
                        .status(OrderStatus.PENDING)
                        .paymentStatus(PaymentStatus.PENDING)
                        .shippingAddress(shippingAddress)
                        .build();

                for (OrderLineRequest item : items) {
                    Product product = products.get(item.getProductId());
                    created.addItem(OrderItem.builder()
                            .itemId(UUID.randomUUID().toString())
                            .productId(product.getProductId())
                            .productName(product.getName())
                            .unitPrice(product.getPrice())
                            .quantity(item.getQuantity())
                            .customizationNotes(item.getCustomizationNotes())
                            .build());
                }
                BigDecimal total = created.recalculateTotal();

                // Prices may have moved since the quote
                if (expectedAmount != null) {
                    verifyAmount(expectedAmount, total);
                }

                created = orderRepository.save(created);

                reservations.clear();
                reservations.addAll(reserved);
                craftsmen.clear();
                products.values().forEach(p -> craftsmen.put(p.getProductId(), p.getCraftsmanId()));
                return created;
            });
        } catch (RuntimeException e) {
            logger.warn("Order creation failed for user {}: {}", userId, e.getMessage());
            metricsService.recordOrderFailure(e.getClass().getSimpleName());
            throw e;
        }

        metricsService.recordOrderCreated();
        logger.info("Created order {} for user {} with {} items, total {}",
                order.getOrderId(), userId, order.getItems().size(), order.getTotalAmount());

        if (fromCart) {
            try {
                cartStore.clear(userId);
            } catch (RuntimeException e) {
                logger.error("Failed to clear cart for user {} after order {}", userId, orderId, e);
                metricsService.recordError("CART_CLEAR_ERROR", "order.create");
            }
        }

        safeNotify(userId, Notification.of(
                        NotificationType.ORDER_PLACED,
                        "Order placed",
                        "Your order " + orderId + " has been placed")
                .with("orderId", orderId)
                .with("totalAmount", order.getTotalAmount()));

        for (StockReservation reservation : reservations) {
            if (reservation.isLowStock()) {
                String craftsmanId = craftsmen.get(reservation.getProductId());
                if (craftsmanId != null) {
                    safeNotify(craftsmanId, Notification.of(
                                    NotificationType.LOW_STOCK,
                                    "Low stock",
                                    "Only " + reservation.getRemainingQuantity() + " units left")
                            .with("productId", reservation.getProductId())
                            .with("remainingQuantity", reservation.getRemainingQuantity()));
                }
            }
        }

        return order;
    }

    private Order chargeOrder(Order order, BigDecimal amount, PaymentMethod method, String flow) {
        String orderId = order.getOrderId();
        PaymentResult result;
        try {
            result = paymentGateway.charge(amount, method, orderId);
        } catch (RuntimeException e) {
            logger.error("Payment gateway error for order {}", orderId, e);
            metricsService.recordError("PAYMENT_GATEWAY_ERROR", flow);
            result = PaymentResult.declined("GATEWAY_ERROR", e.getMessage());
        }

        if (!result.isSuccess()) {
            logger.warn("Payment declined for order {} ({}: {}), cancelling",
                    orderId, result.getDeclineCode(), result.getDeclineReason());
            metricsService.recordPaymentDeclined(flow);
            cancelOrder(orderId, Actor.SYSTEM, "Payment declined: " + result.getDeclineReason());
            throw new PaymentDeclinedException(orderId, result.getDeclineCode(), result.getDeclineReason());
        }

        String transactionId = result.getTransactionId();
        Order paid = txExecutor.execute("order.pay", () -> {
            Order locked = orderRepository.findByIdWithLock(orderId)
                    .orElseThrow(() -> new ResourceNotFoundException(ORDER, orderId));
            if (locked.getStatus() != OrderStatus.PENDING) {
                return null;
            }
            locked.completePayment(transactionId, method);
            return orderRepository.save(locked);
        });

        if (paid == null) {
            // Cancelled while the charge was in flight
            logger.warn("Order {} left PENDING during payment, refunding {}", orderId, transactionId);
            refund(order.getOrderId(), transactionId, amount);
            throw new InvalidTransitionException(ORDER, orderId, OrderStatus.CANCELLED.name(),
                    OrderStatus.CONFIRMED.name(), "order was cancelled during payment");
        }

        logger.info("Order {} paid, transaction {}", orderId, transactionId);
        safeNotify(paid.getUserId(), Notification.of(
                        NotificationType.ORDER_PAID,
                        "Payment received",
                        "Payment for order " + orderId + " was successful")
                .with("orderId", orderId)
                .with("transactionId", transactionId)
                .with("amount", amount));
        return paid;
    }

    private void refund(Order order) {
        refund(order.getOrderId(), order.getPaymentTransactionId(), order.getTotalAmount());
    }

    private void refund(String orderId, String transactionId, BigDecimal amount) {
        try {
            PaymentResult result = paymentGateway.refund(transactionId, amount);
            if (result.isSuccess()) {
                logger.info("Refunded {} for order {}, transaction {}", amount, orderId, result.getTransactionId());
            } else {
                logger.error("Refund for order {} declined: {} {}",
                        orderId, result.getDeclineCode(), result.getDeclineReason());
                metricsService.recordError("REFUND_DECLINED", "order.cancel");
            }
        } catch (RuntimeException e) {
            logger.error("Refund for order {} failed", orderId, e);
            metricsService.recordError("REFUND_ERROR", "order.cancel");
        }
    }

    private Map<String, Product> loadProducts(List<OrderLineRequest> items) {
        List<String> ids = items.stream().map(OrderLineRequest::getProductId).distinct().collect(Collectors.toList());
        Map<String, Product> products = productRepository.findByProductIdIn(ids).stream()
                .collect(Collectors.toMap(Product::getProductId, p -> p));
        for (String id : ids) {
            if (!products.containsKey(id)) {
                throw new ResourceNotFoundException("Product", id);
            }
        }
        return products;
    }

    private List<OrderLineRequest> cartLines(String userId) {
        Cart cart = cartStore.get(userId).orElse(null);
        if (cart == null || cart.isEmpty()) {
            throw new ValidationFailedException("Cart is empty");
        }
        return cart.getItems().stream()
                .map(item -> new OrderLineRequest(item.getProductId(), item.getQuantity(), item.getNotes()))
                .collect(Collectors.toList());
    }

    private static List<ReservationLine> toLines(List<OrderLineRequest> items) {
        return items.stream()
                .map(item -> new ReservationLine(item.getProductId(), item.getQuantity()))
                .collect(Collectors.toList());
    }

    private static List<ReservationLine> toReservationLines(List<OrderItem> items) {
        return items.stream()
                .map(item -> new ReservationLine(item.getProductId(), item.getQuantity()))
                .collect(Collectors.toList());
    }

    private static void verifyAmount(BigDecimal paid, BigDecimal total) {
        if (paid == null || paid.compareTo(total) != 0) {
            throw new ValidationFailedException(
                    "Payment amount " + paid + " does not match order total " + total,
                    Map.of("paymentAmount", "must equal " + total));
        }
    }

    private static void validateOrderRequest(List<OrderLineRequest> items, ShippingAddress address) {
        Map<String, String> errors = new LinkedHashMap<>();

        if (items == null || items.isEmpty()) {
            errors.put("items", "at least one item is required");
        } else {
            for (int i = 0; i < items.size(); i++) {
                OrderLineRequest item = items.get(i);
                if (item.getProductId() == null || item.getProductId().isBlank()) {
                    errors.put("items[" + i + "].productId", "is required");
                }
                if (item.getQuantity() <= 0) {
                    errors.put("items[" + i + "].quantity", "must be greater than 0");
                }
            }
        }

        if (address == null) {
            errors.put("shippingAddress", "is required");
        } else {
            requireText(errors, "shippingAddress.recipientName", address.getRecipientName());
            requireText(errors, "shippingAddress.phone", address.getPhone());
            requireText(errors, "shippingAddress.addressLine", address.getAddressLine());
            requireText(errors, "shippingAddress.city", address.getCity());
            requireText(errors, "shippingAddress.postalCode", address.getPostalCode());
        }

        if (!errors.isEmpty()) {
            throw new ValidationFailedException("Invalid order request", errors);
        }
    }

    private static void requireText(Map<String, String> errors, String field, String value) {
        if (value == null || value.isBlank()) {
            errors.put(field, "is required");
        }
    }

    private void safeNotify(String userId, Notification notification) {
        try {
            notifier.notify(userId, notification);
        } catch (RuntimeException e) {
            logger.error("Notification {} for user {} failed", notification.getType(), userId, e);
            metricsService.recordNotificationFailure(notification.getType().name());
        }
    }
}
