package com.hkcraft.booking.api.controller;

import com.hkcraft.booking.api.dto.CheckoutRequest;
import com.hkcraft.booking.api.dto.CreateOrderRequest;
import com.hkcraft.booking.api.dto.OrderLineDto;
import com.hkcraft.booking.api.dto.OrderResponse;
import com.hkcraft.booking.api.dto.OrderStatusRequest;
import com.hkcraft.booking.api.dto.PaymentRequest;
import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.Order;
import com.hkcraft.booking.security.SecurityUtils;
import com.hkcraft.booking.service.CheckoutCommand;
import com.hkcraft.booking.service.OrderLineRequest;
import com.hkcraft.booking.service.OrderService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for orders.
 *
 * Authorization: users see and cancel their own orders; admins can act on any order
 * and move orders through fulfilment.
 *
 * @author Craft Booking Team
 */
@RestController
@RequestMapping("/api/v1/orders")
@PreAuthorize("isAuthenticated()")
public class OrderController {

    private static final Logger logger = LoggerFactory.getLogger(OrderController.class);

    private final OrderService orderService;

    public OrderController(OrderService orderService) {
        this.orderService = orderService;
    }

    /**
     * Create a PENDING order from explicit lines or from the stored cart.
     */
    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(@Valid @RequestBody CreateOrderRequest request) {
        String userId = SecurityUtils.getCurrentUserId();
        logger.info("Creating order for user: {}, fromCart: {}", userId, request.isFromCart());

        Order order = request.isFromCart()
                ? orderService.createOrderFromCart(userId, request.getShippingAddress())
                : orderService.createOrder(userId, toLines(request.getItems()), request.getShippingAddress());

        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.fromEntity(order));
    }

    /**
     * Place and pay in one call.
     *
     * Flow:
     * 1. Payment amount is checked against the quoted total
     * 2. Stock is reserved and the order persisted
     * 3. The payment is charged; a decline cancels the order and returns 402
     */
    @PostMapping("/checkout")
    public ResponseEntity<OrderResponse> checkout(@Valid @RequestBody CheckoutRequest request) {
        String userId = SecurityUtils.getCurrentUserId();

        CheckoutCommand command = CheckoutCommand.builder()
                .items(toLines(request.getItems()))
                .fromCart(request.isFromCart())
                .shippingAddress(request.getShippingAddress())
                .paymentAmount(request.getPaymentAmount())
                .paymentMethod(request.getPaymentMethod())
                .build();

        Order order = orderService.checkout(userId, command);
        logger.info("Checkout completed - order: {}, user: {}", order.getOrderId(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(OrderResponse.fromEntity(order));
    }

    @PostMapping("/{orderId}/payment")
    public ResponseEntity<OrderResponse> pay(
            @PathVariable String orderId,
            @Valid @RequestBody PaymentRequest request
    ) {
        Order order = orderService.payOrder(orderId, SecurityUtils.currentActor(),
                request.getAmount(), request.getPaymentMethod());
        return ResponseEntity.ok(OrderResponse.fromEntity(order));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrder(@PathVariable String orderId) {
        return ResponseEntity.ok(OrderResponse.fromEntity(orderService.getOrder(orderId, SecurityUtils.currentActor())));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<List<OrderResponse>> getUserOrders(@PathVariable String userId) {
        List<OrderResponse> orders = orderService.getOrdersForUser(userId, SecurityUtils.currentActor())
                .stream()
                .map(OrderResponse::fromEntity)
                .collect(Collectors.toList());
        return ResponseEntity.ok(orders);
    }

    /**
     * Cancel an order and return its stock.
     *
     * @param reason Cancellation reason (query parameter)
     */
    @DeleteMapping("/{orderId}")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable String orderId,
            @RequestParam(required = false, defaultValue = "Customer request") String reason
    ) {
        Actor actor = SecurityUtils.currentActor();
        logger.info("Cancelling order: {} by {}, reason: {}", orderId, actor, reason);
        return ResponseEntity.ok(OrderResponse.fromEntity(orderService.cancelOrder(orderId, actor, reason)));
    }

    @PutMapping("/{orderId}/status")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<OrderResponse> updateStatus(
            @PathVariable String orderId,
            @Valid @RequestBody OrderStatusRequest request
    ) {
        Order order = orderService.updateStatus(orderId, request.getStatus(), SecurityUtils.currentActor());
        return ResponseEntity.ok(OrderResponse.fromEntity(order));
    }

    private static List<OrderLineRequest> toLines(List<OrderLineDto> items) {
        return items.stream()
                .map(item -> new OrderLineRequest(item.getProductId(), item.getQuantity(), item.getCustomizationNotes()))
                .collect(Collectors.toList());
    }
}
