package com.hkcraft.booking.api.controller;

import com.hkcraft.booking.api.dto.CartItemRequest;
import com.hkcraft.booking.api.dto.CartItemUpdateRequest;
import com.hkcraft.booking.api.dto.CartMergeRequest;
import com.hkcraft.booking.domain.model.Cart.CartItem;
import com.hkcraft.booking.security.SecurityUtils;
import com.hkcraft.booking.service.CartService;
import com.hkcraft.booking.service.CartSummary;
import com.hkcraft.booking.service.CartValidation;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for the signed-in user's cart.
 *
 * @author Craft Booking Team
 */
@RestController
@RequestMapping("/api/v1/cart")
@PreAuthorize("isAuthenticated()")
public class CartController {

    private final CartService cartService;

    public CartController(CartService cartService) {
        this.cartService = cartService;
    }

    @GetMapping
    public ResponseEntity<CartSummary> getCart() {
        return ResponseEntity.ok(cartService.getCart(SecurityUtils.getCurrentUserId()));
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Integer>> getItemCount() {
        return ResponseEntity.ok(Map.of("count", cartService.itemCount(SecurityUtils.getCurrentUserId())));
    }

    @GetMapping("/validation")
    public ResponseEntity<CartValidation> validate() {
        return ResponseEntity.ok(cartService.validate(SecurityUtils.getCurrentUserId()));
    }

    @PostMapping("/items")
    public ResponseEntity<CartSummary> addItem(@Valid @RequestBody CartItemRequest request) {
        return ResponseEntity.ok(cartService.addItem(SecurityUtils.getCurrentUserId(),
                request.getProductId(), request.getQuantity(), request.getNotes()));
    }

    @PutMapping("/items/{productId}")
    public ResponseEntity<CartSummary> updateItem(
            @PathVariable String productId,
            @Valid @RequestBody CartItemUpdateRequest request
    ) {
        return ResponseEntity.ok(cartService.updateItem(SecurityUtils.getCurrentUserId(),
                productId, request.getQuantity(), request.getNotes()));
    }

    @DeleteMapping("/items/{productId}")
    public ResponseEntity<CartSummary> removeItem(@PathVariable String productId) {
        return ResponseEntity.ok(cartService.removeItem(SecurityUtils.getCurrentUserId(), productId));
    }

    /**
     * Merge a guest cart after sign-in. Lines that fail validation are dropped.
     */
    @PostMapping("/merge")
    public ResponseEntity<CartSummary> merge(@RequestBody CartMergeRequest request) {
        List<CartItem> items = request.getItems().stream()
                .map(line -> CartItem.builder()
                        .productId(line.getProductId())
                        .quantity(line.getQuantity())
                        .notes(line.getNotes())
                        .build())
                .collect(Collectors.toList());
        return ResponseEntity.ok(cartService.mergeCart(SecurityUtils.getCurrentUserId(), items));
    }

    @DeleteMapping
    public ResponseEntity<Void> clear() {
        cartService.clear(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }
}
