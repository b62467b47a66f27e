package com.hkcraft.booking.api.controller;

import com.hkcraft.booking.api.dto.StockAdjustmentRequest;
import com.hkcraft.booking.api.dto.StockRegistrationRequest;
import com.hkcraft.booking.api.dto.StockResponse;
import com.hkcraft.booking.api.dto.StockStatusRequest;
import com.hkcraft.booking.domain.model.ProductStock;
import com.hkcraft.booking.security.SecurityUtils;
import com.hkcraft.booking.service.ResourceLedgerService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for product stock.
 * Availability reads are public; stock changes are for the product's craftsman or an admin.
 *
 * @author Craft Booking Team
 */
@RestController
@RequestMapping("/api/v1/products")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ResourceLedgerService ledgerService;

    public ProductController(ResourceLedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    /**
     * Current stock level and sales status. Advisory: the order transaction re-checks.
     *
     * @param productId product ID
     * @return stock snapshot
     */
    @GetMapping("/{productId}/availability")
    public ResponseEntity<StockResponse> getAvailability(@PathVariable String productId) {
        logger.debug("Checking availability for product: {}", productId);
        return ResponseEntity.ok(StockResponse.fromEntity(ledgerService.getSnapshot(productId)));
    }

    @PostMapping("/{productId}/stock")
    @PreAuthorize("hasAnyRole('CRAFTSMAN', 'ADMIN')")
    public ResponseEntity<StockResponse> registerStock(
            @PathVariable String productId,
            @Valid @RequestBody StockRegistrationRequest request
    ) {
        int threshold = request.getLowStockThreshold() == null ? 0 : request.getLowStockThreshold();
        ProductStock stock = ledgerService.register(productId, request.getInitialQuantity(), threshold);
        return ResponseEntity.status(HttpStatus.CREATED).body(StockResponse.fromEntity(stock));
    }

    /**
     * Restock or correct the stock level.
     */
    @PutMapping("/{productId}/stock")
    @PreAuthorize("hasAnyRole('CRAFTSMAN', 'ADMIN')")
    public ResponseEntity<StockResponse> adjustStock(
            @PathVariable String productId,
            @Valid @RequestBody StockAdjustmentRequest request
    ) {
        ProductStock stock = ledgerService.adjustQuantity(productId, request.getQuantity(), SecurityUtils.currentActor());
        return ResponseEntity.ok(StockResponse.fromEntity(stock));
    }

    @PutMapping("/{productId}/stock/status")
    @PreAuthorize("hasAnyRole('CRAFTSMAN', 'ADMIN')")
    public ResponseEntity<StockResponse> setStockStatus(
            @PathVariable String productId,
            @Valid @RequestBody StockStatusRequest request
    ) {
        ProductStock stock = ledgerService.setActive(productId, request.getActive(), SecurityUtils.currentActor());
        return ResponseEntity.ok(StockResponse.fromEntity(stock));
    }
}
