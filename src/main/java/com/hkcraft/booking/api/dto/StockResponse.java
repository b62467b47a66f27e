package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.ProductStock;

import java.time.Instant;

/**
 * Response DTO for a product's stock level and sales status.
 *
 * @author Craft Booking Team
 */
public class StockResponse {

    private String productId;

    private Integer quantity;

    private String status;

    private boolean available;

    private boolean lowStock;

    private Instant updatedAt;

    public StockResponse() {
    }

    public static StockResponse fromEntity(ProductStock stock) {
        StockResponse response = new StockResponse();
        response.setProductId(stock.getProductId());
        response.setQuantity(stock.getQuantity());
        response.setStatus(stock.getStatus().name());
        response.setAvailable(stock.isActive() && stock.getQuantity() > 0);
        response.setLowStock(stock.isLowStock());
        response.setUpdatedAt(stock.getUpdatedAt());
        return response;
    }

    // Getters and setters
    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public boolean isLowStock() {
        return lowStock;
    }

    public void setLowStock(boolean lowStock) {
        this.lowStock = lowStock;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
