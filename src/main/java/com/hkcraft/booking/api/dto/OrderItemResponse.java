package com.hkcraft.booking.api.dto;

import com.hkcraft.booking.domain.model.OrderItem;

import java.math.BigDecimal;

/**
 * A line of an order with its price snapshot.
 *
 * @author Craft Booking Team
 */
public class OrderItemResponse {

    private String productId;

    private String productName;

    private BigDecimal unitPrice;

    private Integer quantity;

    private BigDecimal lineTotal;

    private String customizationNotes;

    public OrderItemResponse() {
    }

    public static OrderItemResponse fromEntity(OrderItem item) {
        OrderItemResponse response = new OrderItemResponse();
        response.setProductId(item.getProductId());
        response.setProductName(item.getProductName());
        response.setUnitPrice(item.getUnitPrice());
        response.setQuantity(item.getQuantity());
        response.setLineTotal(item.lineTotal());
        response.setCustomizationNotes(item.getCustomizationNotes());
        return response;
    }

    // Getters and setters
    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }

    public String getProductName() {
        return productName;
    }

    public void setProductName(String productName) {
        this.productName = productName;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public void setUnitPrice(BigDecimal unitPrice) {
        this.unitPrice = unitPrice;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getLineTotal() {
        return lineTotal;
    }

    public void setLineTotal(BigDecimal lineTotal) {
        this.lineTotal = lineTotal;
    }

    public String getCustomizationNotes() {
        return customizationNotes;
    }

    public void setCustomizationNotes(String customizationNotes) {
        this.customizationNotes = customizationNotes;
    }
}
