package com.hkcraft.booking.api.controller;

import com.hkcraft.booking.api.exception.GlobalExceptionHandler;
import com.hkcraft.booking.config.SecurityConfig;
import com.hkcraft.booking.domain.model.Actor;
import com.hkcraft.booking.domain.model.ProductStock;
import com.hkcraft.booking.domain.model.ResourceType;
import com.hkcraft.booking.exception.ResourceAccessDeniedException;
import com.hkcraft.booking.exception.ResourceNotFoundException;
import com.hkcraft.booking.service.ResourceLedgerService;
import com.hkcraft.booking.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ProductController using MockMvc.
 *
 * @author Craft Booking Team
 */
@WebMvcTest(ProductController.class)
@ContextConfiguration(classes = {ProductController.class, GlobalExceptionHandler.class, SecurityConfig.class})
@DisplayName("ProductController Tests")
class ProductControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ResourceLedgerService ledgerService;

    @Test
    @DisplayName("GET /{productId}/availability - Public stock snapshot")
    void getAvailability_Returns200() throws Exception {
        ProductStock stock = TestDataBuilder.stock("p-1", 2).lowStockThreshold(3).build();
        when(ledgerService.getSnapshot("p-1")).thenReturn(stock);

        mockMvc.perform(get("/api/v1/products/p-1/availability"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantity").value(2))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.available").value(true))
                .andExpect(jsonPath("$.lowStock").value(true));
    }

    @Test
    @DisplayName("GET /{productId}/availability - Unknown product returns 404")
    void getAvailability_Unknown_Returns404() throws Exception {
        when(ledgerService.getSnapshot("ghost"))
                .thenThrow(new ResourceNotFoundException(ResourceType.PRODUCT_STOCK, "ghost"));

        mockMvc.perform(get("/api/v1/products/ghost/availability"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.resourceId").value("ghost"));
    }

    @Test
    @DisplayName("PUT /{productId}/stock - Craftsman restocks")
    void adjustStock_Craftsman_Returns200() throws Exception {
        ProductStock stock = TestDataBuilder.stock("p-1", 15).build();
        when(ledgerService.adjustQuantity("p-1", 15,
                new Actor(TestDataBuilder.CRAFTSMAN_ID, Actor.Role.CRAFTSMAN))).thenReturn(stock);

        mockMvc.perform(put("/api/v1/products/p-1/stock")
                        .header("X-User-Id", TestDataBuilder.CRAFTSMAN_ID)
                        .header("X-User-Role", "CRAFTSMAN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\": 15}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.quantity").value(15));
    }

    @Test
    @DisplayName("PUT /{productId}/stock - Another craftsman's product returns 403")
    void adjustStock_NotOwner_Returns403() throws Exception {
        when(ledgerService.adjustQuantity(eq("p-1"), anyInt(), any(Actor.class)))
                .thenThrow(new ResourceAccessDeniedException("c-2", "Product", "p-1"));

        mockMvc.perform(put("/api/v1/products/p-1/stock")
                        .header("X-User-Id", "c-2")
                        .header("X-User-Role", "CRAFTSMAN")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\": 15}"))
                .andExpect(status().isForbidden());
    }

    @Test
    @DisplayName("PUT /{productId}/stock - Buyer role returns 403")
    void adjustStock_User_Returns403() throws Exception {
        mockMvc.perform(put("/api/v1/products/p-1/stock")
                        .header("X-User-Id", "u-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"quantity\": 15}"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(ledgerService);
    }
}
