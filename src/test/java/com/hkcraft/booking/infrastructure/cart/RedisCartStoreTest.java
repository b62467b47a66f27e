package com.hkcraft.booking.infrastructure.cart;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.hkcraft.booking.domain.model.Cart;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RedisCartStore.
 *
 * @author Craft Booking Team
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RedisCartStore Unit Tests")
class RedisCartStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisCartStore cartStore;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        cartStore = new RedisCartStore(redisTemplate, objectMapper, Duration.ofDays(7));
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    @Test
    @DisplayName("set - Cart: Should store JSON under the user key with the idle TTL")
    void set_Cart() {
        Cart cart = Cart.empty("u-1");
        cart.getItems().add(Cart.CartItem.builder().productId("p-1").quantity(2).notes("blue").build());

        cartStore.set("u-1", cart);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(eq("cart:u-1"), payload.capture(), eq(Duration.ofDays(7)));
        assertThat(payload.getValue()).contains("\"productId\":\"p-1\"");
    }

    @Test
    @DisplayName("get - StoredCart: Should read back what was written")
    void get_StoredCart() {
        Cart cart = Cart.empty("u-1");
        cart.getItems().add(Cart.CartItem.builder().productId("p-1").quantity(2).build());
        cartStore.set("u-1", cart);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).set(anyString(), payload.capture(), any(Duration.class));
        when(valueOperations.get("cart:u-1")).thenReturn(payload.getValue());

        Optional<Cart> loaded = cartStore.get("u-1");

        assertThat(loaded).isPresent();
        assertThat(loaded.get().findItem("p-1")).map(Cart.CartItem::getQuantity).contains(2);
    }

    @Test
    @DisplayName("get - NoKey: Should return empty")
    void get_NoKey() {
        when(valueOperations.get("cart:u-2")).thenReturn(null);

        assertThat(cartStore.get("u-2")).isEmpty();
    }

    @Test
    @DisplayName("get - Corrupted: Should discard the value and return empty")
    void get_Corrupted() {
        when(valueOperations.get("cart:u-1")).thenReturn("{not json");

        assertThat(cartStore.get("u-1")).isEmpty();
        verify(redisTemplate).delete("cart:u-1");
    }

    @Test
    @DisplayName("clear - Always: Should delete the key")
    void clear_Always() {
        cartStore.clear("u-1");

        verify(redisTemplate).delete("cart:u-1");
    }
}
