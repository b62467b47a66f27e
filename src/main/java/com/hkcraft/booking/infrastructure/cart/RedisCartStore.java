package com.hkcraft.booking.infrastructure.cart;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hkcraft.booking.domain.model.Cart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Redis-backed cart storage.
 *
 * Cache Keys:
 * - cart:{user_id} -> Cart (JSON), expires after the configured idle TTL
 *
 * Unlike a cache, a cart is user state: read and write failures propagate to the caller.
 * Only {@link #clear(String)} after checkout is treated as best-effort, by the caller.
 *
 * @author Craft Booking Team
 */
@Service
public class RedisCartStore implements CartStore {

    private static final Logger logger = LoggerFactory.getLogger(RedisCartStore.class);

    private static final String CART_PREFIX = "cart:";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration cartTtl;

    public RedisCartStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            @Value("${craft.cart.ttl:P7D}") Duration cartTtl
    ) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.cartTtl = cartTtl;
    }

    @Override
    public Optional<Cart> get(String userId) {
        String value = redisTemplate.opsForValue().get(CART_PREFIX + userId);
        if (value == null) {
            logger.debug("No stored cart for user: {}", userId);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(value, Cart.class));
        } catch (JsonProcessingException e) {
            logger.error("Discarding unreadable cart for user: {}", userId, e);
            redisTemplate.delete(CART_PREFIX + userId);
            return Optional.empty();
        }
    }

    @Override
    public void set(String userId, Cart cart) {
        try {
            String payload = objectMapper.writeValueAsString(cart);
            redisTemplate.opsForValue().set(CART_PREFIX + userId, payload, cartTtl);
            logger.debug("Stored cart for user {} with {} items", userId, cart.getItems().size());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cart for user " + userId + " could not be serialized", e);
        }
    }

    @Override
    public void clear(String userId) {
        redisTemplate.delete(CART_PREFIX + userId);
        logger.debug("Cleared cart for user: {}", userId);
    }
}
