package com.hkcraft.booking.repository;

import com.hkcraft.booking.domain.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository for orders.
 *
 * @author Craft Booking Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String> {

    /**
     * Load an order under a pessimistic write lock so two cancellations of the
     * same order cannot both release its stock.
     *
     * @param orderId Order ID
     * @return Optional containing the locked order if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT o FROM Order o WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithLock(@Param("orderId") String orderId);

    List<Order> findByUserIdOrderByCreatedAtDesc(String userId);
}
