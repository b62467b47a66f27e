package com.hkcraft.booking.repository;

import com.hkcraft.booking.domain.model.StockRelease;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for applied stock releases, keyed by idempotency key.
 *
 * @author Craft Booking Team
 */
@Repository
public interface StockReleaseRepository extends JpaRepository<StockRelease, String> {

    boolean existsByIdempotencyKey(String idempotencyKey);

    List<StockRelease> findByProductId(String productId);
}
