package com.hkcraft.booking.repository;

import com.hkcraft.booking.domain.model.ProductStock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for the product stock ledger.
 *
 * @author Craft Booking Team
 */
@Repository
public interface ProductStockRepository extends JpaRepository<ProductStock, String> {

    /**
     * Plain read without locking. Suitable for advisory views only.
     *
     * @param productId Product ID
     * @return Optional containing the stock row if found
     */
    Optional<ProductStock> findByProductId(String productId);

    /**
     * Re-read a stock row under a pessimistic write lock.
     * Every reserve, release and adjustment goes through this method so that
     * the quantity checked is the quantity written.
     *
     * @param productId Product ID
     * @return Optional containing the locked stock row if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM ProductStock s WHERE s.productId = :productId")
    Optional<ProductStock> findByProductIdWithLock(@Param("productId") String productId);

    /**
     * Bulk fetch for cart summaries.
     *
     * @param productIds Product IDs
     * @return stock rows that exist
     */
    @Query("SELECT s FROM ProductStock s WHERE s.productId IN :productIds")
    List<ProductStock> findByProductIdIn(@Param("productIds") Collection<String> productIds);

    boolean existsByProductId(String productId);
}
