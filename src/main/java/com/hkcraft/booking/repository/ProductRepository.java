package com.hkcraft.booking.repository;

import com.hkcraft.booking.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for product listings.
 *
 * @author Craft Booking Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, String> {

    List<Product> findByCraftsmanId(String craftsmanId);

    List<Product> findByProductIdIn(Collection<String> productIds);
}
