package com.soora.shop.repository;

import com.soora.shop.domain.model.Product;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import jakarta.persistence.LockModeType;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Product entity.
 * Dynamic catalog filters go through {@link JpaSpecificationExecutor} with
 * {@link ProductSpecifications}.
 *
 * @author Soora Platform Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, String>,
        JpaSpecificationExecutor<Product> {

    /**
     * Find active, featured products ordered by sales.
     *
     * @param pageable Window (the storefront asks for the first 12)
     * @return Featured products, best sellers first
     */
    List<Product> findByIsFeaturedTrueAndIsActiveTrueOrderBySalesCountDesc(Pageable pageable);

    boolean existsBySlug(String slug);

    /**
     * Find product by ID with pessimistic write lock.
     * Checkout reads stock and decrements it under this lock so concurrent orders
     * cannot both take the last units.
     *
     * @param id Product ID
     * @return Optional containing the product if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Product p WHERE p.id = :id")
    Optional<Product> findByIdForUpdate(@Param("id") String id);

    /**
     * Atomically add one to the view counter.
     *
     * @param id Product ID
     * @return Number of rows updated (0 if the product does not exist)
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Product p SET p.viewCount = p.viewCount + 1 WHERE p.id = :id")
    int incrementViewCount(@Param("id") String id);

    /**
     * Count products whose stock is at or below their own alert threshold.
     *
     * @return Number of low-stock products
     */
    @Query("SELECT COUNT(p) FROM Product p WHERE p.stock <= p.lowStockAlert")
    long countLowStockProducts();
}
