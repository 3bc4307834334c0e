package com.soora.shop.repository;

import com.soora.shop.domain.model.Category;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Category entity.
 *
 * @author Soora Platform Team
 */
@Repository
public interface CategoryRepository extends JpaRepository<Category, String> {

    /**
     * Find active categories in display order.
     *
     * @return Active categories, lowest sort order first
     */
    List<Category> findByIsActiveTrueOrderBySortOrderAsc();
}
