package com.soora.shop.repository;

import com.soora.shop.domain.model.Review;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository interface for Review entity.
 *
 * @author Soora Platform Team
 */
@Repository
public interface ReviewRepository extends JpaRepository<Review, String> {

    /**
     * Find published reviews of a product with their reviewers loaded.
     *
     * @param productId Product ID
     * @return Published reviews, newest first
     */
    @EntityGraph(attributePaths = "user")
    List<Review> findByProductIdAndIsPublishedTrueOrderByCreatedAtDesc(String productId);
}
