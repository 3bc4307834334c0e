package com.soora.shop.repository;

import com.soora.shop.domain.model.Order;
import com.soora.shop.domain.model.Order.OrderStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;

/**
 * Repository interface for Order entity.
 * Provides data access methods for order management and reporting.
 *
 * @author Soora Platform Team
 */
@Repository
public interface OrderRepository extends JpaRepository<Order, String>,
        JpaSpecificationExecutor<Order> {

    /**
     * Find orders (optionally filtered) with the purchaser loaded.
     * Line items are loaded lazily in batches.
     *
     * @param spec Filter, may be null
     * @param pageable Page window and sort
     * @return Page of orders
     */
    @Override
    @EntityGraph(attributePaths = "user")
    Page<Order> findAll(Specification<Order> spec, Pageable pageable);

    /**
     * Find orders matching a filter with their items and products loaded.
     * Used by the sales report, which needs the whole result set in memory.
     *
     * @param spec Filter, may be null
     * @return Matching orders
     */
    @Override
    @EntityGraph(attributePaths = {"items", "items.product"})
    List<Order> findAll(Specification<Order> spec);

    /**
     * Find a user's orders, newest first.
     *
     * @param userId User ID
     * @param pageable Page window
     * @return Page of the user's orders
     */
    Page<Order> findByUserIdOrderByCreatedAtDesc(String userId, Pageable pageable);

    long countByStatus(OrderStatus status);

    /**
     * Sum order totals for the given statuses.
     *
     * @param statuses Statuses to include
     * @return Sum of totals, zero when no order matches
     */
    @Query("SELECT COALESCE(SUM(o.total), 0) FROM Order o WHERE o.status IN :statuses")
    BigDecimal sumTotalByStatusIn(@Param("statuses") Collection<OrderStatus> statuses);

    /**
     * Count orders per user for a set of users.
     *
     * @param userIds User IDs
     * @return One row per user that has at least one order
     */
    @Query("SELECT new com.soora.shop.repository.UserOrderCount(o.user.id, COUNT(o)) " +
           "FROM Order o WHERE o.user.id IN :userIds GROUP BY o.user.id")
    List<UserOrderCount> countOrdersByUserIds(@Param("userIds") Collection<String> userIds);
}
