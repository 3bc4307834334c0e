package com.soora.shop.repository;

/**
 * Projection row: number of orders placed by one user.
 *
 * @author Soora Platform Team
 */
public class UserOrderCount {

    private final String userId;
    private final long orderCount;

    public UserOrderCount(String userId, Long orderCount) {
        this.userId = userId;
        this.orderCount = orderCount != null ? orderCount : 0L;
    }

    public String getUserId() {
        return userId;
    }

    public long getOrderCount() {
        return orderCount;
    }
}
