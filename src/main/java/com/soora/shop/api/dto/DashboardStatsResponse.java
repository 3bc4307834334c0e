package com.soora.shop.api.dto;

import java.math.BigDecimal;

/**
 * Headline numbers for the admin dashboard.
 *
 * @author Soora Platform Team
 */
public class DashboardStatsResponse {

    private Long totalOrders;
    private Long pendingOrders;
    private BigDecimal totalRevenue;
    private Long totalUsers;
    private Long lowStockProducts;

    public DashboardStatsResponse() {
    }

    public DashboardStatsResponse(Long totalOrders, Long pendingOrders, BigDecimal totalRevenue,
                                  Long totalUsers, Long lowStockProducts) {
        this.totalOrders = totalOrders;
        this.pendingOrders = pendingOrders;
        this.totalRevenue = totalRevenue;
        this.totalUsers = totalUsers;
        this.lowStockProducts = lowStockProducts;
    }

    public Long getTotalOrders() {
        return totalOrders;
    }

    public void setTotalOrders(Long totalOrders) {
        this.totalOrders = totalOrders;
    }

    public Long getPendingOrders() {
        return pendingOrders;
    }

    public void setPendingOrders(Long pendingOrders) {
        this.pendingOrders = pendingOrders;
    }

    public BigDecimal getTotalRevenue() {
        return totalRevenue;
    }

    public void setTotalRevenue(BigDecimal totalRevenue) {
        this.totalRevenue = totalRevenue;
    }

    public Long getTotalUsers() {
        return totalUsers;
    }

    public void setTotalUsers(Long totalUsers) {
        this.totalUsers = totalUsers;
    }

    public Long getLowStockProducts() {
        return lowStockProducts;
    }

    public void setLowStockProducts(Long lowStockProducts) {
        this.lowStockProducts = lowStockProducts;
    }
}
