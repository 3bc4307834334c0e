package com.soora.shop.api.dto;

import java.math.BigDecimal;
import java.util.List;

/**
 * Revenue summary over revenue-counting orders, with the orders themselves.
 *
 * @author Soora Platform Team
 */
public class SalesReportResponse {

    private BigDecimal totalRevenue;
    private Integer totalOrders;
    private BigDecimal averageOrderValue;
    private List<OrderResponse> orders;

    public SalesReportResponse() {
    }

    public SalesReportResponse(BigDecimal totalRevenue, Integer totalOrders,
                               BigDecimal averageOrderValue, List<OrderResponse> orders) {
        this.totalRevenue = totalRevenue;
        this.totalOrders = totalOrders;
        this.averageOrderValue = averageOrderValue;
        this.orders = orders;
    }

    public BigDecimal getTotalRevenue() {
        return totalRevenue;
    }

    public void setTotalRevenue(BigDecimal totalRevenue) {
        this.totalRevenue = totalRevenue;
    }

    public Integer getTotalOrders() {
        return totalOrders;
    }

    public void setTotalOrders(Integer totalOrders) {
        this.totalOrders = totalOrders;
    }

    public BigDecimal getAverageOrderValue() {
        return averageOrderValue;
    }

    public void setAverageOrderValue(BigDecimal averageOrderValue) {
        this.averageOrderValue = averageOrderValue;
    }

    public List<OrderResponse> getOrders() {
        return orders;
    }

    public void setOrders(List<OrderResponse> orders) {
        this.orders = orders;
    }
}
