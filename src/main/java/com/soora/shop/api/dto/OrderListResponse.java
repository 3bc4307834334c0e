package com.soora.shop.api.dto;

import java.util.List;

/**
 * One page of orders.
 *
 * @author Soora Platform Team
 */
public class OrderListResponse {

    private List<OrderResponse> orders;
    private PaginationResponse pagination;

    public OrderListResponse() {
    }

    public OrderListResponse(List<OrderResponse> orders, PaginationResponse pagination) {
        this.orders = orders;
        this.pagination = pagination;
    }

    public List<OrderResponse> getOrders() {
        return orders;
    }

    public void setOrders(List<OrderResponse> orders) {
        this.orders = orders;
    }

    public PaginationResponse getPagination() {
        return pagination;
    }

    public void setPagination(PaginationResponse pagination) {
        this.pagination = pagination;
    }
}
