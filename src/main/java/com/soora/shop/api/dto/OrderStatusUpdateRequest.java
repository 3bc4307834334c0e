package com.soora.shop.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for moving an order to another status.
 * The value is checked against {@code Order.OrderStatus} by the service.
 *
 * @author Soora Platform Team
 */
public class OrderStatusUpdateRequest {

    @NotBlank(message = "Status is required")
    private String status;

    public OrderStatusUpdateRequest() {
    }

    public OrderStatusUpdateRequest(String status) {
        this.status = status;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
