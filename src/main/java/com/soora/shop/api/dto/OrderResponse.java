package com.soora.shop.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.soora.shop.domain.model.Order;
import com.soora.shop.domain.model.ShippingAddress;
import com.soora.shop.domain.model.User;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Response DTO for an order with its items and shipping snapshot.
 * {@code user} (purchaser contact) is only filled on admin views.
 *
 * @author Soora Platform Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderResponse {

    private String id;
    private Order.OrderStatus status;
    private BigDecimal subtotal;
    private BigDecimal deliveryFee;
    private BigDecimal total;
    private String notes;
    private ShippingAddress shippingAddress;
    private List<OrderItemResponse> items;
    private Purchaser user;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant deliveredAt;

    public OrderResponse() {
    }

    /**
     * Create response from Order entity without purchaser details.
     *
     * @param order Order entity
     * @return OrderResponse
     */
    public static OrderResponse fromEntity(Order order) {
        OrderResponse response = new OrderResponse();
        response.setId(order.getId());
        response.setStatus(order.getStatus());
        response.setSubtotal(order.getSubtotal());
        response.setDeliveryFee(order.getDeliveryFee());
        response.setTotal(order.getTotal());
        response.setNotes(order.getNotes());
        response.setShippingAddress(order.getShippingAddress());
        response.setItems(order.getItems().stream()
                .map(OrderItemResponse::fromEntity)
                .collect(Collectors.toList()));
        response.setCreatedAt(order.getCreatedAt());
        response.setUpdatedAt(order.getUpdatedAt());
        response.setDeliveredAt(order.getDeliveredAt());
        return response;
    }

    /**
     * Create response including purchaser name, email and phone.
     *
     * @param order Order entity with user loaded
     * @return OrderResponse
     */
    public static OrderResponse fromEntityWithPurchaser(Order order) {
        OrderResponse response = fromEntity(order);
        User user = order.getUser();
        if (user != null) {
            response.setUser(new Purchaser(user.getName(), user.getEmail(), user.getPhone()));
        }
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Order.OrderStatus getStatus() {
        return status;
    }

    public void setStatus(Order.OrderStatus status) {
        this.status = status;
    }

    public BigDecimal getSubtotal() {
        return subtotal;
    }

    public void setSubtotal(BigDecimal subtotal) {
        this.subtotal = subtotal;
    }

    public BigDecimal getDeliveryFee() {
        return deliveryFee;
    }

    public void setDeliveryFee(BigDecimal deliveryFee) {
        this.deliveryFee = deliveryFee;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public void setTotal(BigDecimal total) {
        this.total = total;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public ShippingAddress getShippingAddress() {
        return shippingAddress;
    }

    public void setShippingAddress(ShippingAddress shippingAddress) {
        this.shippingAddress = shippingAddress;
    }

    public List<OrderItemResponse> getItems() {
        return items;
    }

    public void setItems(List<OrderItemResponse> items) {
        this.items = items;
    }

    public Purchaser getUser() {
        return user;
    }

    public void setUser(Purchaser user) {
        this.user = user;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getDeliveredAt() {
        return deliveredAt;
    }

    public void setDeliveredAt(Instant deliveredAt) {
        this.deliveredAt = deliveredAt;
    }

    public static class Purchaser {
        private String name;
        private String email;
        private String phone;

        public Purchaser() {
        }

        public Purchaser(String name, String email, String phone) {
            this.name = name;
            this.email = email;
            this.phone = phone;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getPhone() {
            return phone;
        }

        public void setPhone(String phone) {
            this.phone = phone;
        }
    }
}
