package com.soora.shop.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for placing an order.
 * Without {@code addressId} the caller's default address is used.
 *
 * @author Soora Platform Team
 */
public class CreateOrderRequest {

    @NotEmpty(message = "Order must contain at least one item")
    @Valid
    private List<OrderItemRequest> items;

    private String addressId;

    @Size(max = 500, message = "Notes must be at most 500 characters")
    private String notes;

    public CreateOrderRequest() {
    }

    public CreateOrderRequest(List<OrderItemRequest> items, String addressId, String notes) {
        this.items = items;
        this.addressId = addressId;
        this.notes = notes;
    }

    public List<OrderItemRequest> getItems() {
        return items;
    }

    public void setItems(List<OrderItemRequest> items) {
        this.items = items;
    }

    public String getAddressId() {
        return addressId;
    }

    public void setAddressId(String addressId) {
        this.addressId = addressId;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
