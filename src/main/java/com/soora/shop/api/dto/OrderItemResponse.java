package com.soora.shop.api.dto;

import com.soora.shop.domain.model.OrderItem;

import java.math.BigDecimal;

/**
 * Order line with the product it refers to.
 *
 * @author Soora Platform Team
 */
public class OrderItemResponse {

    private String id;
    private Integer quantity;
    private BigDecimal price;
    private BigDecimal lineTotal;
    private ProductResponse product;

    public OrderItemResponse() {
    }

    public static OrderItemResponse fromEntity(OrderItem item) {
        OrderItemResponse response = new OrderItemResponse();
        response.setId(item.getId());
        response.setQuantity(item.getQuantity());
        response.setPrice(item.getPrice());
        response.setLineTotal(item.getLineTotal());
        if (item.getProduct() != null) {
            response.setProduct(ProductResponse.fromEntity(item.getProduct()));
        }
        return response;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public Integer getQuantity() {
        return quantity;
    }

    public void setQuantity(Integer quantity) {
        this.quantity = quantity;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public BigDecimal getLineTotal() {
        return lineTotal;
    }

    public void setLineTotal(BigDecimal lineTotal) {
        this.lineTotal = lineTotal;
    }

    public ProductResponse getProduct() {
        return product;
    }

    public void setProduct(ProductResponse product) {
        this.product = product;
    }
}
