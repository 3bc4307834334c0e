package com.soora.shop.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Catalog entry.
 * Products are never deleted; deactivation flips {@code isActive} to false.
 *
 * @author Soora Platform Team
 */
@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_products_slug", columnList = "slug", unique = true),
    @Index(name = "idx_products_category", columnList = "category"),
    @Index(name = "idx_products_brand", columnList = "brand"),
    @Index(name = "idx_products_active", columnList = "is_active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    @Id
    @Column(name = "id", nullable = false, length = 36)
    private String id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    /**
     * URL slug derived from the name at creation time.
     */
    @Column(name = "slug", nullable = false, unique = true, length = 255)
    private String slug;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "stock", nullable = false)
    @Builder.Default
    private Integer stock = 0;

    /**
     * Category name (matches {@link Category#getName()}).
     */
    @Column(name = "category", length = 100)
    private String category;

    @Column(name = "brand", length = 100)
    private String brand;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "is_active", nullable = false)
    @Builder.Default
    private Boolean isActive = true;

    @Column(name = "is_featured", nullable = false)
    @Builder.Default
    private Boolean isFeatured = false;

    /**
     * Incremented once per single-product read. Never decreases.
     */
    @Column(name = "view_count", nullable = false)
    @Builder.Default
    private Integer viewCount = 0;

    /**
     * Units sold. Incremented when an order is placed. Never decreases.
     */
    @Column(name = "sales_count", nullable = false)
    @Builder.Default
    private Integer salesCount = 0;

    /**
     * Stock level at or below which the product counts as low stock.
     */
    @Column(name = "low_stock_alert", nullable = false)
    @Builder.Default
    private Integer lowStockAlert = 10;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * Check whether the requested quantity can be taken from stock.
     *
     * @param quantity Requested quantity
     * @return true if enough units are on hand
     */
    public boolean hasStockFor(int quantity) {
        return stock != null && stock >= quantity;
    }

    /**
     * Take units out of stock and count them as sold.
     *
     * @param quantity Units sold
     * @throws IllegalStateException if stock is insufficient
     */
    public void recordSale(int quantity) {
        if (!hasStockFor(quantity)) {
            throw new IllegalStateException("Insufficient stock for product " + id);
        }
        this.stock = stock - quantity;
        this.salesCount = (salesCount == null ? 0 : salesCount) + quantity;
    }

    public boolean isLowStock() {
        return stock != null && lowStockAlert != null && stock <= lowStockAlert;
    }
}
