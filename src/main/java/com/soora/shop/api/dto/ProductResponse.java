package com.soora.shop.api.dto;

import com.soora.shop.domain.model.Product;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a catalog product.
 *
 * @author Soora Platform Team
 */
public class ProductResponse {

    private String id;
    private String name;
    private String slug;
    private String description;
    private BigDecimal price;
    private Integer stock;
    private String category;
    private String brand;
    private String imageUrl;
    private Boolean isActive;
    private Boolean isFeatured;
    private Integer viewCount;
    private Integer salesCount;
    private Integer lowStockAlert;
    private Instant createdAt;
    private Instant updatedAt;

    public ProductResponse() {
    }

    /**
     * Create response from Product entity.
     *
     * @param product Product entity
     * @return ProductResponse
     */
    public static ProductResponse fromEntity(Product product) {
        ProductResponse response = new ProductResponse();
        response.copyFrom(product);
        return response;
    }

    protected void copyFrom(Product product) {
        setId(product.getId());
        setName(product.getName());
        setSlug(product.getSlug());
        setDescription(product.getDescription());
        setPrice(product.getPrice());
        setStock(product.getStock());
        setCategory(product.getCategory());
        setBrand(product.getBrand());
        setImageUrl(product.getImageUrl());
        setIsActive(product.getIsActive());
        setIsFeatured(product.getIsFeatured());
        setViewCount(product.getViewCount());
        setSalesCount(product.getSalesCount());
        setLowStockAlert(product.getLowStockAlert());
        setCreatedAt(product.getCreatedAt());
        setUpdatedAt(product.getUpdatedAt());
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSlug() {
        return slug;
    }

    public void setSlug(String slug) {
        this.slug = slug;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public Integer getStock() {
        return stock;
    }

    public void setStock(Integer stock) {
        this.stock = stock;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getBrand() {
        return brand;
    }

    public void setBrand(String brand) {
        this.brand = brand;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public Boolean getIsActive() {
        return isActive;
    }

    public void setIsActive(Boolean isActive) {
        this.isActive = isActive;
    }

    public Boolean getIsFeatured() {
        return isFeatured;
    }

    public void setIsFeatured(Boolean isFeatured) {
        this.isFeatured = isFeatured;
    }

    public Integer getViewCount() {
        return viewCount;
    }

    public void setViewCount(Integer viewCount) {
        this.viewCount = viewCount;
    }

    public Integer getSalesCount() {
        return salesCount;
    }

    public void setSalesCount(Integer salesCount) {
        this.salesCount = salesCount;
    }

    public Integer getLowStockAlert() {
        return lowStockAlert;
    }

    public void setLowStockAlert(Integer lowStockAlert) {
        this.lowStockAlert = lowStockAlert;
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
}
