package com.soora.shop.api.dto;

import java.util.List;

/**
 * One page of products.
 *
 * @author Soora Platform Team
 */
public class ProductListResponse {

    private List<ProductResponse> products;
    private PaginationResponse pagination;

    public ProductListResponse() {
    }

    public ProductListResponse(List<ProductResponse> products, PaginationResponse pagination) {
        this.products = products;
        this.pagination = pagination;
    }

    public List<ProductResponse> getProducts() {
        return products;
    }

    public void setProducts(List<ProductResponse> products) {
        this.products = products;
    }

    public PaginationResponse getPagination() {
        return pagination;
    }

    public void setPagination(PaginationResponse pagination) {
        this.pagination = pagination;
    }
}
