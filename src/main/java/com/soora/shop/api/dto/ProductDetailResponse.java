package com.soora.shop.api.dto;

import com.soora.shop.domain.model.Product;
import com.soora.shop.domain.model.Review;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Single product with its published reviews.
 *
 * @author Soora Platform Team
 */
public class ProductDetailResponse extends ProductResponse {

    private List<ReviewResponse> reviews;

    public ProductDetailResponse() {
    }

    /**
     * Create response from a product and its published reviews.
     *
     * @param product Product entity
     * @param reviews Published reviews, reviewer loaded
     * @return ProductDetailResponse
     */
    public static ProductDetailResponse fromEntity(Product product, List<Review> reviews) {
        ProductDetailResponse response = new ProductDetailResponse();
        response.copyFrom(product);
        response.setReviews(reviews.stream()
                .map(ReviewResponse::fromEntity)
                .collect(Collectors.toList()));
        return response;
    }

    public List<ReviewResponse> getReviews() {
        return reviews;
    }

    public void setReviews(List<ReviewResponse> reviews) {
        this.reviews = reviews;
    }
}
