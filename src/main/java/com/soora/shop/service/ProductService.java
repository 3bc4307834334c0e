package com.soora.shop.service;

import com.soora.shop.api.dto.CategoryResponse;
import com.soora.shop.api.dto.PaginationResponse;
import com.soora.shop.api.dto.ProductDetailResponse;
import com.soora.shop.api.dto.ProductListResponse;
import com.soora.shop.api.dto.ProductResponse;
import com.soora.shop.domain.model.Product;
import com.soora.shop.domain.model.Review;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.infrastructure.metrics.StoreMetricsService;
import com.soora.shop.repository.CategoryRepository;
import com.soora.shop.repository.ProductRepository;
import com.soora.shop.repository.ReviewRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service for the public catalog: filtered listings, product pages, featured
 * products and categories.
 *
 * @author Soora Platform Team
 */
@Service
public class ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductService.class);

    static final int FEATURED_LIMIT = 12;

    private final ProductRepository productRepository;
    private final ReviewRepository reviewRepository;
    private final CategoryRepository categoryRepository;
    private final StoreMetricsService metricsService;

    public ProductService(
            ProductRepository productRepository,
            ReviewRepository reviewRepository,
            CategoryRepository categoryRepository,
            StoreMetricsService metricsService
    ) {
        this.productRepository = productRepository;
        this.reviewRepository = reviewRepository;
        this.categoryRepository = categoryRepository;
        this.metricsService = metricsService;
    }

    /**
     * List active products matching the query.
     *
     * @param query Filters, sort and page window
     * @return One page of products plus pagination metadata
     */
    @Transactional(readOnly = true)
    public ProductListResponse listProducts(ProductQuery query) {
        long startTime = System.currentTimeMillis();

        Page<Product> page = productRepository.findAll(query.toSpecification(), query.toPageable());

        List<ProductResponse> products = page.getContent().stream()
                .map(ProductResponse::fromEntity)
                .collect(Collectors.toList());

        long duration = System.currentTimeMillis() - startTime;
        metricsService.recordQueryLatency("listProducts", duration);
        logger.debug("Listed {} of {} products (page {}) in {}ms",
                products.size(), page.getTotalElements(), query.getPageQuery().getPage(), duration);

        return new ProductListResponse(
                products,
                PaginationResponse.of(query.getPageQuery(), page.getTotalElements())
        );
    }

    /**
     * Get a product with its published reviews and count the view.
     * The response carries the view count as read, before this request's increment.
     *
     * @param productId Product ID
     * @return Product detail
     * @throws ResourceNotFoundException if the product does not exist
     */
    @Transactional
    public ProductDetailResponse getProductDetail(String productId) {
        Product product = productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));

        List<Review> reviews = reviewRepository.findByProductIdAndIsPublishedTrueOrderByCreatedAtDesc(productId);
        ProductDetailResponse response = ProductDetailResponse.fromEntity(product, reviews);

        productRepository.incrementViewCount(productId);
        metricsService.recordProductView();

        logger.debug("Fetched product: {} with {} published reviews", productId, reviews.size());
        return response;
    }

    /**
     * Get the best-selling featured products.
     *
     * @return Up to 12 active, featured products by sales count
     */
    @Transactional(readOnly = true)
    public List<ProductResponse> getFeaturedProducts() {
        return productRepository
                .findByIsFeaturedTrueAndIsActiveTrueOrderBySalesCountDesc(PageRequest.of(0, FEATURED_LIMIT))
                .stream()
                .map(ProductResponse::fromEntity)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<CategoryResponse> getActiveCategories() {
        return categoryRepository.findByIsActiveTrueOrderBySortOrderAsc().stream()
                .map(CategoryResponse::fromEntity)
                .collect(Collectors.toList());
    }
}
