package com.soora.shop.api.controller;

import com.soora.shop.api.dto.CategoryResponse;
import com.soora.shop.api.dto.ProductDetailResponse;
import com.soora.shop.api.dto.ProductListResponse;
import com.soora.shop.api.dto.ProductResponse;
import com.soora.shop.service.ProductQuery;
import com.soora.shop.service.ProductService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for the public catalog.
 * No authentication required.
 *
 * @author Soora Platform Team
 */
@RestController
@RequestMapping("/api/products")
public class ProductController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    /**
     * List active products.
     *
     * @param category Exact category; blank or "All" means no filter
     * @param brand Exact brand
     * @param minPrice Inclusive lower price bound
     * @param maxPrice Inclusive upper price bound
     * @param search Case-insensitive text in name, brand or description
     * @param page One-based page, default 1
     * @param limit Page size 1..100, default 20
     * @param sortBy createdAt, price, name, salesCount, viewCount or stock
     * @param order asc or desc
     * @return Products and pagination
     */
    @GetMapping
    public ResponseEntity<ProductListResponse> listProducts(
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String brand,
            @RequestParam(required = false) String minPrice,
            @RequestParam(required = false) String maxPrice,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String order
    ) {
        ProductQuery query = ProductQuery.fromParams(
                category, brand, minPrice, maxPrice, search, page, limit, sortBy, order);

        logger.debug("Listing products - category: {}, brand: {}, search: {}, page: {}",
                category, brand, search, query.getPageQuery().getPage());

        return ResponseEntity.ok(productService.listProducts(query));
    }

    /**
     * Get a product with its published reviews. Counts as one view.
     *
     * @param productId Product ID
     * @return Product detail
     */
    @GetMapping("/{productId}")
    public ResponseEntity<ProductDetailResponse> getProduct(@PathVariable String productId) {
        return ResponseEntity.ok(productService.getProductDetail(productId));
    }

    @GetMapping("/featured/list")
    public ResponseEntity<List<ProductResponse>> getFeaturedProducts() {
        return ResponseEntity.ok(productService.getFeaturedProducts());
    }

    @GetMapping("/categories/list")
    public ResponseEntity<List<CategoryResponse>> getCategories() {
        return ResponseEntity.ok(productService.getActiveCategories());
    }
}
