package com.soora.shop.service;

import com.soora.shop.api.dto.PaginationResponse;
import com.soora.shop.api.dto.ProductCreateRequest;
import com.soora.shop.api.dto.ProductListResponse;
import com.soora.shop.api.dto.ProductResponse;
import com.soora.shop.api.dto.ProductUpdateRequest;
import com.soora.shop.domain.model.Product;
import com.soora.shop.exception.ResourceNotFoundException;
import com.soora.shop.repository.ProductRepository;
import com.soora.shop.repository.ProductSpecifications;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Catalog management for administrators.
 * Unlike {@link ProductService}, listings here include inactive products.
 *
 * @author Soora Platform Team
 */
@Service
public class AdminProductService {

    private static final Logger logger = LoggerFactory.getLogger(AdminProductService.class);

    private final ProductRepository productRepository;

    public AdminProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    /**
     * List all products, newest first, optionally filtered by free text.
     *
     * @param search Text matched against name, brand and description, may be null
     * @param pageQuery Page window
     * @return One page of products
     */
    @Transactional(readOnly = true)
    public ProductListResponse listProducts(String search, PageQuery pageQuery) {
        Specification<Product> spec = Specification.where(ProductSpecifications.matchesText(search));
        Page<Product> page = productRepository.findAll(
                spec, pageQuery.toPageable(Sort.by(Sort.Direction.DESC, "createdAt")));

        List<ProductResponse> products = page.getContent().stream()
                .map(ProductResponse::fromEntity)
                .collect(Collectors.toList());

        return new ProductListResponse(products, PaginationResponse.of(pageQuery, page.getTotalElements()));
    }

    /**
     * Create a product. The slug is derived from the name and suffixed when taken.
     *
     * @param request Validated product fields
     * @return Created product
     */
    @Transactional
    public ProductResponse createProduct(ProductCreateRequest request) {
        String slug = SlugGenerator.uniqueSlug(request.getName(), productRepository::existsBySlug);

        Product.ProductBuilder builder = Product.builder()
                .name(request.getName().trim())
                .slug(slug)
                .description(request.getDescription())
                .price(request.getPrice())
                .stock(request.getStock())
                .category(request.getCategory())
                .brand(request.getBrand())
                .imageUrl(request.getImageUrl());
        if (request.getIsFeatured() != null) {
            builder.isFeatured(request.getIsFeatured());
        }
        if (request.getLowStockAlert() != null) {
            builder.lowStockAlert(request.getLowStockAlert());
        }

        Product saved = productRepository.save(builder.build());
        logger.info("Created product: {} with slug: {}", saved.getId(), slug);
        return ProductResponse.fromEntity(saved);
    }

    /**
     * Apply the non-null fields of the request to a product.
     *
     * @throws ResourceNotFoundException if the product does not exist
     */
    @Transactional
    public ProductResponse updateProduct(String productId, ProductUpdateRequest request) {
        Product product = findProduct(productId);

        if (request.getName() != null) {
            product.setName(request.getName().trim());
        }
        if (request.getDescription() != null) {
            product.setDescription(request.getDescription());
        }
        if (request.getPrice() != null) {
            product.setPrice(request.getPrice());
        }
        if (request.getStock() != null) {
            product.setStock(request.getStock());
        }
        if (request.getCategory() != null) {
            product.setCategory(request.getCategory());
        }
        if (request.getBrand() != null) {
            product.setBrand(request.getBrand());
        }
        if (request.getImageUrl() != null) {
            product.setImageUrl(request.getImageUrl());
        }
        if (request.getIsActive() != null) {
            product.setIsActive(request.getIsActive());
        }
        if (request.getIsFeatured() != null) {
            product.setIsFeatured(request.getIsFeatured());
        }
        if (request.getLowStockAlert() != null) {
            product.setLowStockAlert(request.getLowStockAlert());
        }

        Product saved = productRepository.save(product);
        logger.info("Updated product: {}", productId);
        return ProductResponse.fromEntity(saved);
    }

    @Transactional
    public ProductResponse updateStock(String productId, int stock) {
        Product product = findProduct(productId);
        int previous = product.getStock();
        product.setStock(stock);

        Product saved = productRepository.save(product);
        logger.info("Set stock of product: {} from {} to {}", productId, previous, stock);
        if (saved.isLowStock()) {
            logger.warn("Product: {} is at or below its low stock alert ({} <= {})",
                    productId, saved.getStock(), saved.getLowStockAlert());
        }
        return ProductResponse.fromEntity(saved);
    }

    /**
     * Soft delete: the product disappears from the storefront but stays referenced by orders.
     *
     * @throws ResourceNotFoundException if the product does not exist
     */
    @Transactional
    public void deactivateProduct(String productId) {
        Product product = findProduct(productId);
        product.setIsActive(false);
        productRepository.save(product);
        logger.info("Deactivated product: {}", productId);
    }

    private Product findProduct(String productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
    }
}
