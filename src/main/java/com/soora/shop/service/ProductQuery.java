package com.soora.shop.service;

import com.soora.shop.domain.model.Product;
import com.soora.shop.exception.InvalidRequestException;
import com.soora.shop.repository.ProductSpecifications;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;

/**
 * Parsed catalog listing request: filters, sort and page window.
 *
 * @author Soora Platform Team
 */
public class ProductQuery {

    private final String category;
    private final String brand;
    private final BigDecimal minPrice;
    private final BigDecimal maxPrice;
    private final String search;
    private final ProductSortField sortField;
    private final Sort.Direction direction;
    private final PageQuery pageQuery;

    public ProductQuery(
            String category,
            String brand,
            BigDecimal minPrice,
            BigDecimal maxPrice,
            String search,
            ProductSortField sortField,
            Sort.Direction direction,
            PageQuery pageQuery
    ) {
        this.category = category;
        this.brand = brand;
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.search = search;
        this.sortField = sortField != null ? sortField : ProductSortField.DEFAULT;
        this.direction = direction != null ? direction : Sort.Direction.DESC;
        this.pageQuery = pageQuery != null ? pageQuery : PageQuery.defaults();
    }

    /**
     * Build a query from raw request parameters.
     *
     * @throws InvalidRequestException if a price, sort or page parameter is malformed
     */
    public static ProductQuery fromParams(
            String category,
            String brand,
            String minPrice,
            String maxPrice,
            String search,
            Integer page,
            Integer limit,
            String sortBy,
            String order
    ) {
        return new ProductQuery(
                category,
                brand,
                parsePrice("minPrice", minPrice),
                parsePrice("maxPrice", maxPrice),
                search,
                ProductSortField.fromParam(sortBy),
                ProductSortField.directionFromParam(order),
                PageQuery.of(page, limit)
        );
    }

    /**
     * Predicate for the public catalog. Inactive products are always excluded.
     */
    public Specification<Product> toSpecification() {
        return Specification.where(ProductSpecifications.isActive())
                .and(ProductSpecifications.hasCategory(category))
                .and(ProductSpecifications.hasBrand(brand))
                .and(ProductSpecifications.priceAtLeast(minPrice))
                .and(ProductSpecifications.priceAtMost(maxPrice))
                .and(ProductSpecifications.matchesText(search));
    }

    public Pageable toPageable() {
        return pageQuery.toPageable(sortField.toSort(direction));
    }

    private static BigDecimal parsePrice(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            BigDecimal price = new BigDecimal(value.trim());
            if (price.signum() < 0) {
                throw new InvalidRequestException(field, field + " must not be negative");
            }
            return price;
        } catch (NumberFormatException e) {
            throw new InvalidRequestException(field, field + " must be a number");
        }
    }

    public String getCategory() {
        return category;
    }

    public String getBrand() {
        return brand;
    }

    public BigDecimal getMinPrice() {
        return minPrice;
    }

    public BigDecimal getMaxPrice() {
        return maxPrice;
    }

    public String getSearch() {
        return search;
    }

    public ProductSortField getSortField() {
        return sortField;
    }

    public Sort.Direction getDirection() {
        return direction;
    }

    public PageQuery getPageQuery() {
        return pageQuery;
    }
}
