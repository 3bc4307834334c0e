package com.soora.shop.repository;

import com.soora.shop.domain.model.Product;
import org.springframework.data.jpa.domain.Specification;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Criteria predicates for catalog listings.
 * Each factory returns {@code null} when its input is absent so callers can chain
 * them with {@link Specification#and(Specification)} unconditionally.
 *
 * @author Soora Platform Team
 */
public final class ProductSpecifications {

    /**
     * Category value the storefront sends for "no category filter".
     */
    public static final String ALL_CATEGORIES = "All";

    private ProductSpecifications() {
    }

    public static Specification<Product> isActive() {
        return (root, query, cb) -> cb.isTrue(root.get("isActive"));
    }

    public static Specification<Product> hasCategory(String category) {
        if (category == null || category.isBlank() || ALL_CATEGORIES.equals(category)) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("category"), category);
    }

    public static Specification<Product> hasBrand(String brand) {
        if (brand == null || brand.isBlank()) {
            return null;
        }
        return (root, query, cb) -> cb.equal(root.get("brand"), brand);
    }

    public static Specification<Product> priceAtLeast(BigDecimal minPrice) {
        if (minPrice == null) {
            return null;
        }
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("price"), minPrice);
    }

    public static Specification<Product> priceAtMost(BigDecimal maxPrice) {
        if (maxPrice == null) {
            return null;
        }
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("price"), maxPrice);
    }

    /**
     * Case-insensitive substring match on name, brand or description.
     *
     * @param search Free text from the search box
     * @return OR of the three LIKE predicates, or null when search is blank
     */
    public static Specification<Product> matchesText(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        String pattern = "%" + escapeLike(search.trim().toLowerCase(Locale.ROOT)) + "%";
        return (root, query, cb) -> cb.or(
                cb.like(cb.lower(root.get("name")), pattern, '\\'),
                cb.like(cb.lower(root.get("brand")), pattern, '\\'),
                cb.like(cb.lower(root.get("description")), pattern, '\\')
        );
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }
}
