package com.soora.shop.service;

import com.soora.shop.exception.InvalidRequestException;
import org.springframework.data.domain.Sort;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Product attributes a caller may sort the catalog by.
 * Request values are matched against {@link #getParam()}; nothing else reaches the query.
 *
 * @author Soora Platform Team
 */
public enum ProductSortField {
    CREATED_AT("createdAt"),
    PRICE("price"),
    NAME("name"),
    SALES_COUNT("salesCount"),
    VIEW_COUNT("viewCount"),
    STOCK("stock");

    public static final ProductSortField DEFAULT = CREATED_AT;

    private final String param;

    ProductSortField(String param) {
        this.param = param;
    }

    /**
     * Request value, also the entity attribute name.
     */
    public String getParam() {
        return param;
    }

    /**
     * Resolve the {@code sortBy} parameter.
     *
     * @param value Raw parameter, may be null
     * @return Matching field, or {@link #DEFAULT} when the parameter is absent
     * @throws InvalidRequestException for any value outside the allow-list
     */
    public static ProductSortField fromParam(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        return Arrays.stream(values())
                .filter(field -> field.param.equals(value))
                .findFirst()
                .orElseThrow(() -> new InvalidRequestException("sortBy",
                        "sortBy must be one of " + Arrays.stream(values())
                                .map(ProductSortField::getParam)
                                .collect(Collectors.joining(", "))));
    }

    /**
     * Resolve the {@code order} parameter. Defaults to descending.
     *
     * @param value "asc" or "desc", case-insensitive, may be null
     * @return Sort direction
     * @throws InvalidRequestException for any other value
     */
    public static Sort.Direction directionFromParam(String value) {
        if (value == null || value.isBlank()) {
            return Sort.Direction.DESC;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "asc":
                return Sort.Direction.ASC;
            case "desc":
                return Sort.Direction.DESC;
            default:
                throw new InvalidRequestException("order", "order must be asc or desc");
        }
    }

    public Sort toSort(Sort.Direction direction) {
        return Sort.by(direction, param);
    }
}
