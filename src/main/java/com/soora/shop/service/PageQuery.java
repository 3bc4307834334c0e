package com.soora.shop.service;

import com.soora.shop.exception.InvalidRequestException;
import com.soora.shop.exception.InvalidRequestException.FieldViolation;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

import java.util.ArrayList;
import java.util.List;

/**
 * One-based page window taken from the {@code page} and {@code limit} query parameters.
 * Maps onto Spring Data's zero-based {@link PageRequest}: skip = (page - 1) * limit.
 *
 * @author Soora Platform Team
 */
public final class PageQuery {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private final int page;
    private final int limit;

    private PageQuery(int page, int limit) {
        this.page = page;
        this.limit = limit;
    }

    /**
     * Build a page window, applying defaults for missing values.
     *
     * @param page One-based page number, may be null
     * @param limit Page size, may be null
     * @return Validated page window
     * @throws InvalidRequestException if page is below 1, limit is outside [1, MAX_LIMIT],
     *         or the window starts beyond the largest offset Spring Data accepts
     */
    public static PageQuery of(Integer page, Integer limit) {
        int resolvedPage = page != null ? page : DEFAULT_PAGE;
        int resolvedLimit = limit != null ? limit : DEFAULT_LIMIT;

        List<FieldViolation> violations = new ArrayList<>();
        if (resolvedPage < 1) {
            violations.add(new FieldViolation("page", "Page must be a positive integer"));
        }
        if (resolvedLimit < 1 || resolvedLimit > MAX_LIMIT) {
            violations.add(new FieldViolation("limit", "Limit must be between 1 and " + MAX_LIMIT));
        } else if ((long) (resolvedPage - 1) * resolvedLimit > Integer.MAX_VALUE) {
            violations.add(new FieldViolation("page", "Page is out of range"));
        }
        if (!violations.isEmpty()) {
            throw new InvalidRequestException(violations);
        }
        return new PageQuery(resolvedPage, resolvedLimit);
    }

    public static PageQuery defaults() {
        return new PageQuery(DEFAULT_PAGE, DEFAULT_LIMIT);
    }

    public int getPage() {
        return page;
    }

    public int getLimit() {
        return limit;
    }

    public long getOffset() {
        return (long) (page - 1) * limit;
    }

    public Pageable toPageable() {
        return PageRequest.of(page - 1, limit);
    }

    public Pageable toPageable(Sort sort) {
        return PageRequest.of(page - 1, limit, sort);
    }

    /**
     * Number of pages needed for {@code total} rows: ceil(total / limit).
     *
     * @param total Total row count
     * @return Page count
     */
    public int totalPages(long total) {
        return (int) ((total + limit - 1) / limit);
    }
}
