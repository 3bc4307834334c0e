package com.soora.shop.api.dto;

import com.soora.shop.service.PageQuery;

/**
 * Page metadata returned next to every paginated list.
 *
 * @author Soora Platform Team
 */
public class PaginationResponse {

    private Integer page;
    private Integer limit;
    private Long total;
    private Integer pages;

    public PaginationResponse() {
    }

    public PaginationResponse(Integer page, Integer limit, Long total, Integer pages) {
        this.page = page;
        this.limit = limit;
        this.total = total;
        this.pages = pages;
    }

    /**
     * Build pagination metadata for a page window and a total row count.
     *
     * @param pageQuery Requested window
     * @param total Rows matching the filter
     * @return PaginationResponse with pages = ceil(total / limit)
     */
    public static PaginationResponse of(PageQuery pageQuery, long total) {
        return new PaginationResponse(
                pageQuery.getPage(),
                pageQuery.getLimit(),
                total,
                pageQuery.totalPages(total)
        );
    }

    public Integer getPage() {
        return page;
    }

    public void setPage(Integer page) {
        this.page = page;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Long getTotal() {
        return total;
    }

    public void setTotal(Long total) {
        this.total = total;
    }

    public Integer getPages() {
        return pages;
    }

    public void setPages(Integer pages) {
        this.pages = pages;
    }
}
