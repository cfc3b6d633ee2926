package com.vrfradar.query;

/**
 * Result-set view parameters: 1-based page, page size, filters and sort. Independent of block-window paging.
 */
public record QueryParams(
        int page,
        int pageSize,
        RequestFilters filters,
        SortField sortBy,
        SortDirection sortDirection
) {

    public static final int DEFAULT_PAGE_SIZE = 10;

    public QueryParams {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1: " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be >= 1: " + pageSize);
        }
        filters = filters != null ? filters : RequestFilters.NONE;
        sortBy = sortBy != null ? sortBy : SortField.TIMESTAMP;
        sortDirection = sortDirection != null ? sortDirection : SortDirection.DESC;
    }

    public static QueryParams defaults() {
        return new QueryParams(1, DEFAULT_PAGE_SIZE, RequestFilters.NONE, SortField.TIMESTAMP, SortDirection.DESC);
    }

    public QueryParams withPage(int newPage) {
        return new QueryParams(newPage, pageSize, filters, sortBy, sortDirection);
    }

    public QueryParams withPageSize(int newPageSize) {
        return new QueryParams(page, newPageSize, filters, sortBy, sortDirection);
    }

    /** New filters start again from page 1. */
    public QueryParams withFilters(RequestFilters newFilters) {
        return new QueryParams(1, pageSize, newFilters, sortBy, sortDirection);
    }

    /** A new sort order starts again from page 1. */
    public QueryParams withSort(SortField newSortBy, SortDirection newDirection) {
        return new QueryParams(1, pageSize, filters, newSortBy, newDirection);
    }
}
