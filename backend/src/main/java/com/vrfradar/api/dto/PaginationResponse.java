package com.vrfradar.api.dto;

import com.vrfradar.query.PageResult;

public record PaginationResponse(
        int totalItems,
        int currentPage,
        int pageSize,
        boolean hasNextPage,
        boolean hasPreviousPage
) {

    public static PaginationResponse from(PageResult<?> page) {
        return new PaginationResponse(page.totalItems(), page.currentPage(), page.pageSize(),
                page.hasNextPage(), page.hasPreviousPage());
    }
}
