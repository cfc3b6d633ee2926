package com.vrfradar.query;

import java.util.List;

/**
 * One page of a filtered, sorted result set. {@code totalItems} counts the filtered set, not the page.
 */
public record PageResult<T>(
        List<T> data,
        int totalItems,
        int currentPage,
        int pageSize,
        boolean hasNextPage,
        boolean hasPreviousPage
) {

    public PageResult {
        data = List.copyOf(data);
    }

    public static <T> PageResult<T> empty(int page, int pageSize) {
        return new PageResult<>(List.of(), 0, page, pageSize, false, page > 1);
    }
}
