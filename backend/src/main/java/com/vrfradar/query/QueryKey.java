package com.vrfradar.query;

/**
 * Cache key: block-window page plus the result-set view parameters.
 */
public record QueryKey(int windowPage, QueryParams params) {

    public QueryKey {
        if (windowPage < 0) {
            throw new IllegalArgumentException("windowPage must be >= 0: " + windowPage);
        }
        if (params == null) {
            throw new IllegalArgumentException("params required");
        }
    }

    public boolean isLatestWindow() {
        return windowPage == 0;
    }
}
