package com.vrfradar.api.dto;

import com.vrfradar.query.RequestQueryResult;

import java.time.Instant;
import java.util.List;

/**
 * GET /api/v1/requests response. On a ledger failure {@code error} is set and {@code data} holds the last
 * successful page, if any.
 */
public record RequestPageResponse(
        List<RandomnessRequestResponse> data,
        PaginationResponse pagination,
        boolean loading,
        String error,
        RequestStatsResponse stats,
        BlockWindowResponse window,
        Instant fetchedAt
) {

    public static RequestPageResponse from(RequestQueryResult result, Instant now) {
        return new RequestPageResponse(
                result.data().data().stream()
                        .map(r -> RandomnessRequestResponse.from(r, now))
                        .toList(),
                PaginationResponse.from(result.data()),
                result.loading(),
                result.hasError() ? result.error().getMessage() : null,
                RequestStatsResponse.from(result.stats()),
                result.window() != null ? BlockWindowResponse.from(result.window()) : null,
                result.fetchedAt());
    }
}
