package com.vrfradar.api.dto;

import com.vrfradar.query.RequestStats;

public record RequestStatsResponse(
        int total,
        int pending,
        int fulfilled,
        int failed,
        double successRate,
        String totalFeePaid,
        String avgCallbackGasLimit
) {

    public static RequestStatsResponse from(RequestStats s) {
        return new RequestStatsResponse(s.total(), s.pending(), s.fulfilled(), s.failed(), s.successRate(),
                s.totalFeePaid().toString(), s.avgCallbackGasLimit().toString());
    }
}
