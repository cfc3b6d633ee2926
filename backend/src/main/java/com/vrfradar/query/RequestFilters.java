package com.vrfradar.query;

import com.vrfradar.domain.RequestStatus;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Optional predicates over request aggregates; a null field does not filter. Ranges are inclusive.
 */
public record RequestFilters(
        String requester,
        Set<RequestStatus> statuses,
        Long fromTimestamp,
        Long toTimestamp,
        BigInteger minCallbackGasLimit,
        BigInteger maxCallbackGasLimit
) {

    public static final RequestFilters NONE = new RequestFilters(null, null, null, null, null, null);

    public RequestFilters {
        statuses = statuses == null || statuses.isEmpty() ? null : Set.copyOf(statuses);
        if (fromTimestamp != null && toTimestamp != null && fromTimestamp > toTimestamp) {
            throw new IllegalArgumentException("fromTimestamp " + fromTimestamp + " is after toTimestamp " + toTimestamp);
        }
        if (minCallbackGasLimit != null && maxCallbackGasLimit != null
                && minCallbackGasLimit.compareTo(maxCallbackGasLimit) > 0) {
            throw new IllegalArgumentException("minCallbackGasLimit is above maxCallbackGasLimit");
        }
    }

    public static RequestFilters byStatus(RequestStatus... statuses) {
        Set<RequestStatus> set = statuses.length == 0 ? null : EnumSet.copyOf(Arrays.asList(statuses));
        return new RequestFilters(null, set, null, null, null, null);
    }

    public static RequestFilters byRequester(String requester) {
        return new RequestFilters(requester, null, null, null, null, null);
    }
}
