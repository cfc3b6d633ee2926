package com.vrfradar.query;

import com.vrfradar.domain.RandomnessRequest;
import com.vrfradar.domain.RequestStatus;

import java.math.BigInteger;
import java.util.Collection;

/**
 * Counts and totals over a set of requests. {@code successRate} is the fulfilled share in percent.
 */
public record RequestStats(
        int total,
        int pending,
        int fulfilled,
        int failed,
        double successRate,
        BigInteger totalFeePaid,
        BigInteger avgCallbackGasLimit
) {

    public static final RequestStats EMPTY = new RequestStats(0, 0, 0, 0, 0.0, BigInteger.ZERO, BigInteger.ZERO);

    public static RequestStats of(Collection<RandomnessRequest> requests) {
        if (requests.isEmpty()) {
            return EMPTY;
        }
        int pending = 0;
        int fulfilled = 0;
        int failed = 0;
        BigInteger fees = BigInteger.ZERO;
        BigInteger gas = BigInteger.ZERO;
        for (RandomnessRequest r : requests) {
            if (r.status() == RequestStatus.PENDING) {
                pending++;
            } else if (r.status() == RequestStatus.FULFILLED) {
                fulfilled++;
            } else {
                failed++;
            }
            fees = fees.add(r.feePaid());
            gas = gas.add(r.callbackGasLimit());
        }
        int total = requests.size();
        return new RequestStats(total, pending, fulfilled, failed,
                fulfilled * 100.0 / total, fees, gas.divide(BigInteger.valueOf(total)));
    }
}
