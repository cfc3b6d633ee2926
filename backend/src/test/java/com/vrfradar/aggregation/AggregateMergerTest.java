package com.vrfradar.aggregation;

import com.vrfradar.domain.DomainEvent;
import com.vrfradar.domain.RandomnessRequest;
import com.vrfradar.domain.RequestStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.vrfradar.support.TestEvents.callbackFailed;
import static com.vrfradar.support.TestEvents.fulfilled;
import static com.vrfradar.support.TestEvents.requested;
import static com.vrfradar.support.TestLogs.timeOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregateMergerTest {

    private static final BigInteger ONE = BigInteger.ONE;
    private static final BigInteger TWO = BigInteger.TWO;

    private final AggregateMerger merger = new AggregateMerger(7_200);

    @Test
    @DisplayName("Requested creates a PENDING aggregate with provenance of the creating log")
    void requestedCreatesPending() {
        Map<BigInteger, RandomnessRequest> merged = merger.merge(Map.of(), List.of(requested(1, 1_000, 50, 2)));

        RandomnessRequest request = merged.get(ONE);
        assertThat(request.status()).isEqualTo(RequestStatus.PENDING);
        assertThat(request.blockNumber()).isEqualTo(50);
        assertThat(request.timestamp()).isEqualTo(timeOf(50));
        assertThat(request.deadline()).isEqualTo(timeOf(50) + 7_200);
        assertThat(request.fulfillment()).isEmpty();
    }

    @Test
    void fulfilledAndFailedMoveOutOfPending() {
        Map<BigInteger, RandomnessRequest> merged = merger.merge(Map.of(), List.of(
                requested(1, 1_000, 50, 0),
                requested(2, 1_000, 50, 1),
                fulfilled(1, 42, 51, 0),
                callbackFailed(2, 52, 0)));

        assertThat(merged.get(ONE).status()).isEqualTo(RequestStatus.FULFILLED);
        assertThat(merged.get(ONE).fulfillment()).get().satisfies(f -> {
            assertThat(f.randomness()).isEqualTo(BigInteger.valueOf(42));
            assertThat(f.blockNumber()).isEqualTo(51);
        });
        assertThat(merged.get(TWO).status()).isEqualTo(RequestStatus.FAILED);
        assertThat(merged.get(TWO).failure()).isPresent();
    }

    @Test
    @DisplayName("replaying the same events yields the same aggregates")
    void mergeIsIdempotent() {
        List<DomainEvent> events = List.of(
                requested(1, 1_000, 50, 0),
                fulfilled(1, 42, 51, 0),
                requested(2, 2_000, 53, 0));

        Map<BigInteger, RandomnessRequest> once = merger.merge(Map.of(), events);
        Map<BigInteger, RandomnessRequest> twice = merger.merge(once, events);
        List<DomainEvent> doubled = new ArrayList<>(events);
        doubled.addAll(events);

        assertThat(twice).isEqualTo(once);
        assertThat(merger.merge(Map.of(), doubled)).isEqualTo(once);
    }

    @Test
    @DisplayName("arrival order does not matter: events are applied in (block, logIndex) order")
    void orderIndependent() {
        List<DomainEvent> events = List.of(
                requested(1, 1_000, 50, 4),
                fulfilled(1, 42, 60, 0),
                callbackFailed(1, 61, 0),
                requested(2, 500, 50, 5),
                callbackFailed(2, 55, 1));
        Map<BigInteger, RandomnessRequest> expected = merger.merge(Map.of(), events);

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            List<DomainEvent> shuffled = new ArrayList<>(events);
            Collections.shuffle(shuffled, random);
            assertThat(merger.merge(Map.of(), shuffled)).isEqualTo(expected);
        }
        assertThat(expected.get(ONE).status()).isEqualTo(RequestStatus.FULFILLED);
        assertThat(expected.get(TWO).status()).isEqualTo(RequestStatus.FAILED);
    }

    @Test
    @DisplayName("a settled aggregate never returns to PENDING")
    void statusIsMonotonic() {
        Map<BigInteger, RandomnessRequest> fulfilledFirst = merger.merge(Map.of(), List.of(
                requested(1, 1_000, 50, 0),
                fulfilled(1, 42, 51, 0)));

        Map<BigInteger, RandomnessRequest> replayed = merger.merge(fulfilledFirst, List.of(
                requested(1, 9_999, 70, 0),
                callbackFailed(1, 71, 0),
                fulfilled(1, 43, 72, 0)));

        assertThat(replayed.get(ONE).status()).isEqualTo(RequestStatus.FULFILLED);
        assertThat(replayed.get(ONE).fulfillment().orElseThrow().randomness()).isEqualTo(BigInteger.valueOf(42));
        assertThat(replayed.get(ONE).feePaid()).isEqualTo(BigInteger.valueOf(1_000));
    }

    @Test
    @DisplayName("fulfilment or failure without a matching request is dropped")
    void orphansAreDropped() {
        Map<BigInteger, RandomnessRequest> merged = merger.merge(Map.of(), List.of(
                fulfilled(5, 42, 51, 0),
                callbackFailed(6, 52, 0),
                requested(1, 1_000, 50, 0)));

        assertThat(merged).containsOnlyKeys(ONE);
    }

    @Test
    void existingMapIsNotModified() {
        Map<BigInteger, RandomnessRequest> first = merger.merge(Map.of(), List.of(requested(1, 1_000, 50, 0)));

        Map<BigInteger, RandomnessRequest> second = merger.merge(first, List.of(fulfilled(1, 42, 51, 0)));

        assertThat(first.get(ONE).status()).isEqualTo(RequestStatus.PENDING);
        assertThat(second.get(ONE).status()).isEqualTo(RequestStatus.FULFILLED);
        assertThatThrownBy(() -> second.put(TWO, first.get(ONE))).isInstanceOf(UnsupportedOperationException.class);
    }
}
