package com.vrfradar.domain;

import com.vrfradar.support.TestEvents;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.vrfradar.support.TestLogs.timeOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomnessRequestTest {

    private final RandomnessRequest pending = RandomnessRequest.pending(TestEvents.requested(1, 1_000, 10, 0), 7_200);

    @Test
    void deadlineIsCreationTimePlusOffset() {
        Instant beforeDeadline = Instant.ofEpochSecond(timeOf(10) + 100);
        Instant afterDeadline = Instant.ofEpochSecond(timeOf(10) + 7_201);

        assertThat(pending.deadline()).isEqualTo(timeOf(10) + 7_200);
        assertThat(pending.secondsUntilDeadline(beforeDeadline)).isEqualTo(7_100);
        assertThat(pending.isFulfillable(beforeDeadline)).isFalse();
        assertThat(pending.isFulfillable(afterDeadline)).isTrue();
        assertThat(pending.secondsUntilDeadline(afterDeadline)).isNegative();
    }

    @Test
    void settledRequests_areNotFulfillable_andCannotTransitionAgain() {
        RandomnessRequest fulfilled = pending.fulfilled(TestEvents.fulfilled(1, 42, 11, 0));

        assertThat(fulfilled.isFulfillable(Instant.ofEpochSecond(timeOf(10) + 10_000))).isFalse();
        assertThat(fulfilled.transactionHash()).isEqualTo(pending.transactionHash());
        assertThatThrownBy(() -> fulfilled.failed(TestEvents.callbackFailed(1, 12, 0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void blockRefRejectsNegativeNumbers() {
        assertThatThrownBy(() -> new BlockRef(-1, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
