package com.vrfradar.ingestion.window;

import com.vrfradar.domain.WindowCursor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowSelectorTest {

    private final WindowSelector selector = new WindowSelector();

    @Test
    @DisplayName("page 0 ends at the anchor height")
    void latestWindow() {
        WindowCursor cursor = selector.select(1_000, 0, 100);

        assertThat(cursor.fromBlock()).isEqualTo(901);
        assertThat(cursor.toBlock()).isEqualTo(1_000);
        assertThat(cursor.blockRange()).isEqualTo(100);
        assertThat(cursor.hasMorePages()).isTrue();
    }

    @Test
    @DisplayName("consecutive pages are contiguous and do not overlap")
    void pagesAreContiguous() {
        WindowCursor previous = selector.select(1_000, 0, 100);
        for (int page = 1; page <= 9; page++) {
            WindowCursor cursor = selector.select(1_000, page, 100);
            assertThat(cursor.toBlock()).isEqualTo(previous.fromBlock() - 1);
            assertThat(cursor.pageIndex()).isEqualTo(page);
            previous = cursor;
        }
    }

    @Test
    @DisplayName("the earliest window is clamped at genesis and has no more pages")
    void clampedAtGenesis() {
        WindowCursor cursor = selector.select(250, 2, 100);

        assertThat(cursor.fromBlock()).isZero();
        assertThat(cursor.toBlock()).isEqualTo(50);
        assertThat(cursor.hasMorePages()).isFalse();
    }

    @Test
    @DisplayName("a page before genesis maps to the earliest page")
    void pageBeyondGenesis() {
        WindowCursor cursor = selector.select(250, 7, 100);

        assertThat(cursor.pageIndex()).isEqualTo(2);
        assertThat(cursor.fromBlock()).isZero();
        assertThat(cursor.toBlock()).isEqualTo(50);
    }

    @Test
    void windowStartingExactlyAtGenesis_hasNoMorePages() {
        WindowCursor cursor = selector.select(199, 1, 100);

        assertThat(cursor.fromBlock()).isZero();
        assertThat(cursor.toBlock()).isEqualTo(99);
        assertThat(cursor.hasMorePages()).isFalse();
        assertThat(selector.lastPageIndex(199, 100)).isEqualTo(1);
    }

    @Test
    void invalidArguments_throw() {
        assertThatThrownBy(() -> selector.select(1_000, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(1_000, -1, 100)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> selector.select(-5, 0, 100)).isInstanceOf(IllegalArgumentException.class);
    }
}
