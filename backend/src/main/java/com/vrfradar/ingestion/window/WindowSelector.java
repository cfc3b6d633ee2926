package com.vrfradar.ingestion.window;

import com.vrfradar.domain.WindowCursor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Backward paging over the chain in fixed-size block windows. Page 0 ends at the anchor height; page n ends
 * {@code n * windowSize} blocks earlier. The anchor height is supplied by the caller and must stay fixed for
 * a browsing session so a page always maps to the same range.
 */
@Slf4j
@Component
public class WindowSelector {

    static final long GENESIS_BLOCK = 0L;

    public WindowCursor select(long currentHeight, int pageIndex, long windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
        }
        if (pageIndex < 0) {
            throw new IllegalArgumentException("pageIndex must be >= 0: " + pageIndex);
        }
        if (currentHeight < GENESIS_BLOCK) {
            throw new IllegalArgumentException("currentHeight must be >= 0: " + currentHeight);
        }
        int lastPage = lastPageIndex(currentHeight, windowSize);
        if (pageIndex > lastPage) {
            log.debug("Window page {} is before genesis (height {}, window {}); using earliest page {}",
                    pageIndex, currentHeight, windowSize, lastPage);
            return cursor(currentHeight, lastPage, windowSize);
        }
        return cursor(currentHeight, pageIndex, windowSize);
    }

    /**
     * Index of the earliest window that still contains blocks at or after genesis.
     */
    public int lastPageIndex(long currentHeight, long windowSize) {
        return (int) Math.min(Integer.MAX_VALUE, (currentHeight - GENESIS_BLOCK) / windowSize);
    }

    private static WindowCursor cursor(long currentHeight, int pageIndex, long windowSize) {
        long toBlock = currentHeight - (long) pageIndex * windowSize;
        long unclampedFrom = toBlock - windowSize + 1;
        long fromBlock = Math.max(GENESIS_BLOCK, unclampedFrom);
        return new WindowCursor(fromBlock, toBlock, pageIndex, unclampedFrom > GENESIS_BLOCK);
    }
}
