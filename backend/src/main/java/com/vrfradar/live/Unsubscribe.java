package com.vrfradar.live;

/**
 * Handle returned by a live subscription. Once {@link #unsubscribe()} returns, no further callback is delivered.
 */
@FunctionalInterface
public interface Unsubscribe {

    void unsubscribe();
}
