package com.questrail.lightscan.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for discovery session deadlines.
 *
 * <h2>Binding invariant</h2>
 * The receive window of a discovery session MUST be measured on a monotonic
 * time source. Wall-clock time (e.g. {@code Instant.now()}) is permitted only
 * for observability timestamps.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>
     * Values are only meaningful for elapsed time computations.
     * </p>
     */
    long nowNanos();
}
