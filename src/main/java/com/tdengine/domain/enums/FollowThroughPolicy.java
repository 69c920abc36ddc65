package com.tdengine.domain.enums;

/**
 * What happens to the post-Setup-9 follow-through counters
 * ({@code barsSinceSetup9}, {@code highestCloseSinceSetup9}) when the Setup run breaks.
 *
 * <p>STICKY keeps advancing both counters across later, unrelated runs until the next
 * Setup 9 re-seeds them. Historical outputs were produced this way. RESET_ON_BREAK
 * zeroes them the bar the run breaks.
 */
public enum FollowThroughPolicy {
    STICKY,
    RESET_ON_BREAK
}
