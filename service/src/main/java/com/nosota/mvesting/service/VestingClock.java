package com.nosota.mvesting.service;

/**
 * Source of the logical vesting time.
 *
 * <p>Readings are epoch seconds and never decrease. Each operation reads the clock
 * exactly once at entry and uses that value throughout.
 */
public interface VestingClock {

    /**
     * @return current time in epoch seconds
     */
    long now();
}
