package com.nosota.mvesting.service;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link VestingClock} backed by the system UTC clock.
 * A wall clock stepped backwards is held at the last reading.
 */
@Component
public class SystemVestingClock implements VestingClock {

    private final Clock clock;
    private final AtomicLong lastReading = new AtomicLong();

    public SystemVestingClock() {
        this(Clock.systemUTC());
    }

    SystemVestingClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public long now() {
        long reading = clock.instant().getEpochSecond();
        return lastReading.accumulateAndGet(reading, Math::max);
    }
}
