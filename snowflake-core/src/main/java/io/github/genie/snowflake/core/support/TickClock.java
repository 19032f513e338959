package io.github.genie.snowflake.core.support;

import java.time.Duration;
import java.time.Instant;

/**
 * Counts fixed-size ticks elapsed since a start time, on top of a {@link Clock}.
 */
public class TickClock {

    private final Clock clock;
    private final long startNanos;
    private final long tickNanos;

    public TickClock(Clock clock, Instant startTime, Duration tickUnit) {
        this(clock, Clock.toNanos(startTime), tickUnit.toNanos());
    }

    public TickClock(Clock clock, long startNanos, long tickNanos) {
        if (tickNanos <= 0) {
            throw new IllegalArgumentException("tick unit must be positive: " + tickNanos + "ns");
        }
        this.clock = clock;
        this.startNanos = startNanos;
        this.tickNanos = tickNanos;
    }

    public long currentTick() {
        return ticksSinceStart(clock.nanos());
    }

    /**
     * A distance too large for a {@code long} saturates to {@link Long#MAX_VALUE} or
     * {@link Long#MIN_VALUE} nanoseconds before dividing.
     */
    public long ticksSinceStart(long nanos) {
        long elapsed = nanos - startNanos;
        if (((nanos ^ startNanos) & (nanos ^ elapsed)) < 0) {
            elapsed = nanos > startNanos ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
        return Math.floorDiv(elapsed, tickNanos);
    }

    /**
     * Parks until the clock reaches the first nanosecond of {@code tick}, counting from the part of
     * the current tick that has already passed. Never waits longer than one tick unit.
     *
     * @return the nanoseconds the caller was scheduled to wait, zero if the tick was already reached
     */
    public long awaitTick(long tick) {
        long now = clock.nanos();
        long current = ticksSinceStart(now);
        if (tick <= current) {
            return 0;
        }
        long remaining = tick - current == 1
                ? tickNanos - Math.floorMod(now - startNanos, tickNanos)
                : tickNanos;
        long deadline = now + remaining;
        long left = remaining;
        while (left > 0) {
            clock.park(left);
            left = deadline - clock.nanos();
        }
        return remaining;
    }

    public Clock getClock() {
        return clock;
    }

    public long getStartNanos() {
        return startNanos;
    }

    public long getTickNanos() {
        return tickNanos;
    }

}
