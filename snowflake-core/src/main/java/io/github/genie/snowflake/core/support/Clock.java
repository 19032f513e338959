package io.github.genie.snowflake.core.support;

import java.time.Instant;
import java.util.concurrent.locks.LockSupport;

/**
 * Wall-clock time source of a generator. Replace it to drive a generator deterministically.
 */
public interface Clock {

    Clock DEFAULT = () -> toNanos(Instant.now());

    /**
     * @return nanoseconds since 1970-01-01T00:00:00Z
     */
    long nanos();

    /**
     * Blocks the calling thread for up to {@code nanos} nanoseconds. May return early.
     */
    default void park(long nanos) {
        LockSupport.parkNanos(nanos);
    }

    static long toNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    static Instant toInstant(long nanos) {
        return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
    }

}
