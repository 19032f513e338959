package io.github.genie.snowflake.core.support;

import io.github.genie.snowflake.core.IdGenerator;
import io.github.genie.snowflake.core.exception.ClockMovedBackwardsException;
import io.github.genie.snowflake.core.exception.GeneratorPoisonedException;
import io.github.genie.snowflake.core.exception.SnowflakeException;
import io.github.genie.snowflake.core.exception.TimeLimitExceededException;
import io.github.genie.snowflake.core.log.Log;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Snowflake id generator. Ids of one instance are strictly increasing; ids of different
 * instances are distinct as long as every instance holds its own machine id / data center id
 * pair. Instances are thread safe and meant to be shared.
 * <p>
 * At most {@code 2^sequenceBits} ids are minted per tick. When a tick runs out of sequence
 * numbers the generator moves on to the next tick and the caller waits, at most one tick unit,
 * for the clock to reach it. A clock that moves backwards is absorbed the same way: the recorded
 * tick never decreases and the sequence keeps counting, unless a maximum backward drift is
 * configured.
 */
public class SnowflakeIdGenerator implements IdGenerator {

    public static final Instant DEFAULT_START_TIME = Instant.parse("2022-01-01T00:00:00Z");
    public static final Duration DEFAULT_TICK_UNIT = Duration.ofMillis(1);
    public static final long UNLIMITED_BACKWARD_DRIFT = -1;

    private static final Log log = Log.get(SnowflakeIdGenerator.class);

    private final Lock lock = new ReentrantLock();

    private final Layout layout;
    private final TickClock tickClock;
    private final Instant startTime;
    private final Duration tickUnit;
    private final long machineId;
    private final long dataCenterId;
    private final long maxBackwardTicks;

    private long elapsedTicks;
    private long sequence;
    private Throwable poisonedBy;
    private boolean timeLimitExceeded;

    SnowflakeIdGenerator(Layout layout,
                         Clock clock,
                         Instant startTime,
                         Duration tickUnit,
                         long machineId,
                         long dataCenterId,
                         long maxBackwardTicks) {
        this.layout = layout;
        this.tickClock = new TickClock(clock, startTime, tickUnit);
        this.startTime = startTime;
        this.tickUnit = tickUnit;
        this.machineId = machineId;
        this.dataCenterId = dataCenterId;
        this.maxBackwardTicks = maxBackwardTicks;
        log.info(() -> "snowflake generator created, machine_id=" + machineId
                       + ", data_center_id=" + dataCenterId
                       + ", start_time=" + startTime
                       + ", tick_unit=" + tickUnit
                       + ", " + layout);
    }

    public static SnowflakeBuilder builder() {
        return new SnowflakeBuilder();
    }

    public static SnowflakeIdGenerator create() {
        return builder().build();
    }

    /**
     * @throws TimeLimitExceededException  once the time segment is exhausted, on this and every
     *                                     later call
     * @throws ClockMovedBackwardsException if a maximum backward drift is configured and exceeded
     * @throws GeneratorPoisonedException  if an earlier call failed while holding the lock
     */
    @Override
    public long nextId() {
        lock.lock();
        try {
            if (poisonedBy != null) {
                throw new GeneratorPoisonedException(poisonedBy);
            }
            try {
                return next();
            } catch (SnowflakeException e) {
                throw e;
            } catch (RuntimeException | Error e) {
                poisonedBy = e;
                log.error("generator poisoned", e);
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private long next() {
        if (timeLimitExceeded) {
            throw new TimeLimitExceededException(elapsedTicks, layout.getMaxTime());
        }
        long current = tickClock.currentTick();
        if (current > elapsedTicks) {
            elapsedTicks = current;
            sequence = 0;
        } else {
            if (current < elapsedTicks) {
                checkBackwardDrift(elapsedTicks - current);
            }
            sequence = (sequence + 1) & layout.getMaxSequence();
            if (sequence == 0) {
                elapsedTicks++;
                long waited = tickClock.awaitTick(elapsedTicks);
                if (log.isTraceEnabled()) {
                    long tick = elapsedTicks;
                    log.trace(() -> "sequence exhausted, waited " + waited + "ns for tick " + tick);
                }
            }
        }
        if (elapsedTicks > layout.getMaxTime()) {
            timeLimitExceeded = true;
            log.error(() -> "time segment exhausted for start_time=" + startTime + ", " + layout);
            throw new TimeLimitExceededException(elapsedTicks, layout.getMaxTime());
        }
        return layout.pack(elapsedTicks, sequence, dataCenterId, machineId);
    }

    private void checkBackwardDrift(long drift) {
        if (maxBackwardTicks != UNLIMITED_BACKWARD_DRIFT && drift > maxBackwardTicks) {
            log.warn(() -> "clock moved backwards by " + drift + " ticks, refusing to generate id");
            throw new ClockMovedBackwardsException(drift, maxBackwardTicks);
        }
        log.debug(() -> "clock moved backwards by " + drift + " ticks");
    }

    public DecomposedId decompose(long id) {
        return layout.decompose(id);
    }

    /**
     * @return the instant of the tick the id was generated in
     */
    public Instant getTime(long id) {
        return startTime.plus(tickUnit.multipliedBy(decompose(id).getTime()));
    }

    public Layout getLayout() {
        return layout;
    }

    public long getMachineId() {
        return machineId;
    }

    public long getDataCenterId() {
        return dataCenterId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration getTickUnit() {
        return tickUnit;
    }

    public TickClock getTickClock() {
        return tickClock;
    }

    @Override
    public String toString() {
        return "SnowflakeIdGenerator{machineId=" + machineId
               + ", dataCenterId=" + dataCenterId
               + ", startTime=" + startTime
               + ", tickUnit=" + tickUnit
               + ", layout=" + layout + '}';
    }

}
