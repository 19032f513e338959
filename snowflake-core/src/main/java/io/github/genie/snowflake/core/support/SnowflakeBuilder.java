package io.github.genie.snowflake.core.support;

import io.github.genie.snowflake.core.exception.ConfigurationException;
import io.github.genie.snowflake.core.exception.IdentityCheckException;
import io.github.genie.snowflake.core.exception.IdentityField;
import io.github.genie.snowflake.core.exception.IdentityOutOfRangeException;
import io.github.genie.snowflake.core.exception.IdentitySourceException;
import io.github.genie.snowflake.core.exception.StartTimeAheadException;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.function.LongPredicate;

/**
 * Fluent configuration of a {@link SnowflakeIdGenerator}. Unset values fall back to the defaults
 * of {@link SnowflakeIdGenerator} and {@link Layout#DEFAULT}; both identities default to 0.
 */
public class SnowflakeBuilder {

    private Instant startTime;
    private Duration tickUnit = SnowflakeIdGenerator.DEFAULT_TICK_UNIT;
    private Clock clock = Clock.DEFAULT;
    private IdentitySource machineId = IdentitySource.of(0);
    private IdentitySource dataCenterId = IdentitySource.of(0);
    private LongPredicate checkMachineId;
    private LongPredicate checkDataCenterId;
    private Duration maxBackwardDrift;
    private int timeBits = Layout.DEFAULT_TIME_BITS;
    private int sequenceBits = Layout.DEFAULT_SEQUENCE_BITS;
    private int dataCenterIdBits = Layout.DEFAULT_DATA_CENTER_ID_BITS;
    private int machineIdBits = Layout.DEFAULT_MACHINE_ID_BITS;

    SnowflakeBuilder() {
    }

    /**
     * Sets the start time ids count their ticks from. Must not be ahead of the clock.
     */
    public SnowflakeBuilder startTime(@NotNull Instant startTime) {
        this.startTime = Objects.requireNonNull(startTime);
        return this;
    }

    public SnowflakeBuilder tickUnit(@NotNull Duration tickUnit) {
        this.tickUnit = Objects.requireNonNull(tickUnit);
        return this;
    }

    public SnowflakeBuilder clock(@NotNull Clock clock) {
        this.clock = Objects.requireNonNull(clock);
        return this;
    }

    public SnowflakeBuilder machineId(@NotNull IdentitySource machineId) {
        this.machineId = Objects.requireNonNull(machineId);
        return this;
    }

    public SnowflakeBuilder machineId(long machineId) {
        return machineId(IdentitySource.of(machineId));
    }

    public SnowflakeBuilder dataCenterId(@NotNull IdentitySource dataCenterId) {
        this.dataCenterId = Objects.requireNonNull(dataCenterId);
        return this;
    }

    public SnowflakeBuilder dataCenterId(long dataCenterId) {
        return dataCenterId(IdentitySource.of(dataCenterId));
    }

    public SnowflakeBuilder checkMachineId(LongPredicate checkMachineId) {
        this.checkMachineId = checkMachineId;
        return this;
    }

    public SnowflakeBuilder checkDataCenterId(LongPredicate checkDataCenterId) {
        this.checkDataCenterId = checkDataCenterId;
        return this;
    }

    /**
     * Fails {@code nextId()} with {@code ClockMovedBackwardsException} when the clock reads more
     * than {@code maxBackwardDrift} behind the last recorded tick. {@code null} absorbs any drift.
     */
    public SnowflakeBuilder maxBackwardDrift(Duration maxBackwardDrift) {
        this.maxBackwardDrift = maxBackwardDrift;
        return this;
    }

    public SnowflakeBuilder layout(@NotNull Layout layout) {
        this.timeBits = layout.getTimeBits();
        this.sequenceBits = layout.getSequenceBits();
        this.dataCenterIdBits = layout.getDataCenterIdBits();
        this.machineIdBits = layout.getMachineIdBits();
        return this;
    }

    public SnowflakeBuilder bitLenTime(int timeBits) {
        this.timeBits = timeBits;
        return this;
    }

    public SnowflakeBuilder bitLenSequence(int sequenceBits) {
        this.sequenceBits = sequenceBits;
        return this;
    }

    public SnowflakeBuilder bitLenDataCenterId(int dataCenterIdBits) {
        this.dataCenterIdBits = dataCenterIdBits;
        return this;
    }

    public SnowflakeBuilder bitLenMachineId(int machineIdBits) {
        this.machineIdBits = machineIdBits;
        return this;
    }

    /**
     * Validates the configuration, resolves both identities and creates the generator.
     *
     * @throws io.github.genie.snowflake.core.exception.InvalidBitLengthException if the widths do
     *                                                                           not add up to 63
     * @throws StartTimeAheadException      if the start time is ahead of the clock
     * @throws ConfigurationException       if the tick unit is not positive or the start time is
     *                                      not representable in nanoseconds since 1970
     * @throws IdentitySourceException      if an identity source fails
     * @throws IdentityOutOfRangeException  if an identity does not fit its segment
     * @throws IdentityCheckException       if an identity check rejects the identity
     */
    public SnowflakeIdGenerator build() {
        Layout layout = Layout.of(timeBits, sequenceBits, dataCenterIdBits, machineIdBits);
        if (tickUnit.isNegative() || tickUnit.isZero()) {
            throw new ConfigurationException("tick unit must be positive: " + tickUnit);
        }
        Instant start = resolveStartTime();
        long machine = resolve(IdentityField.MACHINE_ID, machineId, layout.getMaxMachineId(), checkMachineId);
        long dataCenter = resolve(IdentityField.DATA_CENTER_ID, dataCenterId, layout.getMaxDataCenterId(), checkDataCenterId);
        return new SnowflakeIdGenerator(
                layout,
                clock,
                start,
                tickUnit,
                machine,
                dataCenter,
                resolveMaxBackwardTicks()
        );
    }

    private Instant resolveStartTime() {
        if (startTime == null) {
            return SnowflakeIdGenerator.DEFAULT_START_TIME;
        }
        if (startTime.isAfter(Clock.toInstant(clock.nanos()))) {
            throw new StartTimeAheadException(startTime);
        }
        try {
            Clock.toNanos(startTime);
        } catch (ArithmeticException e) {
            throw new ConfigurationException("start time `" + startTime + "` is outside the range of the clock", e);
        }
        return startTime;
    }

    private long resolveMaxBackwardTicks() {
        if (maxBackwardDrift == null) {
            return SnowflakeIdGenerator.UNLIMITED_BACKWARD_DRIFT;
        }
        if (maxBackwardDrift.isNegative()) {
            throw new ConfigurationException("max backward drift must not be negative: " + maxBackwardDrift);
        }
        return maxBackwardDrift.toNanos() / tickUnit.toNanos();
    }

    private static long resolve(IdentityField field, IdentitySource source, long max, LongPredicate check) {
        long value;
        try {
            value = source.resolve();
        } catch (Exception e) {
            throw new IdentitySourceException(field, e);
        }
        if (value < 0 || value > max) {
            throw new IdentityOutOfRangeException(field, value, max);
        }
        if (check != null && !check.test(value)) {
            throw new IdentityCheckException(field, value);
        }
        return value;
    }

}
