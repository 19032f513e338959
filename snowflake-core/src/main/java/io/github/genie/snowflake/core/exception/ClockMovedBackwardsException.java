package io.github.genie.snowflake.core.exception;

public class ClockMovedBackwardsException extends SnowflakeException {

    private final long driftTicks;

    public ClockMovedBackwardsException(long driftTicks, long toleranceTicks) {
        super("clock moved backwards by " + driftTicks + " ticks, tolerance is " + toleranceTicks);
        this.driftTicks = driftTicks;
    }

    public long getDriftTicks() {
        return driftTicks;
    }

}
