package io.github.genie.snowflake.core.exception;

/**
 * The time segment is exhausted for the configured start time and width. Terminal for the
 * generator: every later call fails the same way until it is rebuilt with a later start time
 * or a wider time segment.
 */
public class TimeLimitExceededException extends SnowflakeException {

    private final long elapsedTicks;
    private final long maxTicks;

    public TimeLimitExceededException(long elapsedTicks, long maxTicks) {
        super("over the time limit: elapsed ticks " + elapsedTicks + " > " + maxTicks);
        this.elapsedTicks = elapsedTicks;
        this.maxTicks = maxTicks;
    }

    public long getElapsedTicks() {
        return elapsedTicks;
    }

    public long getMaxTicks() {
        return maxTicks;
    }

}
