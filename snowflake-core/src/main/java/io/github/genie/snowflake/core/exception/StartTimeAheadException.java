package io.github.genie.snowflake.core.exception;

import java.time.Instant;

public class StartTimeAheadException extends ConfigurationException {

    private final Instant startTime;

    public StartTimeAheadException(Instant startTime) {
        super("start time `" + startTime + "` is ahead of current time");
        this.startTime = startTime;
    }

    public Instant getStartTime() {
        return startTime;
    }

}
