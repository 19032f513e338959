package io.github.genie.snowflake.core.exception;

/**
 * Base type of every failure raised while building or using a snowflake generator.
 */
public class SnowflakeException extends RuntimeException {

    public SnowflakeException(String message) {
        super(message);
    }

    public SnowflakeException(String message, Throwable cause) {
        super(message, cause);
    }

}
