package io.github.genie.snowflake.core.exception;

/**
 * Raised at build time. Retrying without changing the inputs fails the same way.
 */
public class ConfigurationException extends SnowflakeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

}
