package io.github.genie.snowflake.core.exception;

/**
 * A previous call terminated abnormally while holding the generator lock, so its state may be
 * inconsistent. The failure of that call is the cause.
 */
public class GeneratorPoisonedException extends SnowflakeException {

    public GeneratorPoisonedException(Throwable cause) {
        super("generator is poisoned (a previous call failed while holding the lock)", cause);
    }

}
