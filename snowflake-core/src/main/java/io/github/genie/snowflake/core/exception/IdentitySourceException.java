package io.github.genie.snowflake.core.exception;

/**
 * The identity source itself failed; the underlying failure is the cause.
 */
public class IdentitySourceException extends ConfigurationException {

    private final IdentityField field;

    public IdentitySourceException(IdentityField field, Throwable cause) {
        super(field + " returned an error: " + cause.getMessage(), cause);
        this.field = field;
    }

    public IdentityField getField() {
        return field;
    }

}
