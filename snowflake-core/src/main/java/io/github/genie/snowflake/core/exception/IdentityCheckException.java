package io.github.genie.snowflake.core.exception;

public class IdentityCheckException extends ConfigurationException {

    private final IdentityField field;
    private final long value;

    public IdentityCheckException(IdentityField field, long value) {
        super("check_" + field + " rejected " + value);
        this.field = field;
        this.value = value;
    }

    public IdentityField getField() {
        return field;
    }

    public long getValue() {
        return value;
    }

}
