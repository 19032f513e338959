package io.github.genie.snowflake.core.exception;

public class IdentityOutOfRangeException extends ConfigurationException {

    private final IdentityField field;
    private final long value;
    private final long max;

    public IdentityOutOfRangeException(IdentityField field, long value, long max) {
        super(field + " " + value + " out of range, 0 <= " + field + " <= " + max);
        this.field = field;
        this.value = value;
        this.max = max;
    }

    public IdentityField getField() {
        return field;
    }

    public long getValue() {
        return value;
    }

    public long getMax() {
        return max;
    }

}
