package io.github.genie.snowflake.core.exception;

public enum IdentityField {

    MACHINE_ID("machine_id"),
    DATA_CENTER_ID("data_center_id");

    private final String label;

    IdentityField(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }

}
