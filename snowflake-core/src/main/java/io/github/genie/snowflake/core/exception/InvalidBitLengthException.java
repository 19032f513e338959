package io.github.genie.snowflake.core.exception;

public class InvalidBitLengthException extends ConfigurationException {

    public InvalidBitLengthException(String message) {
        super(message);
    }

    public InvalidBitLengthException(int time, int sequence, int dataCenterId, int machineId) {
        this("invalid bit length configuration: time(" + time + ") + sequence(" + sequence
             + ") + data_center(" + dataCenterId + ") + machine(" + machineId + ") must be 63");
    }

}
