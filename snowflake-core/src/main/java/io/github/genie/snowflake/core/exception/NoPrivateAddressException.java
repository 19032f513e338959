package io.github.genie.snowflake.core.exception;

public class NoPrivateAddressException extends SnowflakeException {

    public NoPrivateAddressException() {
        super("could not find any private ipv4 or ipv6 address");
    }

    public NoPrivateAddressException(Throwable cause) {
        super("could not find any private ipv4 or ipv6 address", cause);
    }

}
