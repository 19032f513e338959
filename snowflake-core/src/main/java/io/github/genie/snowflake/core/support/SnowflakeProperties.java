package io.github.genie.snowflake.core.support;

import io.github.genie.snowflake.core.exception.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Properties;

/**
 * Generator settings read from a {@link Properties} source. Absent keys keep the builder's value.
 */
public class SnowflakeProperties {

    public static final String START_TIME = "snowflake.start-time";
    public static final String TICK_UNIT_MILLIS = "snowflake.tick-unit-millis";
    public static final String TIME_BITS = "snowflake.bits.time";
    public static final String SEQUENCE_BITS = "snowflake.bits.sequence";
    public static final String DATA_CENTER_ID_BITS = "snowflake.bits.data-center-id";
    public static final String MACHINE_ID_BITS = "snowflake.bits.machine-id";
    public static final String MACHINE_ID = "snowflake.machine-id";
    public static final String DATA_CENTER_ID = "snowflake.data-center-id";
    public static final String MAX_BACKWARD_DRIFT_MILLIS = "snowflake.max-backward-drift-millis";

    private final Properties base;

    public SnowflakeProperties(Properties base) {
        this.base = base;
    }

    public static SnowflakeProperties load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read " + path, e);
        }
    }

    public static SnowflakeProperties loadResource(String name) {
        ClassLoader cl = SnowflakeProperties.class.getClassLoader();
        InputStream in = cl != null ? cl.getResourceAsStream(name) : ClassLoader.getSystemResourceAsStream(name);
        if (in == null) {
            throw new ConfigurationException("resource not found: " + name);
        }
        try (InputStream resource = in) {
            return load(resource);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read resource " + name, e);
        }
    }

    private static SnowflakeProperties load(InputStream in) throws IOException {
        Properties properties = new Properties();
        properties.load(in);
        return new SnowflakeProperties(properties);
    }

    public SnowflakeBuilder applyTo(SnowflakeBuilder builder) {
        String startTime = get(START_TIME);
        if (startTime != null) {
            try {
                builder.startTime(Instant.parse(startTime));
            } catch (DateTimeParseException e) {
                throw new ConfigurationException(START_TIME + " is not an ISO-8601 instant: " + startTime, e);
            }
        }
        String tickUnit = get(TICK_UNIT_MILLIS);
        if (tickUnit != null) {
            builder.tickUnit(Duration.ofMillis(getLong(TICK_UNIT_MILLIS, tickUnit)));
        }
        String timeBits = get(TIME_BITS);
        if (timeBits != null) {
            builder.bitLenTime(getInt(TIME_BITS, timeBits));
        }
        String sequenceBits = get(SEQUENCE_BITS);
        if (sequenceBits != null) {
            builder.bitLenSequence(getInt(SEQUENCE_BITS, sequenceBits));
        }
        String dataCenterIdBits = get(DATA_CENTER_ID_BITS);
        if (dataCenterIdBits != null) {
            builder.bitLenDataCenterId(getInt(DATA_CENTER_ID_BITS, dataCenterIdBits));
        }
        String machineIdBits = get(MACHINE_ID_BITS);
        if (machineIdBits != null) {
            builder.bitLenMachineId(getInt(MACHINE_ID_BITS, machineIdBits));
        }
        String machineId = get(MACHINE_ID);
        if (machineId != null) {
            builder.machineId(getLong(MACHINE_ID, machineId));
        }
        String dataCenterId = get(DATA_CENTER_ID);
        if (dataCenterId != null) {
            builder.dataCenterId(getLong(DATA_CENTER_ID, dataCenterId));
        }
        String maxBackwardDrift = get(MAX_BACKWARD_DRIFT_MILLIS);
        if (maxBackwardDrift != null) {
            builder.maxBackwardDrift(Duration.ofMillis(getLong(MAX_BACKWARD_DRIFT_MILLIS, maxBackwardDrift)));
        }
        return builder;
    }

    public SnowflakeIdGenerator build() {
        return applyTo(SnowflakeIdGenerator.builder()).build();
    }

    public String get(String key) {
        String value = base.getProperty(key);
        return value == null ? null : value.trim();
    }

    public Properties getBase() {
        return base;
    }

    private static long getLong(String key, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + value, e);
        }
    }

    private static int getInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + value, e);
        }
    }

}
