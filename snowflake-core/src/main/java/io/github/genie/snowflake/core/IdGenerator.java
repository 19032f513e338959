package io.github.genie.snowflake.core;

public interface IdGenerator {

    long nextId();

}
