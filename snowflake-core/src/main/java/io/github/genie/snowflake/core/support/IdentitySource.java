package io.github.genie.snowflake.core.support;

/**
 * Supplies the machine id or data center id of a generator. Resolved once, when the generator
 * is built; any exception it throws fails the build.
 */
@FunctionalInterface
public interface IdentitySource {

    long resolve() throws Exception;

    static IdentitySource of(long value) {
        return () -> value;
    }

}
