package com.hcltech.taskgraph.common;

import java.time.Duration;

/**
 * Abstraction for reading environment variables.
 * <p>
 * Configuration goes through this instead of {@link System#getenv(String)}
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {

    IEnvGetter env = System::getenv;

    /** Returns the value of the given environment variable, or {@code null} if unset. */
    String get(String name);

    /** Returns the integer value of the variable, throwing if missing, blank or invalid. */
    static int getInt(IEnvGetter env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required environment variable: " + name);
        }
        return parseInt(name, value);
    }

    static int getIntOr(IEnvGetter env, String name, int defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        return parseInt(name, value);
    }

    static long getLongOr(IEnvGetter env, String name, long defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid long for environment variable: " + name + " = '" + value + "'", e);
        }
    }

    /** Reads a millisecond count as a {@link Duration}. */
    static Duration getMillisOr(IEnvGetter env, String name, Duration defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        return Duration.ofMillis(getLongOr(env, name, 0L));
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for environment variable: " + name + " = '" + value + "'", e);
        }
    }
}
