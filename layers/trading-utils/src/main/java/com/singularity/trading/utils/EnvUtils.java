package com.singularity.trading.utils;

import java.util.Map;

/**
 * Reads function configuration from environment variables.
 */
public class EnvUtils {

    private EnvUtils() {}

    /**
     * Returns the value of a variable, or the default when it is unset or blank.
     */
    public static String get(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value == null || value.isBlank()) ? defaultValue : value.trim();
    }

    /**
     * Returns a strictly positive integer setting.
     *
     * @throws IllegalArgumentException if the variable is set but is not a positive integer.
     */
    public static int positiveInt(Map<String, String> env, String name, int defaultValue) {
        String value = get(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got: " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(name + " must be greater than zero, got: " + value);
        }
        return parsed;
    }
}
