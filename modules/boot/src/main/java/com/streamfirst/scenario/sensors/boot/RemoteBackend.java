package com.streamfirst.scenario.sensors.boot;

import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Remote tier implementations selectable through {@code scenario.sensors.remote.backend}.
 */
public enum RemoteBackend {
    /** Local tier only; misses fail with a pointer to this setting. */
    NONE,
    S3,
    /** Process-local store, for demos and tests. */
    MEMORY;

    public static RemoteBackend parse(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown remote backend '" + value + "', expected one of "
                    + Arrays.toString(values()).toLowerCase(Locale.ROOT));
        }
    }
}
