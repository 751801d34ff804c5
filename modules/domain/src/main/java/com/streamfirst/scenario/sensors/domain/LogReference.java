package com.streamfirst.scenario.sensors.domain;

/**
 * Names the driving log a scenario was extracted from.
 *
 * @param logName the log file name without extension (e.g. "2021.07.16.20.45.29_veh-35_01095_01486")
 */
public record LogReference(String logName) {
    public LogReference {
        if (logName == null || logName.isBlank()) {
            throw new IllegalArgumentException("Log name cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        return logName;
    }
}
