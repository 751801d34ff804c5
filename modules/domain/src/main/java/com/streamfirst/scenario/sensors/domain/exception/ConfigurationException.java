package com.streamfirst.scenario.sensors.domain.exception;

/**
 * Raised eagerly when a scenario window or a component setting is malformed.
 */
public class ConfigurationException extends SensorAccessException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
