package com.streamfirst.scenario.sensors.domain.exception;

/**
 * Base type of every failure raised while extracting, fetching or decoding scenario sensor data.
 * Unchecked so that it travels unchanged through {@code CompletableFuture} pipelines.
 */
public class SensorAccessException extends RuntimeException {

    public SensorAccessException(String message) {
        super(message);
    }

    public SensorAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
