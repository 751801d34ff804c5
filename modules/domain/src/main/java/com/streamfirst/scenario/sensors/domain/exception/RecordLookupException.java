package com.streamfirst.scenario.sensors.domain.exception;

/**
 * Raised when an iteration, token or channel has no corresponding record in the log.
 */
public class RecordLookupException extends SensorAccessException {

    public RecordLookupException(String message) {
        super(message);
    }
}
