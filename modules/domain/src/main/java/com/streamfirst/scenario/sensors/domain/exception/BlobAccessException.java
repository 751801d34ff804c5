package com.streamfirst.scenario.sensors.domain.exception;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import lombok.Getter;

/**
 * Failure tied to one stored payload. Carries the offending key.
 */
@Getter
public abstract class BlobAccessException extends SensorAccessException {

    private final BlobKey key;

    protected BlobAccessException(BlobKey key, String message) {
        super(message);
        this.key = key;
    }

    protected BlobAccessException(BlobKey key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }
}
