package com.streamfirst.scenario.sensors.domain.exception;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import lombok.Getter;

import java.time.Duration;

/**
 * Fetching and decoding one blob did not finish within the configured timeout.
 */
@Getter
public class FetchTimeoutException extends BlobAccessException {

    private final Duration timeout;

    public FetchTimeoutException(BlobKey key, Duration timeout) {
        super(key, "Fetch of blob " + key + " timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }
}
