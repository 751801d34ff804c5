package com.streamfirst.scenario.sensors.domain.exception;

import com.streamfirst.scenario.sensors.domain.BlobKey;

/**
 * The calling thread was interrupted while waiting for a blob.
 */
public class FetchCancelledException extends BlobAccessException {

    public FetchCancelledException(BlobKey key, Throwable cause) {
        super(key, "Fetch of blob " + key + " was cancelled", cause);
    }
}
