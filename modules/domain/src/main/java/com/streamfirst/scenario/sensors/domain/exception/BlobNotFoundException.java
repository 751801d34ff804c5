package com.streamfirst.scenario.sensors.domain.exception;

import com.streamfirst.scenario.sensors.domain.BlobKey;

/**
 * The remote tier was queried and does not hold the key.
 */
public class BlobNotFoundException extends BlobAccessException {

    public BlobNotFoundException(BlobKey key, String remote) {
        super(key, "Blob " + key + " not found in remote store " + remote);
    }
}
