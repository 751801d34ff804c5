package com.streamfirst.scenario.sensors.domain.exception;

import com.streamfirst.scenario.sensors.domain.BlobKey;

/**
 * A storage backend failed while reading or writing a key (I/O error, SDK error).
 */
public class BlobStoreException extends BlobAccessException {

    public BlobStoreException(BlobKey key, String message, Throwable cause) {
        super(key, message, cause);
    }
}
