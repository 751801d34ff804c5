package com.streamfirst.scenario.sensors.domain.exception;

import com.streamfirst.scenario.sensors.domain.BlobKey;

/**
 * Local tier missed and no remote tier is configured to fall back to.
 */
public class RemoteStoreUnavailableException extends BlobAccessException {

    public RemoteStoreUnavailableException(BlobKey key, String missingSetting) {
        super(key, "Blob " + key + " is not in the local cache and no remote store is configured"
                + " (set '" + missingSetting + "' to enable one)");
    }
}
