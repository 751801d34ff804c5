package com.streamfirst.scenario.sensors.ports;

import com.streamfirst.scenario.sensors.domain.BlobKey;

import java.util.Optional;

/**
 * Port for the optional remote object store consulted on a local cache miss.
 * Abstracts S3-compatible stores and test doubles behind a single read operation.
 */
public interface RemoteBlobStorePort {

    /**
     * Downloads a payload.
     *
     * @param key the blob key
     * @return the payload bytes, empty if the store has no object for the key
     * @throws com.streamfirst.scenario.sensors.domain.exception.BlobStoreException if the request fails
     */
    Optional<byte[]> get(BlobKey key);

    /**
     * Human-readable identification of the backend, used in logs and error messages
     * (e.g. "s3://nuplan-sensors/v1.1").
     */
    String describe();
}
