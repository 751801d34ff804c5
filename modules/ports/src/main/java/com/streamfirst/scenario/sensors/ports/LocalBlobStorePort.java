package com.streamfirst.scenario.sensors.ports;

import com.streamfirst.scenario.sensors.domain.BlobKey;

import java.util.Optional;

/**
 * Port for the local, persistent tier of the sensor blob cache.
 * Entries are written at most once per key and never mutated afterwards.
 */
public interface LocalBlobStorePort {

    /**
     * Reads a cached payload.
     *
     * @param key the blob key
     * @return the payload bytes, empty if the key is not cached
     * @throws com.streamfirst.scenario.sensors.domain.exception.BlobStoreException if the read fails
     */
    Optional<byte[]> get(BlobKey key);

    /**
     * Publishes a payload under a key. The write must be atomic: readers observe either no
     * entry or the complete bytes, even if the writer crashes or is interrupted mid-write.
     * If the key is already present the existing entry is kept.
     *
     * @param key the blob key
     * @param data the payload bytes
     * @throws com.streamfirst.scenario.sensors.domain.exception.BlobStoreException if the write fails
     */
    void put(BlobKey key, byte[] data);

    /**
     * Checks whether a key is cached.
     *
     * @param key the blob key
     * @return true if a complete entry exists
     */
    boolean contains(BlobKey key);
}
