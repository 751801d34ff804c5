package com.streamfirst.scenario.sensors.adapters;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.ports.LocalBlobStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of LocalBlobStorePort for testing.
 * Publishing through {@code putIfAbsent} gives the same first-write-wins, all-or-nothing
 * visibility as the filesystem tier. Data is lost when the process stops.
 */
@Slf4j
public class InMemoryLocalBlobStore implements LocalBlobStorePort {

    private final Map<BlobKey, byte[]> blobs = new ConcurrentHashMap<>();

    private final AtomicInteger writeCount = new AtomicInteger();

    @Override
    public Optional<byte[]> get(BlobKey key) {
        byte[] content = blobs.get(key);
        log.debug("Local lookup of {}: {}", key, content != null ? "hit" : "miss");
        return content == null ? Optional.empty() : Optional.of(Arrays.copyOf(content, content.length));
    }

    @Override
    public void put(BlobKey key, byte[] data) {
        byte[] previous = blobs.putIfAbsent(key, Arrays.copyOf(data, data.length));
        if (previous == null) {
            writeCount.incrementAndGet();
            log.debug("Cached {} ({} bytes)", key, data.length);
        } else {
            log.debug("Blob {} already cached, keeping existing entry", key);
        }
    }

    @Override
    public boolean contains(BlobKey key) {
        return blobs.containsKey(key);
    }

    /**
     * Gets the number of entries actually published.
     */
    public int getWriteCount() {
        return writeCount.get();
    }

    /**
     * Gets the number of cached blobs.
     */
    public int size() {
        return blobs.size();
    }
}
