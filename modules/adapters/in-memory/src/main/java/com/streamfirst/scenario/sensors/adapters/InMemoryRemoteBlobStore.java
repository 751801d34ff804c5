package com.streamfirst.scenario.sensors.adapters;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.exception.BlobStoreException;
import com.streamfirst.scenario.sensors.ports.RemoteBlobStorePort;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of RemoteBlobStorePort for testing and demos.
 * Counts fetches and can simulate latency and failing keys, which is how tests observe
 * single-flight and timeout behaviour of the cache above it.
 */
@Slf4j
public class InMemoryRemoteBlobStore implements RemoteBlobStorePort {

    private final String name;

    private final Map<BlobKey, byte[]> objects = new ConcurrentHashMap<>();

    private final Map<BlobKey, AtomicInteger> fetchesByKey = new ConcurrentHashMap<>();

    private final Set<BlobKey> failingKeys = ConcurrentHashMap.newKeySet();

    private final AtomicInteger fetchCount = new AtomicInteger();

    private volatile Duration latency = Duration.ZERO;

    public InMemoryRemoteBlobStore() {
        this("memory://remote");
    }

    public InMemoryRemoteBlobStore(String name) {
        this.name = name;
    }

    @Override
    public Optional<byte[]> get(BlobKey key) {
        fetchCount.incrementAndGet();
        fetchesByKey.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        log.debug("Remote fetch of {} from {}", key, name);

        simulateLatency(key);
        if (failingKeys.contains(key)) {
            throw new BlobStoreException(key, "Simulated remote failure for " + key, null);
        }

        byte[] content = objects.get(key);
        return content == null ? Optional.empty() : Optional.of(Arrays.copyOf(content, content.length));
    }

    @Override
    public String describe() {
        return name;
    }

    /**
     * Stores an object. Used for test setup.
     */
    public void put(String key, byte[] data) {
        objects.put(BlobKey.of(key), Arrays.copyOf(data, data.length));
    }

    /**
     * Makes every fetch sleep before answering. Sleep honours interruption.
     */
    public void setLatency(Duration latency) {
        this.latency = latency;
    }

    /**
     * Makes fetches of a key fail with a storage error.
     */
    public void failOn(String key) {
        failingKeys.add(BlobKey.of(key));
    }

    public int getFetchCount() {
        return fetchCount.get();
    }

    public int getFetchCount(String key) {
        AtomicInteger count = fetchesByKey.get(BlobKey.of(key));
        return count == null ? 0 : count.get();
    }

    private void simulateLatency(BlobKey key) {
        Duration delay = latency;
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BlobStoreException(key, "Remote fetch of " + key + " interrupted", e);
        }
    }
}
