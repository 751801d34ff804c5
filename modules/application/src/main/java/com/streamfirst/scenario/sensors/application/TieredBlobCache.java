package com.streamfirst.scenario.sensors.application;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.exception.BlobNotFoundException;
import com.streamfirst.scenario.sensors.domain.exception.BlobStoreException;
import com.streamfirst.scenario.sensors.domain.exception.FetchCancelledException;
import com.streamfirst.scenario.sensors.domain.exception.RemoteStoreUnavailableException;
import com.streamfirst.scenario.sensors.ports.LocalBlobStorePort;
import com.streamfirst.scenario.sensors.ports.RemoteBlobStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.LongAdder;

/**
 * Resolves blob keys to bytes through a local tier backed by an optional remote tier.
 *
 * <p>Lookup protocol:
 * <ol>
 * <li>A local hit is returned immediately; the remote tier is not contacted.</li>
 * <li>On a local miss without a remote tier, {@link RemoteStoreUnavailableException} is raised.</li>
 * <li>A remote hit is written through to the local tier (atomically, by the local tier's
 * contract) and returned.</li>
 * <li>A remote miss raises {@link BlobNotFoundException}.</li>
 * </ol>
 *
 * <p>Concurrent lookups of the same cold key are collapsed into a single flight: one caller
 * fetches and populates, the others wait for its outcome and observe the same bytes or the
 * same exception. One instance is meant to be shared by every accessor reading the same
 * sensor root. Nothing is retried and nothing is evicted.
 */
@Slf4j
public class TieredBlobCache {

    /** Setting that selects the remote backend, named in errors when none is configured. */
    public static final String REMOTE_BACKEND_SETTING = "scenario.sensors.remote.backend";

    private final LocalBlobStorePort localTier;
    private final RemoteBlobStorePort remoteTier;

    private final ConcurrentMap<BlobKey, CompletableFuture<byte[]>> inFlight = new ConcurrentHashMap<>();

    private final LongAdder localHits = new LongAdder();
    private final LongAdder remoteFetches = new LongAdder();
    private final LongAdder remoteMisses = new LongAdder();
    private final LongAdder joinedFlights = new LongAdder();

    public TieredBlobCache(LocalBlobStorePort localTier, Optional<RemoteBlobStorePort> remoteTier) {
        this.localTier = Objects.requireNonNull(localTier, "Local tier cannot be null");
        this.remoteTier = Objects.requireNonNull(remoteTier, "Remote tier cannot be null, use Optional.empty()")
                .orElse(null);
        log.info("Blob cache created with remote tier {}",
                this.remoteTier == null ? "<none>" : this.remoteTier.describe());
    }

    /**
     * Gets the payload for a key, fetching it from the remote tier on a local miss.
     *
     * @param key the blob key
     * @return the payload; callers must not assume exclusive ownership of the array
     * @throws RemoteStoreUnavailableException on a local miss without a remote tier
     * @throws BlobNotFoundException if the remote tier has no object for the key
     * @throws FetchCancelledException if the calling thread is interrupted while waiting
     * @throws BlobStoreException if a tier fails
     */
    public byte[] get(BlobKey key) {
        Optional<byte[]> local = localTier.get(key);
        if (local.isPresent()) {
            localHits.increment();
            return local.get();
        }

        CompletableFuture<byte[]> flight = new CompletableFuture<>();
        CompletableFuture<byte[]> existing = inFlight.putIfAbsent(key, flight);
        if (existing != null) {
            joinedFlights.increment();
            log.debug("Joining in-flight fetch of {}", key);
            byte[] shared = await(key, existing);
            return Arrays.copyOf(shared, shared.length);
        }

        try {
            flight.complete(fetchThrough(key));
        } catch (Throwable t) {
            flight.completeExceptionally(t);
        } finally {
            inFlight.remove(key, flight);
        }
        return await(key, flight);
    }

    /**
     * Runs {@link #get(BlobKey)} on the given executor.
     */
    public CompletableFuture<byte[]> getAsync(BlobKey key, Executor executor) {
        return CompletableFuture.supplyAsync(() -> get(key), executor);
    }

    public boolean hasRemoteTier() {
        return remoteTier != null;
    }

    public CacheStats stats() {
        return new CacheStats(localHits.sum(), remoteFetches.sum(), remoteMisses.sum(), joinedFlights.sum());
    }

    private byte[] fetchThrough(BlobKey key) {
        // A flight that finished between our local miss and our registration has already
        // published the entry.
        Optional<byte[]> raced = localTier.get(key);
        if (raced.isPresent()) {
            localHits.increment();
            return raced.get();
        }

        if (remoteTier == null) {
            throw new RemoteStoreUnavailableException(key, REMOTE_BACKEND_SETTING);
        }

        remoteFetches.increment();
        log.debug("Local miss for {}, fetching from {}", key, remoteTier.describe());
        Optional<byte[]> remote = remoteTier.get(key);
        if (remote.isEmpty()) {
            remoteMisses.increment();
            throw new BlobNotFoundException(key, remoteTier.describe());
        }

        byte[] bytes = remote.get();
        try {
            localTier.put(key, bytes);
        } catch (BlobStoreException e) {
            log.warn("Fetched {} but could not cache it locally, serving uncached", key, e);
        }
        log.debug("Fetched {} from {} ({} bytes)", key, remoteTier.describe(), bytes.length);
        return bytes;
    }

    private static byte[] await(BlobKey key, CompletableFuture<byte[]> flight) {
        try {
            return flight.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchCancelledException(key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new BlobStoreException(key, "Fetch of " + key + " failed", cause);
        }
    }
}
