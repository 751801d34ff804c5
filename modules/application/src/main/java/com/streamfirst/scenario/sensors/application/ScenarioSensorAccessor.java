package com.streamfirst.scenario.sensors.application;

import com.streamfirst.scenario.sensors.application.decode.SensorDecoder;
import com.streamfirst.scenario.sensors.domain.CameraChannel;
import com.streamfirst.scenario.sensors.domain.ChannelKind;
import com.streamfirst.scenario.sensors.domain.DecodedImage;
import com.streamfirst.scenario.sensors.domain.DecodedPointCloud;
import com.streamfirst.scenario.sensors.domain.LidarChannel;
import com.streamfirst.scenario.sensors.domain.LogReference;
import com.streamfirst.scenario.sensors.domain.ScenarioSelection;
import com.streamfirst.scenario.sensors.domain.ScenarioWindow;
import com.streamfirst.scenario.sensors.domain.SensorBundle;
import com.streamfirst.scenario.sensors.domain.SensorChannel;
import com.streamfirst.scenario.sensors.domain.SensorChannels;
import com.streamfirst.scenario.sensors.domain.SensorData;
import com.streamfirst.scenario.sensors.domain.SensorRecordRef;
import com.streamfirst.scenario.sensors.domain.TimedToken;
import com.streamfirst.scenario.sensors.domain.TokenSequence;
import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;
import com.streamfirst.scenario.sensors.domain.exception.FetchCancelledException;
import com.streamfirst.scenario.sensors.domain.exception.FetchTimeoutException;
import com.streamfirst.scenario.sensors.domain.exception.RecordLookupException;
import com.streamfirst.scenario.sensors.domain.exception.SensorAccessException;
import com.streamfirst.scenario.sensors.ports.LogRecordIndexPort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for reading the sensor data of one scenario.
 *
 * <p>For a scenario iteration the accessor resolves the iteration's token through the memoized
 * token sequence, asks the log index for the payload refs of the requested channels, fetches
 * every payload through the shared {@link TieredBlobCache} and decodes it. Fetches of one call
 * run concurrently, at most {@link AccessorSettings#maxParallelism()} at a time, and the call
 * returns once all of them have settled.
 *
 * <p>Failure handling is asymmetric:
 * <ul>
 * <li><strong>Camera channels are best effort.</strong> A missing ref, a failed fetch, a timeout
 * or a decode error drops that camera from {@link SensorBundle#getImages()} and is logged at
 * warn level; the bundle is still returned.</li>
 * <li><strong>Lidar is required.</strong> A requested lidar channel without a ref raises
 * {@link RecordLookupException}; a failed fetch, timeout or decode error is rethrown to the
 * caller as the typed exception raised by the cache or decoder.</li>
 * </ul>
 *
 * <p>The token sequence is the only state. It is computed on first use and shared by all
 * threads afterwards.
 */
@Slf4j
public class ScenarioSensorAccessor {

    @Getter
    private final LogReference logReference;
    @Getter
    private final ScenarioSelection selection;

    private final LogRecordIndexPort logRecordIndex;
    private final TieredBlobCache cache;
    private final SensorDecoder decoder;
    private final TokenExtractor extractor;
    private final AccessorSettings settings;
    private final ExecutorService executor;

    private volatile TokenSequence tokens;

    public ScenarioSensorAccessor(LogReference logReference,
                                  LogRecordIndexPort logRecordIndex,
                                  TieredBlobCache cache,
                                  SensorDecoder decoder,
                                  ScenarioSelection selection,
                                  AccessorSettings settings,
                                  ExecutorService executor) {
        this.logReference = Objects.requireNonNull(logReference, "Log reference cannot be null");
        this.logRecordIndex = Objects.requireNonNull(logRecordIndex, "Log record index cannot be null");
        this.cache = Objects.requireNonNull(cache, "Blob cache cannot be null");
        this.decoder = Objects.requireNonNull(decoder, "Decoder cannot be null");
        this.selection = Objects.requireNonNull(selection, "Scenario selection cannot be null");
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.executor = Objects.requireNonNull(executor, "Executor cannot be null");
        this.extractor = new TokenExtractor(logRecordIndex);
    }

    /**
     * Gets the scenario's tokens, extracting them on first call.
     */
    public TokenSequence getTokens() {
        TokenSequence result = tokens;
        if (result == null) {
            synchronized (this) {
                result = tokens;
                if (result == null) {
                    result = extractor.extract(selection);
                    log.debug("Scenario in log {} resolved to {} iterations", logReference, result.size());
                    tokens = result;
                }
            }
        }
        return result;
    }

    public int getNumberOfIterations() {
        return getTokens().size();
    }

    /**
     * Gets the default channels of this accessor at a scenario iteration.
     */
    public SensorBundle getSensorsAtIteration(int iteration) {
        return getSensorsAtIteration(iteration, settings.defaultChannels());
    }

    /**
     * Gets the requested channels at a scenario iteration.
     *
     * @param iteration index into the scenario's token sequence
     * @param channels channels to fetch; the accessor's defaults when null or empty
     * @throws RecordLookupException if the iteration is out of range or a requested lidar
     *         channel has no record at that instant
     * @throws SensorAccessException if fetching or decoding a requested lidar channel fails
     */
    public SensorBundle getSensorsAtIteration(int iteration, Set<? extends SensorChannel> channels) {
        return getSensorsAt(getTokens().get(iteration), channels);
    }

    /**
     * Lazily yields one bundle per token of a window with the accessor's default channels.
     */
    public Iterable<SensorBundle> getPastSensors(ScenarioWindow window) {
        return getPastSensors(window, settings.defaultChannels());
    }

    /**
     * Lazily yields one bundle per token of a window, in timestamp order. Nothing is
     * extracted or fetched until iteration starts; every new iterator starts over.
     *
     * @throws ConfigurationException if no window is given
     */
    public Iterable<SensorBundle> getPastSensors(ScenarioWindow window, Set<? extends SensorChannel> channels) {
        if (window == null) {
            throw new ConfigurationException("A scenario window is required to read past sensors");
        }
        Set<SensorChannel> requested = SensorChannels.orDefault(channels, settings.defaultChannels());
        return () -> new Iterator<>() {
            private TokenSequence sequence;
            private int next;

            @Override
            public boolean hasNext() {
                if (sequence == null) {
                    sequence = extractor.extract(window);
                }
                return next < sequence.size();
            }

            @Override
            public SensorBundle next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return getSensorsAt(sequence.get(next++), requested);
            }
        };
    }

    /**
     * Builds the bundle of one instant. Shared by iteration and window reads.
     */
    public SensorBundle getSensorsAt(TimedToken token, Set<? extends SensorChannel> channels) {
        Set<SensorChannel> requested = SensorChannels.orDefault(channels, settings.defaultChannels());
        List<SensorRecordRef> refs = logRecordIndex.resolveRefs(token.token(), requested);
        requireLidarRefs(token, requested, refs);

        Semaphore permits = new Semaphore(settings.maxParallelism());
        Map<SensorRecordRef, CompletableFuture<SensorData>> fetches = new LinkedHashMap<>();
        for (SensorRecordRef ref : refs) {
            fetches.put(ref, fetchAndDecode(ref, permits));
        }
        awaitSettled(token, fetches.values());

        Map<LidarChannel, DecodedPointCloud> pointclouds = new EnumMap<>(LidarChannel.class);
        Map<CameraChannel, DecodedImage> images = new EnumMap<>(CameraChannel.class);
        SensorAccessException lidarFailure = null;

        for (Map.Entry<SensorRecordRef, CompletableFuture<SensorData>> fetch : fetches.entrySet()) {
            SensorRecordRef ref = fetch.getKey();
            try {
                SensorData data = fetch.getValue().join();
                if (ref.channel() instanceof LidarChannel lidar) {
                    pointclouds.put(lidar, (DecodedPointCloud) data);
                } else {
                    images.put((CameraChannel) ref.channel(), (DecodedImage) data);
                }
            } catch (CompletionException | CancellationException e) {
                SensorAccessException failure = toSensorFailure(ref, e);
                if (ref.channel().kind() == ChannelKind.LIDAR) {
                    log.error("Failed to load {} for token {} in log {}", ref.channel(), token.token(), logReference, failure);
                    if (lidarFailure == null) {
                        lidarFailure = failure;
                    }
                } else {
                    log.warn("Dropping {} for token {} in log {}: {}",
                            ref.channel(), token.token(), logReference, failure.getMessage());
                }
            }
        }

        if (lidarFailure != null) {
            throw lidarFailure;
        }
        return new SensorBundle(token, pointclouds, images);
    }

    private void requireLidarRefs(TimedToken token, Set<SensorChannel> requested, List<SensorRecordRef> refs) {
        for (SensorChannel channel : requested) {
            if (channel.kind() != ChannelKind.LIDAR) {
                continue;
            }
            boolean present = refs.stream().anyMatch(ref -> ref.channel() == channel);
            if (!present) {
                throw new RecordLookupException("No " + channel + " record for token " + token.token()
                        + " in log " + logReference);
            }
        }
        if (refs.size() < requested.size()) {
            log.debug("Token {} has {} of {} requested channels", token.token(), refs.size(), requested.size());
        }
    }

    private CompletableFuture<SensorData> fetchAndDecode(SensorRecordRef ref, Semaphore permits) {
        CompletableFuture<SensorData> result = new CompletableFuture<>();
        Future<?> task = executor.submit(() -> {
            boolean acquired = false;
            try {
                permits.acquire();
                acquired = true;
                result.orTimeout(settings.fetchTimeout().toMillis(), TimeUnit.MILLISECONDS);
                byte[] payload = cache.get(ref.blobKey());
                result.complete(decoder.decode(payload, ref.channel().kind()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.completeExceptionally(new FetchCancelledException(ref.blobKey(), e));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            } finally {
                if (acquired) {
                    permits.release();
                }
            }
        });
        // Cancelling the CompletableFuture never reaches the worker, so interrupt it here
        result.whenComplete((data, error) -> {
            if (error instanceof TimeoutException || error instanceof CancellationException) {
                task.cancel(true);
            }
        });
        return result;
    }

    private void awaitSettled(TimedToken token, Iterable<CompletableFuture<SensorData>> fetches) {
        for (CompletableFuture<SensorData> fetch : fetches) {
            try {
                fetch.get();
            } catch (ExecutionException | CancellationException e) {
                // Outcome is inspected per channel once everything has settled
            } catch (InterruptedException e) {
                fetches.forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                throw new SensorAccessException("Interrupted while loading sensors for token "
                        + token.token() + " in log " + logReference, e);
            }
        }
    }

    private SensorAccessException toSensorFailure(SensorRecordRef ref, RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            return new FetchTimeoutException(ref.blobKey(), settings.fetchTimeout());
        }
        if (cause instanceof CancellationException) {
            return new FetchCancelledException(ref.blobKey(), cause);
        }
        if (cause instanceof SensorAccessException sensorFailure) {
            return sensorFailure;
        }
        return new SensorAccessException("Unexpected failure loading " + ref.channel() + " blob " + ref.blobKey(), cause);
    }
}
