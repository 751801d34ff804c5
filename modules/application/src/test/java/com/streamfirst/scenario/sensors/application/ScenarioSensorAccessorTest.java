package com.streamfirst.scenario.sensors.application;

import com.streamfirst.scenario.sensors.adapters.InMemoryLocalBlobStore;
import com.streamfirst.scenario.sensors.adapters.InMemoryLogRecordIndex;
import com.streamfirst.scenario.sensors.adapters.InMemoryRemoteBlobStore;
import com.streamfirst.scenario.sensors.application.decode.SensorDecoder;
import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.CameraChannel;
import com.streamfirst.scenario.sensors.domain.LidarChannel;
import com.streamfirst.scenario.sensors.domain.ScenarioSelection;
import com.streamfirst.scenario.sensors.domain.ScenarioWindow;
import com.streamfirst.scenario.sensors.domain.SensorBundle;
import com.streamfirst.scenario.sensors.domain.SensorChannel;
import com.streamfirst.scenario.sensors.domain.SensorRecordRef;
import com.streamfirst.scenario.sensors.domain.TimedToken;
import com.streamfirst.scenario.sensors.domain.Token;
import com.streamfirst.scenario.sensors.domain.TokenSequence;
import com.streamfirst.scenario.sensors.domain.exception.BlobNotFoundException;
import com.streamfirst.scenario.sensors.domain.exception.BlobStoreException;
import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;
import com.streamfirst.scenario.sensors.domain.exception.DecodeException;
import com.streamfirst.scenario.sensors.domain.exception.FetchTimeoutException;
import com.streamfirst.scenario.sensors.domain.exception.RecordLookupException;
import com.streamfirst.scenario.sensors.domain.exception.SensorAccessException;
import com.streamfirst.scenario.sensors.ports.LogRecordIndexPort;
import com.streamfirst.scenario.sensors.ports.RemoteBlobStorePort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static com.streamfirst.scenario.sensors.application.SensorFixtures.LOG;
import static com.streamfirst.scenario.sensors.application.SensorFixtures.cameraKey;
import static com.streamfirst.scenario.sensors.application.SensorFixtures.lidarKey;
import static com.streamfirst.scenario.sensors.application.SensorFixtures.timestamp;
import static com.streamfirst.scenario.sensors.application.SensorFixtures.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScenarioSensorAccessorTest {

    private static final Set<SensorChannel> LIDAR_AND_CAMERAS =
            Set.of(LidarChannel.MERGED_PC, CameraChannel.CAM_F0, CameraChannel.CAM_L0);

    // [1.0 s, 1.5 s) covers records 0..9; half rate keeps 0, 2, 4, 6, 8
    private static final ScenarioWindow WINDOW =
            new ScenarioWindow(SensorFixtures.FIRST_TIMESTAMP_US, 0, 0.5, 0.5);

    private InMemoryLocalBlobStore local;
    private InMemoryRemoteBlobStore remote;
    private InMemoryLogRecordIndex index;
    private ExecutorService executor;
    private ScenarioSensorAccessor accessor;

    @BeforeEach
    void setUp() {
        local = new InMemoryLocalBlobStore();
        remote = new InMemoryRemoteBlobStore();
        index = SensorFixtures.recordedLog(12, remote, CameraChannel.CAM_F0, CameraChannel.CAM_L0);
        executor = Executors.newFixedThreadPool(4);
        accessor = open(new TieredBlobCache(local, Optional.of(remote)), AccessorSettings.defaults());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void resolvesAndMemoizesTheScenarioTokens() {
        TokenSequence tokens = accessor.getTokens();

        assertThat(accessor.getNumberOfIterations()).isEqualTo(5);
        assertThat(tokens).extracting(t -> t.token().value())
                .containsExactly(token(0), token(2), token(4), token(6), token(8));
        assertThat(accessor.getTokens()).isSameAs(tokens);
    }

    @Test
    void singleInstantScenarioHasOneIteration() {
        var single = new ScenarioSensorAccessor(LOG, index, new TieredBlobCache(local, Optional.of(remote)),
                new SensorDecoder(), ScenarioSelection.atToken(Token.of(token(3))),
                AccessorSettings.defaults(), executor);

        assertThat(single.getNumberOfIterations()).isEqualTo(1);
        assertThat(single.getSensorsAtIteration(0).getToken()).isEqualTo(TimedToken.of(token(3), timestamp(3)));
    }

    @Test
    void defaultChannelsAreTheMergedPointCloud() {
        SensorBundle bundle = accessor.getSensorsAtIteration(1);

        assertThat(bundle.getToken()).isEqualTo(TimedToken.of(token(2), timestamp(2)));
        assertThat(bundle.getImages()).isEmpty();
        assertThat(bundle.pointcloud(LidarChannel.MERGED_PC)).hasValueSatisfying(cloud -> {
            assertThat(cloud.size()).isEqualTo(2);
            assertThat(cloud.x()).containsExactly(2f, 3f);
        });
        assertThat(remote.getFetchCount()).isEqualTo(1);
    }

    @Test
    void fetchesEveryRequestedChannel() {
        SensorBundle bundle = accessor.getSensorsAtIteration(2, LIDAR_AND_CAMERAS);

        assertThat(bundle.getPointclouds()).containsOnlyKeys(LidarChannel.MERGED_PC);
        assertThat(bundle.getImages()).containsOnlyKeys(CameraChannel.CAM_F0, CameraChannel.CAM_L0);
        assertThat(bundle.image(CameraChannel.CAM_L0)).hasValueSatisfying(image ->
                assertThat(image.getWidth()).isEqualTo(4));
    }

    @Test
    void repeatedReadsAreServedFromTheLocalTier() {
        SensorBundle first = accessor.getSensorsAtIteration(3, LIDAR_AND_CAMERAS);
        SensorBundle second = accessor.getSensorsAtIteration(3, LIDAR_AND_CAMERAS);

        assertThat(second.getPointclouds()).isEqualTo(first.getPointclouds());
        assertThat(second.getImages()).isEqualTo(first.getImages());
        assertThat(remote.getFetchCount()).isEqualTo(3);
        assertThat(local.size()).isEqualTo(3);
    }

    @Test
    void failedCameraIsDroppedFromTheBundle() {
        remote.failOn(cameraKey(CameraChannel.CAM_F0, 4));

        SensorBundle bundle = accessor.getSensorsAtIteration(2, LIDAR_AND_CAMERAS);

        assertThat(bundle.getImages()).containsOnlyKeys(CameraChannel.CAM_L0);
        assertThat(bundle.pointcloud(LidarChannel.MERGED_PC)).isPresent();
    }

    @Test
    void undecodableCameraIsDroppedFromTheBundle() {
        remote.put(cameraKey(CameraChannel.CAM_L0, 4), new byte[] {1, 2, 3});

        SensorBundle bundle = accessor.getSensorsAtIteration(2, LIDAR_AND_CAMERAS);

        assertThat(bundle.getImages()).containsOnlyKeys(CameraChannel.CAM_F0);
    }

    @Test
    void cameraWithoutRecordIsAbsent() {
        SensorBundle bundle = accessor.getSensorsAtIteration(0,
                Set.of(LidarChannel.MERGED_PC, CameraChannel.CAM_R2));

        assertThat(bundle.getImages()).isEmpty();
        assertThat(bundle.getPointclouds()).hasSize(1);
    }

    @Test
    void cameraOnlyRequestMayYieldAnEmptyBundle() {
        SensorBundle bundle = accessor.getSensorsAtIteration(0, Set.of(CameraChannel.CAM_R2));

        assertThat(bundle.isEmpty()).isTrue();
    }

    @Test
    void failedLidarFetchPropagates() {
        remote.failOn(lidarKey(6));

        assertThatThrownBy(() -> accessor.getSensorsAtIteration(3, LIDAR_AND_CAMERAS))
                .isInstanceOfSatisfying(BlobStoreException.class,
                        e -> assertThat(e.getKey()).isEqualTo(BlobKey.of(lidarKey(6))));
    }

    @Test
    void missingLidarBlobPropagates() {
        index.addRecord("orphan", 9_000_000L);
        index.addRef("orphan", LidarChannel.MERGED_PC, "sensor_blobs/" + LOG + "/MERGED_PC/orphan.pcd");

        assertThatThrownBy(() -> accessor.getSensorsAt(TimedToken.of("orphan", 9_000_000L), Set.of()))
                .isInstanceOf(BlobNotFoundException.class)
                .hasMessageContaining("orphan.pcd");
    }

    @Test
    void undecodableLidarPropagates() {
        remote.put(lidarKey(0), "FIELDS x y z\nDATA ascii\n".getBytes());

        assertThatThrownBy(() -> accessor.getSensorsAtIteration(0))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void lidarWithoutRecordIsALookupError() {
        index.addRecord("bare", 9_500_000L);

        assertThatThrownBy(() -> accessor.getSensorsAt(TimedToken.of("bare", 9_500_000L), null))
                .isInstanceOf(RecordLookupException.class)
                .hasMessageContaining("MERGED_PC")
                .hasMessageContaining("bare");
    }

    @Test
    void iterationOutOfRangeIsALookupError() {
        assertThatThrownBy(() -> accessor.getSensorsAtIteration(5))
                .isInstanceOf(RecordLookupException.class);
        assertThatThrownBy(() -> accessor.getSensorsAtIteration(-1))
                .isInstanceOf(RecordLookupException.class);
    }

    @Test
    void slowCameraTimesOutAndIsDropped() {
        var slowCameras = new SlowRemote(remote, "CAM_F0", Duration.ofSeconds(5));
        var impatient = open(new TieredBlobCache(local, Optional.of(slowCameras)),
                AccessorSettings.defaults().withFetchTimeout(Duration.ofMillis(300)));

        long started = System.nanoTime();
        SensorBundle bundle = impatient.getSensorsAtIteration(1, LIDAR_AND_CAMERAS);

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(4));
        assertThat(bundle.getImages()).containsOnlyKeys(CameraChannel.CAM_L0);
        assertThat(bundle.pointcloud(LidarChannel.MERGED_PC)).isPresent();
    }

    @Test
    void slowLidarTimesOutWithTypedError() {
        var slowLidar = new SlowRemote(remote, "MERGED_PC", Duration.ofSeconds(5));
        var impatient = open(new TieredBlobCache(local, Optional.of(slowLidar)),
                AccessorSettings.defaults().withFetchTimeout(Duration.ofMillis(300)));

        assertThatThrownBy(() -> impatient.getSensorsAtIteration(1))
                .isInstanceOfSatisfying(FetchTimeoutException.class,
                        e -> assertThat(e.getKey()).isEqualTo(BlobKey.of(lidarKey(2))));
    }

    @Test
    void interruptingTheCallerAbortsItsRemoteFetches() throws Exception {
        var slowLidar = new SlowRemote(remote, "MERGED_PC", Duration.ofMillis(1500));
        var slow = open(new TieredBlobCache(local, Optional.of(slowLidar)), AccessorSettings.defaults());
        slow.getTokens();
        AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread caller = new Thread(() -> {
            try {
                slow.getSensorsAtIteration(1);
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        caller.start();
        Thread.sleep(200);
        caller.interrupt();
        caller.join(5_000);

        assertThat(failure.get()).isInstanceOf(SensorAccessException.class)
                .hasMessageContaining("Interrupted");
        Thread.sleep(2_000);
        assertThat(local.contains(BlobKey.of(lidarKey(2)))).isFalse();
        assertThat(local.getWriteCount()).isZero();
    }

    @Test
    void concurrentCallersResolveTheTokensOnce() throws Exception {
        var counting = new CountingIndex(index);
        var shared = new ScenarioSensorAccessorFactory(new TieredBlobCache(local, Optional.of(remote)),
                new SensorDecoder(), AccessorSettings.defaults(), executor)
                .open(LOG, counting, ScenarioSelection.overWindow(Token.of(token(0)), WINDOW));
        int callers = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            List<Future<TokenSequence>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return shared.getTokens();
                }));
            }
            start.countDown();

            TokenSequence first = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<TokenSequence> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(counting.rangeQueries.get()).isEqualTo(1);
    }

    @Test
    void serialFetchingStillLoadsEveryChannel() {
        var serial = open(new TieredBlobCache(local, Optional.of(remote)),
                AccessorSettings.defaults().withMaxParallelism(1));

        assertThat(serial.getSensorsAtIteration(4, LIDAR_AND_CAMERAS).getImages()).hasSize(2);
    }

    @Test
    void pastSensorsMatchIterationReads() {
        Iterable<SensorBundle> past = accessor.getPastSensors(WINDOW, LIDAR_AND_CAMERAS);
        assertThat(remote.getFetchCount()).isZero();

        List<SensorBundle> bundles = new ArrayList<>();
        past.forEach(bundles::add);

        assertThat(bundles).hasSize(accessor.getNumberOfIterations());
        for (int i = 0; i < bundles.size(); i++) {
            SensorBundle expected = accessor.getSensorsAtIteration(i, LIDAR_AND_CAMERAS);
            assertThat(bundles.get(i).getToken()).isEqualTo(expected.getToken());
            assertThat(bundles.get(i).getPointclouds()).isEqualTo(expected.getPointclouds());
            assertThat(bundles.get(i).getImages()).isEqualTo(expected.getImages());
        }
    }

    @Test
    void pastSensorsCanBeIteratedAgain() {
        Iterable<SensorBundle> past = accessor.getPastSensors(ScenarioWindow.of(SensorFixtures.FIRST_TIMESTAMP_US, 0.1));

        assertThat(past).hasSize(2);
        assertThat(past).extracting(b -> b.getToken().token().value()).containsExactly(token(0), token(1));
    }

    @Test
    void pastSensorsRequireAWindow() {
        assertThatThrownBy(() -> accessor.getPastSensors(null))
                .isInstanceOf(ConfigurationException.class);
    }

    private ScenarioSensorAccessor open(TieredBlobCache cache, AccessorSettings settings) {
        return new ScenarioSensorAccessorFactory(cache, new SensorDecoder(), settings, executor)
                .open(LOG, index, ScenarioSelection.overWindow(Token.of(token(0)), WINDOW));
    }

    /**
     * Delays fetches of keys containing a marker; interruption aborts the fetch.
     */
    private static final class SlowRemote implements RemoteBlobStorePort {

        private final RemoteBlobStorePort delegate;
        private final String marker;
        private final Duration delay;

        SlowRemote(RemoteBlobStorePort delegate, String marker, Duration delay) {
            this.delegate = delegate;
            this.marker = marker;
            this.delay = delay;
        }

        @Override
        public Optional<byte[]> get(BlobKey key) {
            if (key.value().contains(marker)) {
                try {
                    Thread.sleep(delay.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new BlobStoreException(key, "interrupted", e);
                }
            }
            return delegate.get(key);
        }

        @Override
        public String describe() {
            return "slow " + delegate.describe();
        }
    }

    /**
     * Counts range queries and holds each one long enough for callers to pile up.
     */
    private static final class CountingIndex implements LogRecordIndexPort {

        private final LogRecordIndexPort delegate;
        private final AtomicInteger rangeQueries = new AtomicInteger();

        CountingIndex(LogRecordIndexPort delegate) {
            this.delegate = delegate;
        }

        @Override
        public List<TimedToken> listTokensInRange(long startUs, long endUs) {
            rangeQueries.incrementAndGet();
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return delegate.listTokensInRange(startUs, endUs);
        }

        @Override
        public List<SensorRecordRef> resolveRefs(Token token, Collection<? extends SensorChannel> channels) {
            return delegate.resolveRefs(token, channels);
        }

        @Override
        public Optional<TimedToken> findToken(Token token) {
            return delegate.findToken(token);
        }
    }
}
