package com.streamfirst.scenario.sensors.boot;

import com.streamfirst.scenario.sensors.adapters.InMemoryRemoteBlobStore;
import com.streamfirst.scenario.sensors.adapters.storage.local.FileSystemLocalBlobStore;
import com.streamfirst.scenario.sensors.adapters.storage.s3.S3RemoteBlobStore;
import com.streamfirst.scenario.sensors.application.AccessorSettings;
import com.streamfirst.scenario.sensors.application.ScenarioSensorAccessorFactory;
import com.streamfirst.scenario.sensors.application.TieredBlobCache;
import com.streamfirst.scenario.sensors.application.decode.SensorDecoder;
import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;
import com.streamfirst.scenario.sensors.ports.LocalBlobStorePort;
import com.streamfirst.scenario.sensors.ports.RemoteBlobStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the sensor access stack: local tier under the sensor root, the configured remote tier,
 * one shared blob cache and the accessor factory handed to callers.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SensorAccessProperties.class)
public class SensorAccessConfiguration {

    // --- Storage tiers ---

    @Bean
    public FileSystemLocalBlobStore localBlobStore(SensorAccessProperties properties) {
        String root = properties.getSensorRoot();
        if (root == null || root.isBlank()) {
            throw new ConfigurationException("scenario.sensors.sensor-root must be set");
        }
        FileSystemLocalBlobStore store = new FileSystemLocalBlobStore(Path.of(root));
        int purged = store.purgeStaleTemporaries();
        log.info("Local sensor tier at {} ({} stale temporaries removed)", store.getRoot(), purged);
        return store;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "scenario.sensors.remote", name = "backend", havingValue = "s3")
    public S3RemoteBlobStore s3RemoteBlobStore(SensorAccessProperties properties) {
        return S3RemoteBlobStore.create(properties.getRemote().toS3Settings());
    }

    @Bean
    @ConditionalOnProperty(prefix = "scenario.sensors.remote", name = "backend", havingValue = "memory")
    public InMemoryRemoteBlobStore inMemoryRemoteBlobStore() {
        log.warn("Using the in-memory remote tier, fetched blobs come from process memory only");
        return new InMemoryRemoteBlobStore();
    }

    @Bean
    public TieredBlobCache tieredBlobCache(LocalBlobStorePort localBlobStore,
                                           ObjectProvider<RemoteBlobStorePort> remoteBlobStore,
                                           SensorAccessProperties properties) {
        RemoteBackend backend = properties.getRemote().backendType();
        Optional<RemoteBlobStorePort> remote = backend == RemoteBackend.NONE
                ? Optional.empty()
                : Optional.ofNullable(remoteBlobStore.getIfAvailable());
        if (backend != RemoteBackend.NONE && remote.isEmpty()) {
            throw new ConfigurationException("Remote backend " + backend + " is configured but no store was created");
        }
        return new TieredBlobCache(localBlobStore, remote);
    }

    // --- Application services ---

    @Bean(destroyMethod = "shutdown")
    public ExecutorService sensorFetchExecutor(SensorAccessProperties properties) {
        if (properties.getFetchThreads() < 1) {
            throw new ConfigurationException("scenario.sensors.fetch-threads must be at least 1");
        }
        return Executors.newFixedThreadPool(properties.getFetchThreads(), new CustomizableThreadFactory("sensor-fetch-"));
    }

    @Bean
    public SensorDecoder sensorDecoder() {
        return new SensorDecoder();
    }

    @Bean
    public AccessorSettings accessorSettings(SensorAccessProperties properties) {
        return properties.toAccessorSettings();
    }

    @Bean
    public ScenarioSensorAccessorFactory scenarioSensorAccessorFactory(TieredBlobCache tieredBlobCache,
                                                                       SensorDecoder sensorDecoder,
                                                                       AccessorSettings accessorSettings,
                                                                       ExecutorService sensorFetchExecutor) {
        log.info("Sensor accessors use {}", accessorSettings);
        return new ScenarioSensorAccessorFactory(tieredBlobCache, sensorDecoder, accessorSettings, sensorFetchExecutor);
    }

    // --- Demo runner ---

    @Bean
    @ConditionalOnProperty(prefix = "scenario.sensors.demo", name = "enabled", havingValue = "true")
    public CommandLineRunner demo(ScenarioSensorAccessorFactory scenarioSensorAccessorFactory,
                                  LocalBlobStorePort localBlobStore,
                                  ObjectProvider<RemoteBlobStorePort> remoteBlobStore,
                                  SensorAccessProperties properties) {
        return new DemoScenarioRunner(scenarioSensorAccessorFactory, localBlobStore,
                remoteBlobStore.getIfAvailable(), properties.getDemo());
    }
}
