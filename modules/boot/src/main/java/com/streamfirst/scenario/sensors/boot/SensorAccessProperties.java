package com.streamfirst.scenario.sensors.boot;

import com.streamfirst.scenario.sensors.adapters.storage.s3.S3RemoteStoreSettings;
import com.streamfirst.scenario.sensors.application.AccessorSettings;
import com.streamfirst.scenario.sensors.domain.SensorChannels;
import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized settings under {@code scenario.sensors}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "scenario.sensors")
public class SensorAccessProperties {

    /** Root directory of the local blob tier. */
    private String sensorRoot;

    /** Concurrent fetches issued by one accessor call. */
    private int maxParallelism = AccessorSettings.DEFAULT_MAX_PARALLELISM;

    /** Threads shared by all accessors for fetch-and-decode work. */
    private int fetchThreads = 16;

    /** Time a single fetch-and-decode may take once started. */
    private Duration fetchTimeout = AccessorSettings.DEFAULT_FETCH_TIMEOUT;

    /** Channels fetched when a call names none. */
    private List<String> defaultChannels = new ArrayList<>(List.of("MERGED_PC"));

    private Remote remote = new Remote();

    private Demo demo = new Demo();

    public AccessorSettings toAccessorSettings() {
        return new AccessorSettings(SensorChannels.parseAll(defaultChannels), maxParallelism, fetchTimeout);
    }

    @Getter
    @Setter
    public static class Remote {

        /** One of none, s3, memory. */
        private String backend = "none";

        /** {@code s3://bucket/prefix}; takes precedence over bucket and key-prefix. */
        private String uri;

        private String bucket;

        private String keyPrefix = "";

        /** Endpoint override for S3-compatible stores. */
        private String endpoint;

        private String region = S3RemoteStoreSettings.DEFAULT_REGION;

        private boolean pathStyleAccess;

        private String accessKeyId;

        private String secretAccessKey;

        public RemoteBackend backendType() {
            return RemoteBackend.parse(backend);
        }

        public S3RemoteStoreSettings toS3Settings() {
            S3RemoteStoreSettings settings;
            if (uri != null && !uri.isBlank()) {
                settings = S3RemoteStoreSettings.fromUri(uri);
            } else if (bucket != null && !bucket.isBlank()) {
                settings = S3RemoteStoreSettings.of(bucket, keyPrefix);
            } else {
                throw new ConfigurationException(
                        "S3 remote backend needs scenario.sensors.remote.uri or scenario.sensors.remote.bucket");
            }
            settings = settings.withRegion(region).withPathStyleAccess(pathStyleAccess);
            if (endpoint != null && !endpoint.isBlank()) {
                settings = settings.withEndpoint(URI.create(endpoint), pathStyleAccess);
            }
            if (accessKeyId != null && !accessKeyId.isBlank()) {
                settings = settings.withCredentials(accessKeyId, secretAccessKey);
            }
            return settings;
        }
    }

    @Getter
    @Setter
    public static class Demo {

        private boolean enabled;

        /** Records in the synthetic log, one every 50 ms. */
        private int records = 40;

        private double durationSeconds = 1.0;

        private double subsampleRatio = 0.5;
    }
}
