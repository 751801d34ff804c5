package com.streamfirst.scenario.sensors.adapters.storage.s3;

import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection settings of an S3-compatible remote tier.
 *
 * @param bucket bucket holding the sensor blobs
 * @param keyPrefix prefix prepended to every blob key, without leading or trailing slash; may be empty
 * @param endpoint endpoint override for S3-compatible stores (MinIO, Ceph); empty for AWS
 * @param region signing region
 * @param pathStyleAccess address the bucket in the path instead of the host name
 * @param accessKeyId static access key; empty to use the SDK default credential chain
 * @param secretAccessKey static secret matching {@code accessKeyId}
 */
public record S3RemoteStoreSettings(String bucket,
                                    String keyPrefix,
                                    Optional<URI> endpoint,
                                    String region,
                                    boolean pathStyleAccess,
                                    Optional<String> accessKeyId,
                                    Optional<String> secretAccessKey) {

    public static final String DEFAULT_REGION = "us-east-1";

    public S3RemoteStoreSettings {
        if (bucket == null || bucket.isBlank()) {
            throw new ConfigurationException("S3 remote store requires a bucket");
        }
        keyPrefix = trimSlashes(keyPrefix == null ? "" : keyPrefix);
        endpoint = Objects.requireNonNullElse(endpoint, Optional.empty());
        region = region == null || region.isBlank() ? DEFAULT_REGION : region;
        accessKeyId = Objects.requireNonNullElse(accessKeyId, Optional.empty());
        secretAccessKey = Objects.requireNonNullElse(secretAccessKey, Optional.empty());
        if (accessKeyId.isPresent() != secretAccessKey.isPresent()) {
            throw new ConfigurationException("S3 access key id and secret access key must be set together");
        }
    }

    /**
     * Settings for a bucket and prefix on AWS with the default credential chain.
     */
    public static S3RemoteStoreSettings of(String bucket, String keyPrefix) {
        return new S3RemoteStoreSettings(bucket, keyPrefix, Optional.empty(), DEFAULT_REGION, false,
                Optional.empty(), Optional.empty());
    }

    /**
     * Parses {@code s3://bucket[/prefix]}.
     *
     * @throws ConfigurationException if the URI is malformed or not an s3 URI
     */
    public static S3RemoteStoreSettings fromUri(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new ConfigurationException("S3 URI cannot be empty");
        }
        URI parsed;
        try {
            parsed = new URI(uri.trim());
        } catch (URISyntaxException e) {
            throw new ConfigurationException("Malformed S3 URI '" + uri + "': " + e.getMessage());
        }
        if (!"s3".equalsIgnoreCase(parsed.getScheme()) || parsed.getHost() == null) {
            throw new ConfigurationException("Expected s3://bucket/prefix, got '" + uri + "'");
        }
        return of(parsed.getHost(), parsed.getPath());
    }

    public S3RemoteStoreSettings withEndpoint(URI endpointOverride, boolean pathStyle) {
        return new S3RemoteStoreSettings(bucket, keyPrefix, Optional.ofNullable(endpointOverride), region, pathStyle,
                accessKeyId, secretAccessKey);
    }

    public S3RemoteStoreSettings withPathStyleAccess(boolean pathStyle) {
        return new S3RemoteStoreSettings(bucket, keyPrefix, endpoint, region, pathStyle,
                accessKeyId, secretAccessKey);
    }

    public S3RemoteStoreSettings withRegion(String signingRegion) {
        return new S3RemoteStoreSettings(bucket, keyPrefix, endpoint, signingRegion, pathStyleAccess,
                accessKeyId, secretAccessKey);
    }

    public S3RemoteStoreSettings withCredentials(String accessKey, String secretKey) {
        return new S3RemoteStoreSettings(bucket, keyPrefix, endpoint, region, pathStyleAccess,
                Optional.ofNullable(accessKey), Optional.ofNullable(secretKey));
    }

    /**
     * Object key of a blob key under this prefix.
     */
    public String objectKey(String blobKey) {
        return keyPrefix.isEmpty() ? blobKey : keyPrefix + "/" + blobKey;
    }

    /**
     * Location in {@code s3://bucket/prefix} form, used in logs and errors.
     */
    public String location() {
        return "s3://" + bucket + (keyPrefix.isEmpty() ? "" : "/" + keyPrefix);
    }

    @Override
    public String toString() {
        // Credentials stay out of logs
        return "S3RemoteStoreSettings{" + location()
                + endpoint.map(e -> ", endpoint=" + e).orElse("")
                + ", region=" + region
                + ", pathStyle=" + pathStyleAccess
                + ", staticCredentials=" + accessKeyId.isPresent() + '}';
    }

    private static String trimSlashes(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '/') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(start, end);
    }
}
