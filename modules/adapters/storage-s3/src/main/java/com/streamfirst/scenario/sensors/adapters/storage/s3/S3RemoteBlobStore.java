package com.streamfirst.scenario.sensors.adapters.storage.s3;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.exception.BlobStoreException;
import com.streamfirst.scenario.sensors.ports.RemoteBlobStorePort;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.urlconnection.UrlConnectionHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.util.Objects;
import java.util.Optional;

/**
 * Remote tier over an S3-compatible object store. Blob keys map to object keys under the
 * configured prefix; a missing object is a miss, any other SDK failure a {@link BlobStoreException}.
 */
@Slf4j
public class S3RemoteBlobStore implements RemoteBlobStorePort, AutoCloseable {

    @Getter(AccessLevel.PACKAGE)
    private final S3Client client;
    @Getter
    private final S3RemoteStoreSettings settings;

    public S3RemoteBlobStore(S3Client client, S3RemoteStoreSettings settings) {
        this.client = Objects.requireNonNull(client, "S3 client cannot be null");
        this.settings = Objects.requireNonNull(settings, "S3 settings cannot be null");
    }

    /**
     * Builds a store with its own client, closed by {@link #close()}.
     */
    public static S3RemoteBlobStore create(S3RemoteStoreSettings settings) {
        S3ClientBuilder builder = S3Client.builder()
                .httpClientBuilder(UrlConnectionHttpClient.builder())
                .region(Region.of(settings.region()))
                .credentialsProvider(credentials(settings))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(settings.pathStyleAccess())
                        .build());
        settings.endpoint().ifPresent(builder::endpointOverride);
        log.info("Connecting remote tier to {}", settings);
        return new S3RemoteBlobStore(builder.build(), settings);
    }

    @Override
    public Optional<byte[]> get(BlobKey key) {
        String objectKey = settings.objectKey(key.value());
        GetObjectRequest request = GetObjectRequest.builder()
                .bucket(settings.bucket())
                .key(objectKey)
                .build();
        try {
            ResponseBytes<GetObjectResponse> object = client.getObjectAsBytes(request);
            log.debug("Fetched s3://{}/{} ({} bytes)", settings.bucket(), objectKey, object.asByteArray().length);
            return Optional.of(object.asByteArray());
        } catch (NoSuchKeyException e) {
            log.debug("No object at s3://{}/{}", settings.bucket(), objectKey);
            return Optional.empty();
        } catch (S3Exception e) {
            // Only a missing key is a miss; a missing bucket or denied access is a store failure
            log.error("S3 request for {} failed with status {}", objectKey, e.statusCode(), e);
            throw new BlobStoreException(key, "S3 fetch of " + objectKey + " failed: " + e.getMessage(), e);
        } catch (SdkException e) {
            log.error("S3 request for {} failed", objectKey, e);
            throw new BlobStoreException(key, "S3 fetch of " + objectKey + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return settings.location();
    }

    @Override
    public void close() {
        client.close();
    }

    private static AwsCredentialsProvider credentials(S3RemoteStoreSettings settings) {
        if (settings.accessKeyId().isPresent()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(
                    settings.accessKeyId().get(), settings.secretAccessKey().orElseThrow()));
        }
        return DefaultCredentialsProvider.create();
    }
}
