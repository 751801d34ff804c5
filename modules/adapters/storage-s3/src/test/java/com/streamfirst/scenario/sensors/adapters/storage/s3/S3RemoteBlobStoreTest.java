package com.streamfirst.scenario.sensors.adapters.storage.s3;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.exception.BlobStoreException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchBucketException;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class S3RemoteBlobStoreTest {

    private static final BlobKey KEY = BlobKey.of("sensor_blobs/log/MERGED_PC/t1.pcd");

    @Test
    void fetchesUnderThePrefix() {
        var client = new StubClient(null);
        var store = new S3RemoteBlobStore(client, S3RemoteStoreSettings.fromUri("s3://sensor-data/nuplan"));

        assertThat(store.get(KEY)).hasValueSatisfying(bytes ->
                assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("pcd-bytes"));
        assertThat(client.requests).singleElement().satisfies(request -> {
            assertThat(request.bucket()).isEqualTo("sensor-data");
            assertThat(request.key()).isEqualTo("nuplan/sensor_blobs/log/MERGED_PC/t1.pcd");
        });
    }

    @Test
    void missingKeyIsAMiss() {
        var store = new S3RemoteBlobStore(
                new StubClient(NoSuchKeyException.builder().statusCode(404).message("no such key").build()),
                S3RemoteStoreSettings.of("sensor-data", ""));

        assertThat(store.get(KEY)).isEmpty();
    }

    @Test
    void missingBucketIsAStoreFailure() {
        var store = new S3RemoteBlobStore(
                new StubClient(NoSuchBucketException.builder().statusCode(404).message("no such bucket").build()),
                S3RemoteStoreSettings.of("sensor-data", ""));

        assertThatThrownBy(() -> store.get(KEY))
                .isInstanceOfSatisfying(BlobStoreException.class, e -> assertThat(e.getKey()).isEqualTo(KEY))
                .hasCauseInstanceOf(NoSuchBucketException.class);
    }

    @Test
    void otherNotFoundResponsesAreStoreFailures() {
        var store = new S3RemoteBlobStore(
                new StubClient((S3Exception) S3Exception.builder().statusCode(404).message("not found").build()),
                S3RemoteStoreSettings.of("sensor-data", ""));

        assertThatThrownBy(() -> store.get(KEY)).isInstanceOf(BlobStoreException.class);
    }

    /**
     * Answers every object request with the same payload, or with a fixed failure.
     */
    private static final class StubClient implements S3Client {

        private final S3Exception failure;
        private final List<GetObjectRequest> requests = new ArrayList<>();

        StubClient(S3Exception failure) {
            this.failure = failure;
        }

        @Override
        public ResponseBytes<GetObjectResponse> getObjectAsBytes(GetObjectRequest request) {
            requests.add(request);
            if (failure != null) {
                throw failure;
            }
            return ResponseBytes.fromByteArray(GetObjectResponse.builder().build(),
                    "pcd-bytes".getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public String serviceName() {
            return SERVICE_NAME;
        }

        @Override
        public void close() {
        }
    }
}
