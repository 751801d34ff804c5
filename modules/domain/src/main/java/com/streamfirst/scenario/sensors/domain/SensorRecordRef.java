package com.streamfirst.scenario.sensors.domain;

import java.util.Objects;

/**
 * Pointer from a log record to the stored payload of one channel at one instant.
 * Exactly one ref exists per (token, channel) pair recorded in the log.
 *
 * @param token the record token
 * @param timestampUs recording time in microseconds
 * @param channel the channel that produced the payload
 * @param blobKey where the payload is stored
 */
public record SensorRecordRef(Token token, long timestampUs, SensorChannel channel, BlobKey blobKey) {
    public SensorRecordRef {
        Objects.requireNonNull(token, "Token cannot be null");
        Objects.requireNonNull(channel, "Channel cannot be null");
        Objects.requireNonNull(blobKey, "Blob key cannot be null");
    }
}
