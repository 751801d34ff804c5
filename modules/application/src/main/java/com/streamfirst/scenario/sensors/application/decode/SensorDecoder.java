package com.streamfirst.scenario.sensors.application.decode;

import com.streamfirst.scenario.sensors.domain.ChannelKind;
import com.streamfirst.scenario.sensors.domain.DecodedImage;
import com.streamfirst.scenario.sensors.domain.DecodedPointCloud;
import com.streamfirst.scenario.sensors.domain.SensorData;
import lombok.RequiredArgsConstructor;

import java.util.Objects;

/**
 * Turns raw payload bytes plus the declared channel kind into typed sensor data.
 */
@RequiredArgsConstructor
public class SensorDecoder {

    private final PayloadDecoder<DecodedImage> imageDecoder;
    private final PayloadDecoder<DecodedPointCloud> pointCloudDecoder;

    public SensorDecoder() {
        this(new ImageDecoder(), new PcdPointCloudDecoder());
    }

    /**
     * Decodes a payload according to its channel kind.
     *
     * @throws com.streamfirst.scenario.sensors.domain.exception.DecodeException on malformed input
     */
    public SensorData decode(byte[] data, ChannelKind kind) {
        Objects.requireNonNull(kind, "Channel kind cannot be null");
        return switch (kind) {
            case CAMERA -> imageDecoder.decode(data);
            case LIDAR -> pointCloudDecoder.decode(data);
        };
    }
}
