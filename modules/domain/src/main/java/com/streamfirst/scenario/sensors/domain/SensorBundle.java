package com.streamfirst.scenario.sensors.domain;

import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Sensor data of one scenario instant. Either map may be empty. Built fresh for every call and
 * owned by the caller.
 */
@Value
public class SensorBundle {

    /** The instant this bundle was resolved at */
    TimedToken token;

    /** Decoded point clouds by lidar channel */
    Map<LidarChannel, DecodedPointCloud> pointclouds;

    /** Decoded frames by camera channel, missing cameras are absent */
    Map<CameraChannel, DecodedImage> images;

    public SensorBundle(TimedToken token,
                        Map<LidarChannel, DecodedPointCloud> pointclouds,
                        Map<CameraChannel, DecodedImage> images) {
        this.token = Objects.requireNonNull(token, "Token cannot be null");
        EnumMap<LidarChannel, DecodedPointCloud> clouds = new EnumMap<>(LidarChannel.class);
        clouds.putAll(Objects.requireNonNull(pointclouds, "Point clouds cannot be null"));
        EnumMap<CameraChannel, DecodedImage> frames = new EnumMap<>(CameraChannel.class);
        frames.putAll(Objects.requireNonNull(images, "Images cannot be null"));
        this.pointclouds = Collections.unmodifiableMap(clouds);
        this.images = Collections.unmodifiableMap(frames);
    }

    public Optional<DecodedPointCloud> pointcloud(LidarChannel channel) {
        return Optional.ofNullable(pointclouds.get(channel));
    }

    public Optional<DecodedImage> image(CameraChannel channel) {
        return Optional.ofNullable(images.get(channel));
    }

    public boolean isEmpty() {
        return pointclouds.isEmpty() && images.isEmpty();
    }

    @Override
    public String toString() {
        return "SensorBundle{" +
               "token=" + token.token() +
               ", timestampUs=" + token.timestampUs() +
               ", pointclouds=" + pointclouds.keySet() +
               ", images=" + images.keySet() +
               '}';
    }
}
