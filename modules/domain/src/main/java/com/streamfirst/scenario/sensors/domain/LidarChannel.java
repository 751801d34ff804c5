package com.streamfirst.scenario.sensors.domain;

/**
 * Lidar streams. Logs carry a single point cloud merged from all lidar units.
 */
public enum LidarChannel implements SensorChannel {
    MERGED_PC;

    @Override
    public ChannelKind kind() {
        return ChannelKind.LIDAR;
    }
}
