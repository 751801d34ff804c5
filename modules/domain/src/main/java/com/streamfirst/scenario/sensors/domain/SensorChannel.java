package com.streamfirst.scenario.sensors.domain;

/**
 * A named sensor source producing one data stream in a driving log.
 * Implemented only by the closed enumerations {@link CameraChannel} and {@link LidarChannel}.
 */
public interface SensorChannel {

    /**
     * Channel name as recorded in the log (e.g. "CAM_F0", "MERGED_PC").
     */
    String name();

    /**
     * Payload kind of this channel.
     */
    ChannelKind kind();
}
