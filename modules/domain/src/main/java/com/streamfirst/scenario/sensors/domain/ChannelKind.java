package com.streamfirst.scenario.sensors.domain;

/**
 * Kind of payload a sensor channel produces. Drives which decoder is applied to a blob.
 */
public enum ChannelKind {
    /** Encoded still image (JPEG in recorded logs) */
    CAMERA,
    /** Point cloud file (PCD) */
    LIDAR
}
