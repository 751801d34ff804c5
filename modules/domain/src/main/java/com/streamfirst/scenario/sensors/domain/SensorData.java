package com.streamfirst.scenario.sensors.domain;

/**
 * Decoded payload of one sensor channel at one instant.
 */
public interface SensorData {

    ChannelKind kind();
}
