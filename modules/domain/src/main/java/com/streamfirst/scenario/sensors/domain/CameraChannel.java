package com.streamfirst.scenario.sensors.domain;

/**
 * Camera positions mounted on the recording vehicle.
 */
public enum CameraChannel implements SensorChannel {
    CAM_F0,
    CAM_B0,
    CAM_L0,
    CAM_L1,
    CAM_L2,
    CAM_R0,
    CAM_R1,
    CAM_R2;

    @Override
    public ChannelKind kind() {
        return ChannelKind.CAMERA;
    }
}
