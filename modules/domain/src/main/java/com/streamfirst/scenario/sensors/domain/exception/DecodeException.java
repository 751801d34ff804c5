package com.streamfirst.scenario.sensors.domain.exception;

import com.streamfirst.scenario.sensors.domain.ChannelKind;
import lombok.Getter;

/**
 * Payload bytes were present but malformed for the declared channel kind.
 */
@Getter
public class DecodeException extends SensorAccessException {

    private final ChannelKind channelKind;
    private final int byteLength;

    public DecodeException(ChannelKind channelKind, int byteLength, String reason) {
        super("Cannot decode " + channelKind + " payload of " + byteLength + " bytes: " + reason);
        this.channelKind = channelKind;
        this.byteLength = byteLength;
    }

    public DecodeException(ChannelKind channelKind, int byteLength, String reason, Throwable cause) {
        super("Cannot decode " + channelKind + " payload of " + byteLength + " bytes: " + reason, cause);
        this.channelKind = channelKind;
        this.byteLength = byteLength;
    }
}
