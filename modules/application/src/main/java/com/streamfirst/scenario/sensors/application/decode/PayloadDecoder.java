package com.streamfirst.scenario.sensors.application.decode;

import com.streamfirst.scenario.sensors.domain.ChannelKind;
import com.streamfirst.scenario.sensors.domain.SensorData;

/**
 * Decodes the raw payload of one channel kind. Implementations are pure and stateless.
 *
 * @param <T> the decoded value type
 */
public interface PayloadDecoder<T extends SensorData> {

    /**
     * The channel kind this decoder accepts.
     */
    ChannelKind kind();

    /**
     * Decodes a complete payload.
     *
     * @param data the raw bytes
     * @return the fully decoded value
     * @throws com.streamfirst.scenario.sensors.domain.exception.DecodeException if the bytes are
     *         empty, truncated or not in the expected format
     */
    T decode(byte[] data);
}
