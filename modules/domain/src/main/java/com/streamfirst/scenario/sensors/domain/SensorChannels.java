package com.streamfirst.scenario.sensors.domain;

import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lookup helpers over the closed channel enumerations.
 */
public final class SensorChannels {

    /** Channels requested when a caller does not name any. */
    public static final Set<SensorChannel> DEFAULT_CHANNELS = Set.of(LidarChannel.MERGED_PC);

    private SensorChannels() {
    }

    /**
     * Resolves a channel by its recorded name, searching cameras then lidars.
     *
     * @throws ConfigurationException if the name matches no known channel
     */
    public static SensorChannel parse(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Sensor channel name cannot be null or empty");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (CameraChannel camera : CameraChannel.values()) {
            if (camera.name().equals(normalized)) {
                return camera;
            }
        }
        for (LidarChannel lidar : LidarChannel.values()) {
            if (lidar.name().equals(normalized)) {
                return lidar;
            }
        }
        throw new ConfigurationException("Unknown sensor channel: " + name);
    }

    /**
     * Resolves every name, keeping the caller's order and dropping duplicates.
     */
    public static Set<SensorChannel> parseAll(Collection<String> names) {
        Set<SensorChannel> channels = new LinkedHashSet<>();
        for (String name : names) {
            channels.add(parse(name));
        }
        return Collections.unmodifiableSet(channels);
    }

    /**
     * Returns a copy of the given channels, or {@code defaults} when none were requested.
     */
    public static Set<SensorChannel> orDefault(Set<? extends SensorChannel> requested,
                                               Set<SensorChannel> defaults) {
        if (requested == null || requested.isEmpty()) {
            return defaults;
        }
        return Set.copyOf(requested);
    }
}
