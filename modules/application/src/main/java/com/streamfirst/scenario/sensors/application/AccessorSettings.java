package com.streamfirst.scenario.sensors.application;

import com.streamfirst.scenario.sensors.domain.SensorChannel;
import com.streamfirst.scenario.sensors.domain.SensorChannels;
import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;

import java.time.Duration;
import java.util.Set;

/**
 * Tuning of a {@link ScenarioSensorAccessor}.
 *
 * @param defaultChannels channels fetched when a call names none
 * @param maxParallelism upper bound on concurrent fetches issued by one call
 * @param fetchTimeout time a single fetch-and-decode may take once started
 */
public record AccessorSettings(Set<SensorChannel> defaultChannels, int maxParallelism, Duration fetchTimeout) {

    public static final int DEFAULT_MAX_PARALLELISM = 8;
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);

    public AccessorSettings {
        if (defaultChannels == null || defaultChannels.isEmpty()) {
            throw new ConfigurationException("Default channel set cannot be empty");
        }
        if (maxParallelism < 1) {
            throw new ConfigurationException("Max parallelism must be at least 1, got " + maxParallelism);
        }
        if (fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            throw new ConfigurationException("Fetch timeout must be positive, got " + fetchTimeout);
        }
        defaultChannels = Set.copyOf(defaultChannels);
    }

    public static AccessorSettings defaults() {
        return new AccessorSettings(SensorChannels.DEFAULT_CHANNELS, DEFAULT_MAX_PARALLELISM, DEFAULT_FETCH_TIMEOUT);
    }

    public AccessorSettings withFetchTimeout(Duration timeout) {
        return new AccessorSettings(defaultChannels, maxParallelism, timeout);
    }

    public AccessorSettings withMaxParallelism(int parallelism) {
        return new AccessorSettings(defaultChannels, parallelism, fetchTimeout);
    }
}
