package com.streamfirst.scenario.sensors.application;

import com.streamfirst.scenario.sensors.application.decode.SensorDecoder;
import com.streamfirst.scenario.sensors.domain.LogReference;
import com.streamfirst.scenario.sensors.domain.ScenarioSelection;
import com.streamfirst.scenario.sensors.ports.LogRecordIndexPort;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;

/**
 * Opens accessors that share one blob cache, decoder and fetch executor.
 */
@Slf4j
@RequiredArgsConstructor
public class ScenarioSensorAccessorFactory {

    @Getter
    private final TieredBlobCache cache;
    private final SensorDecoder decoder;
    @Getter
    private final AccessorSettings settings;
    private final ExecutorService executor;

    /**
     * Opens an accessor for one scenario of a log.
     *
     * @param logReference the log the scenario comes from
     * @param logRecordIndex read access to that log's records
     * @param selection the scenario's initial token and optional window
     */
    public ScenarioSensorAccessor open(LogReference logReference,
                                       LogRecordIndexPort logRecordIndex,
                                       ScenarioSelection selection) {
        log.debug("Opening sensor accessor for log {} ({})", logReference,
                selection.isSingleInstant() ? "single instant" : selection.window().get());
        return new ScenarioSensorAccessor(logReference, logRecordIndex, cache, decoder, selection, settings, executor);
    }
}
