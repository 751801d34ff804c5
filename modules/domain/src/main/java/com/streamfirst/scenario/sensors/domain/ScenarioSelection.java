package com.streamfirst.scenario.sensors.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Which records of a log an accessor iterates over: a single instant identified by its
 * token, or a window of records.
 *
 * @param initialToken token of the scenario's first record
 * @param window the window to extract, empty for single-instant mode
 */
public record ScenarioSelection(Token initialToken, Optional<ScenarioWindow> window) {
    public ScenarioSelection {
        Objects.requireNonNull(initialToken, "Initial token cannot be null");
        Objects.requireNonNull(window, "Window cannot be null, use Optional.empty()");
    }

    public static ScenarioSelection atToken(Token initialToken) {
        return new ScenarioSelection(initialToken, Optional.empty());
    }

    public static ScenarioSelection overWindow(Token initialToken, ScenarioWindow window) {
        return new ScenarioSelection(initialToken, Optional.of(window));
    }

    public boolean isSingleInstant() {
        return window.isEmpty();
    }
}
