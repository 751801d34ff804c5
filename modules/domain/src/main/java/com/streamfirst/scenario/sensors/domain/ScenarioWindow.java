package com.streamfirst.scenario.sensors.domain;

import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;

/**
 * Time interval plus sampling parameters that define which log records belong to one
 * extracted scenario. All fields are validated on construction, so any arithmetic on a
 * window operates on a present anchor and well-formed sampling parameters.
 *
 * @param anchorTimestampUs scenario anchor in microseconds since the epoch; required
 * @param extractionOffsetSeconds offset of the window start relative to the anchor, may be negative
 * @param durationSeconds window length, strictly positive
 * @param subsampleRatio fraction of records to keep, in (0, 1]
 */
public record ScenarioWindow(Long anchorTimestampUs,
                             double extractionOffsetSeconds,
                             double durationSeconds,
                             double subsampleRatio) {

    private static final double MICROS_PER_SECOND = 1_000_000d;

    public ScenarioWindow {
        if (anchorTimestampUs == null) {
            throw new ConfigurationException("Scenario window requires an anchor timestamp");
        }
        if (!Double.isFinite(extractionOffsetSeconds)) {
            throw new ConfigurationException(
                    "Extraction offset must be finite, got " + extractionOffsetSeconds);
        }
        if (!Double.isFinite(durationSeconds) || durationSeconds <= 0) {
            throw new ConfigurationException(
                    "Scenario duration must be positive, got " + durationSeconds);
        }
        if (!Double.isFinite(subsampleRatio) || subsampleRatio <= 0 || subsampleRatio > 1) {
            throw new ConfigurationException(
                    "Subsample ratio must be in (0, 1], got " + subsampleRatio);
        }
    }

    /**
     * Window starting at the anchor, keeping every record.
     */
    public static ScenarioWindow of(long anchorTimestampUs, double durationSeconds) {
        return new ScenarioWindow(anchorTimestampUs, 0, durationSeconds, 1.0);
    }

    /**
     * Inclusive lower bound of the window, in microseconds.
     */
    public long startTimestampUs() {
        return anchorTimestampUs + Math.round(extractionOffsetSeconds * MICROS_PER_SECOND);
    }

    /**
     * Exclusive upper bound of the window, in microseconds.
     */
    public long endTimestampUs() {
        return startTimestampUs() + Math.round(durationSeconds * MICROS_PER_SECOND);
    }

    /**
     * Number of records to advance between kept samples. Ties round to even.
     */
    public int stride() {
        long stride = (long) Math.rint(1.0 / subsampleRatio);
        if (stride > Integer.MAX_VALUE) {
            throw new ConfigurationException("Subsample ratio " + subsampleRatio + " is too small");
        }
        return (int) Math.max(1, stride);
    }

    @Override
    public String toString() {
        return "ScenarioWindow{anchor=" + anchorTimestampUs
                + "us, offset=" + extractionOffsetSeconds
                + "s, duration=" + durationSeconds
                + "s, subsample=" + subsampleRatio + '}';
    }
}
