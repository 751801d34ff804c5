package com.streamfirst.scenario.sensors.application;

import com.streamfirst.scenario.sensors.domain.ScenarioSelection;
import com.streamfirst.scenario.sensors.domain.ScenarioWindow;
import com.streamfirst.scenario.sensors.domain.TimedToken;
import com.streamfirst.scenario.sensors.domain.Token;
import com.streamfirst.scenario.sensors.domain.TokenSequence;
import com.streamfirst.scenario.sensors.domain.exception.ConfigurationException;
import com.streamfirst.scenario.sensors.domain.exception.RecordLookupException;
import com.streamfirst.scenario.sensors.ports.LogRecordIndexPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns a scenario window into the ordered tokens of the records it covers.
 *
 * <p>The window spans {@code [anchor + offset, anchor + offset + duration)} and keeps every
 * {@code stride}-th record of that range, starting with the first one. In single-instant mode
 * the sequence holds only the scenario's initial token.
 */
@Slf4j
@RequiredArgsConstructor
public class TokenExtractor {

    private final LogRecordIndexPort logRecordIndex;

    /**
     * Extracts the tokens selected by a scenario: the window when present, otherwise the
     * initial token alone.
     */
    public TokenSequence extract(ScenarioSelection selection) {
        return selection.window()
                .map(this::extract)
                .orElseGet(() -> extract(selection.initialToken()));
    }

    /**
     * Extracts the stride-selected records of a window.
     *
     * @param window a validated window
     * @return tokens with strictly increasing timestamps, possibly empty
     * @throws ConfigurationException if no window is given
     */
    public TokenSequence extract(ScenarioWindow window) {
        if (window == null) {
            throw new ConfigurationException("A scenario window is required for window extraction");
        }
        long startUs = window.startTimestampUs();
        long endUs = window.endTimestampUs();
        int stride = window.stride();

        List<TimedToken> inRange = ordered(logRecordIndex.listTokensInRange(startUs, endUs));
        List<TimedToken> selected = new ArrayList<>((inRange.size() + stride - 1) / stride);
        for (int i = 0; i < inRange.size(); i += stride) {
            selected.add(inRange.get(i));
        }

        log.debug("Extracted {} of {} records in [{}, {}) with stride {}",
                selected.size(), inRange.size(), startUs, endUs, stride);
        return TokenSequence.of(selected);
    }

    /**
     * Single-instant extraction: the one-element sequence of the given token.
     *
     * @throws RecordLookupException if the log has no record for the token
     */
    public TokenSequence extract(Token initialToken) {
        TimedToken token = logRecordIndex.findToken(initialToken)
                .orElseThrow(() -> new RecordLookupException("Token " + initialToken + " has no record in the log"));
        return TokenSequence.single(token);
    }

    /**
     * The index contract promises ascending order; tolerate indexes that do not keep it by
     * sorting and dropping repeated timestamps.
     */
    private static List<TimedToken> ordered(List<TimedToken> tokens) {
        boolean strictlyIncreasing = true;
        for (int i = 1; i < tokens.size() && strictlyIncreasing; i++) {
            strictlyIncreasing = tokens.get(i).timestampUs() > tokens.get(i - 1).timestampUs();
        }
        if (strictlyIncreasing) {
            return tokens;
        }

        log.warn("Log index returned {} records out of timestamp order, sorting them", tokens.size());
        List<TimedToken> sorted = new ArrayList<>(tokens);
        sorted.sort(Comparator.comparingLong(TimedToken::timestampUs));
        List<TimedToken> unique = new ArrayList<>(sorted.size());
        for (TimedToken token : sorted) {
            if (unique.isEmpty() || unique.get(unique.size() - 1).timestampUs() < token.timestampUs()) {
                unique.add(token);
            }
        }
        return unique;
    }
}
