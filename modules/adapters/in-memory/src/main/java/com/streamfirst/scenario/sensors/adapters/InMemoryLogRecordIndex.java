package com.streamfirst.scenario.sensors.adapters;

import com.streamfirst.scenario.sensors.domain.BlobKey;
import com.streamfirst.scenario.sensors.domain.LogReference;
import com.streamfirst.scenario.sensors.domain.SensorChannel;
import com.streamfirst.scenario.sensors.domain.SensorRecordRef;
import com.streamfirst.scenario.sensors.domain.TimedToken;
import com.streamfirst.scenario.sensors.domain.Token;
import com.streamfirst.scenario.sensors.ports.LogRecordIndexPort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of LogRecordIndexPort for testing and development.
 * Holds the records of a single log; populated through {@link #addRecord} and {@link #addRef}.
 */
@Slf4j
public class InMemoryLogRecordIndex implements LogRecordIndexPort {

    @Getter
    private final LogReference logReference;

    // Timestamp -> token, kept sorted for range scans
    private final ConcurrentSkipListMap<Long, Token> recordsByTime = new ConcurrentSkipListMap<>();

    private final Map<Token, Long> timestamps = new ConcurrentHashMap<>();

    // Token -> channel -> ref
    private final Map<Token, Map<SensorChannel, SensorRecordRef>> refs = new ConcurrentHashMap<>();

    public InMemoryLogRecordIndex(LogReference logReference) {
        this.logReference = logReference;
    }

    /**
     * Registers a record instant. Timestamps are unique within a log.
     */
    public TimedToken addRecord(String token, long timestampUs) {
        Token id = Token.of(token);
        Token previous = recordsByTime.putIfAbsent(timestampUs, id);
        if (previous != null && !previous.equals(id)) {
            throw new IllegalArgumentException("Timestamp " + timestampUs + " already recorded for token " + previous);
        }
        timestamps.put(id, timestampUs);
        log.debug("Registered record {} at {}us in log {}", id, timestampUs, logReference);
        return new TimedToken(id, timestampUs);
    }

    /**
     * Registers the payload of one channel at an already registered record.
     */
    public SensorRecordRef addRef(String token, SensorChannel channel, String blobKey) {
        Token id = Token.of(token);
        Long timestampUs = timestamps.get(id);
        if (timestampUs == null) {
            throw new IllegalArgumentException("Unknown token " + token + ", register the record first");
        }
        SensorRecordRef ref = new SensorRecordRef(id, timestampUs, channel, BlobKey.of(blobKey));
        refs.computeIfAbsent(id, k -> new ConcurrentHashMap<>()).put(channel, ref);
        log.debug("Registered {} ref {} for record {}", channel, blobKey, id);
        return ref;
    }

    @Override
    public List<TimedToken> listTokensInRange(long startUs, long endUs) {
        if (endUs <= startUs) {
            return List.of();
        }
        List<TimedToken> tokens = new ArrayList<>();
        recordsByTime.subMap(startUs, true, endUs, false)
                .forEach((ts, token) -> tokens.add(new TimedToken(token, ts)));
        log.debug("Found {} records in [{}, {}) of log {}", tokens.size(), startUs, endUs, logReference);
        return tokens;
    }

    @Override
    public List<SensorRecordRef> resolveRefs(Token token, Collection<? extends SensorChannel> channels) {
        Map<SensorChannel, SensorRecordRef> recorded = refs.getOrDefault(token, Map.of());
        List<SensorRecordRef> resolved = new ArrayList<>();
        for (SensorChannel channel : channels) {
            SensorRecordRef ref = recorded.get(channel);
            if (ref != null) {
                resolved.add(ref);
            }
        }
        log.debug("Resolved {} of {} requested channels for record {}", resolved.size(), channels.size(), token);
        return resolved;
    }

    @Override
    public Optional<TimedToken> findToken(Token token) {
        return Optional.ofNullable(timestamps.get(token)).map(ts -> new TimedToken(token, ts));
    }

    /**
     * Gets the number of registered records.
     */
    public int getRecordCount() {
        return recordsByTime.size();
    }
}
