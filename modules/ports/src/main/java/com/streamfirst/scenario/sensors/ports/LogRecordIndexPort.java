package com.streamfirst.scenario.sensors.ports;

import com.streamfirst.scenario.sensors.domain.SensorChannel;
import com.streamfirst.scenario.sensors.domain.SensorRecordRef;
import com.streamfirst.scenario.sensors.domain.TimedToken;
import com.streamfirst.scenario.sensors.domain.Token;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Port for read-only queries against one driving log.
 * Abstracts the log record store (SQLite log files, a log database service, etc.) behind
 * the minimal surface needed to extract scenarios and locate sensor payloads.
 */
public interface LogRecordIndexPort {

    /**
     * Lists the records whose timestamp falls in {@code [startUs, endUs)}.
     *
     * @param startUs inclusive lower bound in microseconds
     * @param endUs exclusive upper bound in microseconds
     * @return tokens ordered by ascending timestamp, empty if none match
     */
    List<TimedToken> listTokensInRange(long startUs, long endUs);

    /**
     * Resolves the payload refs recorded for a token on the requested channels.
     * Channels without a recording at that token are simply absent from the result.
     *
     * @param token the record token
     * @param channels the channels to resolve
     * @return at most one ref per requested channel
     */
    List<SensorRecordRef> resolveRefs(Token token, Collection<? extends SensorChannel> channels);

    /**
     * Looks up the timestamp of a single token.
     *
     * @param token the record token
     * @return the timed token, empty if the log has no such record
     */
    Optional<TimedToken> findToken(Token token);
}
