package com.streamfirst.scenario.sensors.domain;

import java.util.Objects;

/**
 * A token paired with the instant it was recorded at.
 *
 * @param token the record token
 * @param timestampUs recording time in microseconds since the epoch
 */
public record TimedToken(Token token, long timestampUs) {
    public TimedToken {
        Objects.requireNonNull(token, "Token cannot be null");
    }

    public static TimedToken of(String token, long timestampUs) {
        return new TimedToken(Token.of(token), timestampUs);
    }
}
