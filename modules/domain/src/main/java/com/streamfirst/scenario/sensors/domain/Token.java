package com.streamfirst.scenario.sensors.domain;

/**
 * Opaque identifier of one time-stamped record in a driving log.
 *
 * @param value the token as stored in the log (typically a hex string)
 */
public record Token(String value) {
    public Token {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Token cannot be null or empty");
        }
    }

    public static Token of(String value) {
        return new Token(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
