package com.streamfirst.scenario.sensors.domain;

import com.streamfirst.scenario.sensors.domain.exception.RecordLookupException;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, timestamp-ordered tokens covering one scenario.
 */
public final class TokenSequence implements Iterable<TimedToken> {

    private final List<TimedToken> tokens;

    private TokenSequence(List<TimedToken> tokens) {
        for (int i = 1; i < tokens.size(); i++) {
            if (tokens.get(i).timestampUs() <= tokens.get(i - 1).timestampUs()) {
                throw new IllegalArgumentException("Token timestamps must be strictly increasing at index "
                        + i + ": " + tokens.get(i - 1) + " then " + tokens.get(i));
            }
        }
        this.tokens = tokens;
    }

    public static TokenSequence of(List<TimedToken> tokens) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        return new TokenSequence(List.copyOf(tokens));
    }

    public static TokenSequence single(TimedToken token) {
        return new TokenSequence(List.of(token));
    }

    /**
     * Gets the token for a scenario iteration.
     *
     * @throws RecordLookupException if the iteration is outside the sequence
     */
    public TimedToken get(int iteration) {
        if (iteration < 0 || iteration >= tokens.size()) {
            throw new RecordLookupException("Iteration " + iteration + " is out of range, scenario has "
                    + tokens.size() + " iterations");
        }
        return tokens.get(iteration);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public List<TimedToken> tokens() {
        return tokens;
    }

    @Override
    public Iterator<TimedToken> iterator() {
        return tokens.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TokenSequence other && tokens.equals(other.tokens);
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public String toString() {
        return "TokenSequence{size=" + tokens.size() + '}';
    }
}
