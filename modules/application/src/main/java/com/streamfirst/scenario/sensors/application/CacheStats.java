package com.streamfirst.scenario.sensors.application;

/**
 * Point-in-time counters of a {@link TieredBlobCache}.
 *
 * @param localHits lookups answered by the local tier
 * @param remoteFetches requests sent to the remote tier
 * @param remoteMisses remote requests that found no object
 * @param joinedFlights lookups that waited on another caller's in-flight fetch
 */
public record CacheStats(long localHits, long remoteFetches, long remoteMisses, long joinedFlights) {
}
