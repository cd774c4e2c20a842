package com.flightdeck.core.routing;

import java.time.Instant;

/**
 * Snapshot of the router's counters for the current wall-clock hour.
 */
public record RoutingStats(
    int cloudCallsThisHour,
    int localCallsThisHour,
    long cloudTokensUsed,
    long localTokensUsed,
    Instant hourStart
) {}
