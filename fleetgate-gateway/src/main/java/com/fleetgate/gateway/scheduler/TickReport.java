package com.fleetgate.gateway.scheduler;

/**
 * Counters of one scheduler tick. {@code overlapped} ticks did nothing because a
 * previous tick was still running.
 */
public record TickReport(int recovered, int due, int fired, int skipped, int failed, boolean overlapped) {

    static TickReport overlapping() {
        return new TickReport(0, 0, 0, 0, 0, true);
    }
}
