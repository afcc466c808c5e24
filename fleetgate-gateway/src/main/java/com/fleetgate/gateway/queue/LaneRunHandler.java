package com.fleetgate.gateway.queue;

/**
 * Executes a lane dispatch. Called on a runner thread; at most one call per lane at a time.
 */
@FunctionalInterface
public interface LaneRunHandler {

    void runLane(LaneRun run) throws Exception;
}
