package com.nayem.courier.core;

/**
 * Execution policy for fan-out publication.
 */
public enum PublishStrategy {

    /**
     * Start every handler without waiting for the previous one. Start order follows
     * handler order; completion order is unspecified.
     */
    PARALLEL,

    /**
     * Run handlers one at a time in ascending order, each completing before the next starts.
     */
    SEQUENTIAL,

    /**
     * Hand every handler to the engine's executor and return at once. Failures are logged
     * and counted but never reach the caller, and the caller's cancellation token is not passed on.
     */
    FIRE_AND_FORGET
}
