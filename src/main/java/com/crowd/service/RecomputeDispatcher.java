package com.crowd.service;

import java.time.Duration;

/**
 * Queue of cell groups waiting for a density recompute
 */
public interface RecomputeDispatcher {
    
    /**
     * Schedule a recompute of the group holding the cell; returns immediately
     */
    void enqueue(String cell);
    
    /**
     * Number of groups waiting to be picked up by a worker
     */
    int pending();
    
    /**
     * Wait until no group is queued or being recomputed
     *
     * @return true if the dispatcher became idle within the timeout
     */
    boolean awaitIdle(Duration timeout) throws InterruptedException;
}
